package com.dcaswap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DcaSwapApplication {

    public static void main(String[] args) {
        SpringApplication.run(DcaSwapApplication.class, args);
    }
}
