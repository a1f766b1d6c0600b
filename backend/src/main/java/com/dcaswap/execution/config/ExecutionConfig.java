package com.dcaswap.execution.config;

import com.dcaswap.execution.ability.SwapAbilityClient;
import com.dcaswap.execution.ability.WebClientSwapAbilityClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({ExecutionProperties.class, ConfirmationProperties.class})
public class ExecutionConfig {

    @Bean
    public SwapAbilityClient swapAbilityClient(WebClient.Builder webClientBuilder, ExecutionProperties properties) {
        return new WebClientSwapAbilityClient(webClientBuilder, properties.getExecutorUrl(),
                Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }
}
