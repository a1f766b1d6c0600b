package com.dcaswap.authorization.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Authorization service endpoint and the id of the app schedules run under.
 */
@ConfigurationProperties(prefix = "dca.authorization")
@Getter
@Setter
public class AuthorizationProperties {

    private String serviceUrl = "http://localhost:8082";

    /** App id every schedule is permitted against. */
    private long appId;

    private int readTimeoutSeconds = 10;
}
