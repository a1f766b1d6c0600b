package com.dcaswap.execution.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Execution service endpoint and gas sponsorship settings passed with every ability call.
 */
@ConfigurationProperties(prefix = "dca.execution")
@Getter
@Setter
public class ExecutionProperties {

    private String executorUrl = "http://localhost:8083";

    /** When true, operations are submitted as sponsored user operations and confirmed through the bundler. */
    private boolean gasSponsor;

    private String gasSponsorApiKey;

    private String gasSponsorPolicyId;

    /** Timeout in seconds for one precheck or execute call. */
    private int requestTimeoutSeconds = 60;
}
