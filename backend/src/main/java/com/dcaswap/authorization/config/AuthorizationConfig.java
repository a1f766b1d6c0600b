package com.dcaswap.authorization.config;

import com.dcaswap.authorization.PermittedVersionClient;
import com.dcaswap.authorization.WebClientPermittedVersionClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(AuthorizationProperties.class)
public class AuthorizationConfig {

    @Bean
    public PermittedVersionClient permittedVersionClient(WebClient.Builder webClientBuilder,
                                                         AuthorizationProperties properties) {
        return new WebClientPermittedVersionClient(webClientBuilder, properties.getServiceUrl(),
                Duration.ofSeconds(properties.getReadTimeoutSeconds()));
    }
}
