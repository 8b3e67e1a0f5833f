package com.fairway.revenueservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code fairway.service.*}.
 *
 * @param name        service name used for logs, meters and spans
 * @param environment deployment environment, {@code development} when unset
 * @param description human-readable description for the info endpoint
 */
@ConfigurationProperties(prefix = "fairway.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
