package com.fairway.revenueservice;

import com.fairway.revenueservice.config.RevenueProperties;
import com.fairway.revenueservice.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Fairway revenue service: revenue analytics and tenant governance over REST.
 *
 * <p>Endpoints live under {@code /api/v1/revenue} and {@code /api/v1/tenants}; actuator health,
 * metrics and Prometheus endpoints are exposed under {@code /actuator}.
 */
@SpringBootApplication
@EnableConfigurationProperties({ServiceProperties.class, RevenueProperties.class})
public class RevenueServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(RevenueServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RevenueServiceApplication.class, args);
        log.info("Fairway revenue service started");
    }
}
