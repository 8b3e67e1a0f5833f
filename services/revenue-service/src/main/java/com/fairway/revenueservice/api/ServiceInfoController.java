package com.fairway.revenueservice.api;

import com.fairway.revenue.RevenueFeatures;
import com.fairway.revenueservice.config.ServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Runtime information about the service, including which revenue features are switched on.
 * Build metadata stays on {@code /actuator/info}.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final RevenueFeatures features;
    private final Clock clock;

    public ServiceInfoController(ServiceProperties properties, RevenueFeatures features, Clock clock) {
        this.properties = properties;
        this.features = features;
        this.clock = clock;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("features", features);
        info.put("status", "running");
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
