package com.protocolguide.api.health;

import com.protocolguide.application.resilience.ServiceRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

    private final ServiceRegistry services;

    public HealthController(ServiceRegistry services) {
        this.services = services;
    }

    @GetMapping("/api/v1/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "protocol-guide-api",
                "health", services.overallHealth().name(),
                "ts", Instant.now().toString()
        );
    }

    @GetMapping("/api/v1/health/services")
    public Map<String, Object> services() {
        return ServiceStatusView.of(services);
    }
}
