package com.protocolguide.api.config;

import com.protocolguide.application.resilience.CircuitBreakerConfig;
import com.protocolguide.application.resilience.Dependencies;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Per-dependency breaker tuning under guide.resilience.breakers.&lt;name&gt;.
 * Missing values fall back to {@link CircuitBreakerConfig#defaultsFor(String)}.
 */
@ConfigurationProperties(prefix = "guide.resilience")
public record ResilienceProperties(

    Map<String, Breaker> breakers,

    @DefaultValue(Dependencies.DATABASE) Set<String> critical

) {

    public record Breaker(
        Integer failureThreshold,
        Integer successThreshold,
        Duration resetTimeout,
        Duration failureWindow
    ) {}

    public CircuitBreakerConfig configFor(String name) {
        CircuitBreakerConfig d = CircuitBreakerConfig.defaultsFor(name);
        Breaker b = breakers == null ? null : breakers.get(name);
        if (b == null) return d;
        return new CircuitBreakerConfig(
            name,
            b.failureThreshold() != null ? b.failureThreshold() : d.failureThreshold(),
            b.successThreshold() != null ? b.successThreshold() : d.successThreshold(),
            b.resetTimeout() != null ? b.resetTimeout().toMillis() : d.resetTimeoutMs(),
            b.failureWindow() != null ? b.failureWindow().toMillis() : d.failureWindowMs()
        );
    }
}
