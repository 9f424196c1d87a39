package com.protocolguide.application.resilience;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Directory of the per-dependency breakers with an aggregated health view.
 *
 * Overall health:
 * - UNHEALTHY: two or more services unavailable, or any critical service unavailable
 * - DEGRADED: one service unavailable, or two or more available-but-degraded services
 * - HEALTHY: otherwise
 */
public final class ServiceRegistry {

    public enum OverallHealth {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    private final Map<String, GuardedCall> guards;
    private final Set<String> critical;

    public ServiceRegistry(Collection<GuardedCall> guards, Set<String> critical) {
        Map<String, GuardedCall> byName = new LinkedHashMap<>();
        for (GuardedCall g : guards) {
            if (byName.putIfAbsent(g.name(), g) != null) {
                throw new IllegalArgumentException("Duplicate circuit breaker: " + g.name());
            }
        }
        this.guards = Collections.unmodifiableMap(byName);
        this.critical = Set.copyOf(critical);
    }

    public Set<String> names() {
        return guards.keySet();
    }

    public GuardedCall guard(String name) {
        GuardedCall g = guards.get(name);
        if (g == null) {
            throw new IllegalArgumentException("Unknown service: " + name);
        }
        return g;
    }

    public <T> T call(String service, Supplier<T> operation, Supplier<T> fallback) {
        return guard(service).call(operation, fallback);
    }

    public <T> CompletableFuture<T> execute(
            String service,
            Supplier<? extends CompletionStage<T>> operation,
            Supplier<? extends CompletionStage<T>> fallback
    ) {
        return guard(service).execute(operation, fallback);
    }

    public boolean isAvailable(String service) {
        return guard(service).tracker().canAttempt();
    }

    public ServiceStatus status(String service) {
        return ServiceStatus.of(guard(service).tracker().getStats());
    }

    public Map<String, ServiceStatus> statuses() {
        Map<String, ServiceStatus> out = new LinkedHashMap<>();
        for (String name : guards.keySet()) {
            out.put(name, status(name));
        }
        return out;
    }

    public OverallHealth overallHealth() {
        return overallHealth(statuses());
    }

    public OverallHealth overallHealth(Map<String, ServiceStatus> statuses) {
        long unavailable = statuses.values().stream().filter(s -> !s.available()).count();
        long degraded = statuses.values().stream().filter(s -> s.available() && s.degraded()).count();
        boolean criticalDown = statuses.values().stream()
                .anyMatch(s -> !s.available() && critical.contains(s.name()));

        if (unavailable >= 2 || criticalDown) return OverallHealth.UNHEALTHY;
        if (unavailable > 0 || degraded >= 2) return OverallHealth.DEGRADED;
        return OverallHealth.HEALTHY;
    }

    public void resetAll() {
        guards.values().forEach(g -> g.tracker().reset());
    }
}
