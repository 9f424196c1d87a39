package com.protocolguide.api.config;

import com.protocolguide.api.metrics.CircuitMetrics;
import com.protocolguide.application.ports.BillingGatewayException;
import com.protocolguide.application.resilience.CircuitTransitionListener;
import com.protocolguide.application.resilience.Dependencies;
import com.protocolguide.application.resilience.FailureTracker;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.application.resilience.LoggingCircuitTransitionListener;
import com.protocolguide.application.resilience.ServiceRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.util.List;

/**
 * One breaker per external dependency, built from guide.resilience.*.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Primary: {@link CircuitMetrics} is itself a listener bean.
     */
    @Bean
    @Primary
    public CircuitTransitionListener circuitTransitionListener(CircuitMetrics metrics) {
        return CircuitTransitionListener.composite(List.of(new LoggingCircuitTransitionListener(), metrics));
    }

    /**
     * Constraint violations are answers from a healthy store (duplicate event id), not outages.
     */
    @Bean
    public GuardedCall databaseGuard(ResilienceProperties props, Clock clock, CircuitTransitionListener listener) {
        return new GuardedCall(tracker(Dependencies.DATABASE, props, clock, listener),
                t -> !(t instanceof DataIntegrityViolationException));
    }

    @Bean
    public GuardedCall aiGuard(ResilienceProperties props, Clock clock, CircuitTransitionListener listener) {
        return new GuardedCall(tracker(Dependencies.AI, props, clock, listener));
    }

    /**
     * Only transport errors, 5xx and 429 count; a 4xx is our request's fault.
     */
    @Bean
    public GuardedCall billingGuard(ResilienceProperties props, Clock clock, CircuitTransitionListener listener) {
        return new GuardedCall(tracker(Dependencies.BILLING, props, clock, listener), ResilienceConfig::isBillingOutage);
    }

    @Bean
    public ServiceRegistry serviceRegistry(List<GuardedCall> guards, ResilienceProperties props, CircuitMetrics metrics) {
        ServiceRegistry registry = new ServiceRegistry(guards, props.critical());
        metrics.bindGauges(registry);
        return registry;
    }

    static boolean isBillingOutage(Throwable t) {
        if (t instanceof BillingGatewayException e) {
            int code = e.statusCode();
            return code < 0 || code >= 500 || code == 429;
        }
        return !(t instanceof IllegalArgumentException || t instanceof IllegalStateException);
    }

    private static FailureTracker tracker(String name, ResilienceProperties props, Clock clock,
                                          CircuitTransitionListener listener) {
        return new FailureTracker(props.configFor(name), clock, listener);
    }
}
