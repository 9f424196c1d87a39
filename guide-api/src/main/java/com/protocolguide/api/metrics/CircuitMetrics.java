package com.protocolguide.api.metrics;

import com.protocolguide.application.resilience.CircuitState;
import com.protocolguide.application.resilience.CircuitTransition;
import com.protocolguide.application.resilience.CircuitTransitionListener;
import com.protocolguide.application.resilience.ServiceRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Breaker metrics.
 *
 * Exposes:
 * - guide.circuit.state (gauge per circuit: 0 closed, 1 half-open, 2 open)
 * - guide.circuit.window_failures (gauge per circuit)
 * - guide.circuit.transitions (counter per circuit / target state / cause)
 * - guide.service.health (gauge: 0 healthy, 1 degraded, 2 unhealthy)
 */
@Component
public class CircuitMetrics implements CircuitTransitionListener {

  private final MeterRegistry registry;

  public CircuitMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void onTransition(CircuitTransition t) {
    Counter.builder("guide.circuit.transitions")
        .description("Circuit breaker state transitions")
        .tag("circuit", t.circuit())
        .tag("to", t.to().name())
        .tag("cause", t.cause().name())
        .register(registry)
        .increment();
  }

  public void bindGauges(ServiceRegistry services) {
    for (String name : services.names()) {
      var tracker = services.guard(name).tracker();
      Gauge.builder("guide.circuit.state", tracker, tr -> stateValue(tr.getState()))
          .description("Circuit state (0 closed, 1 half-open, 2 open)")
          .tag("circuit", name)
          .register(registry);
      Gauge.builder("guide.circuit.window_failures", tracker, tr -> tr.getStats().failures())
          .description("Failures inside the current window")
          .tag("circuit", name)
          .register(registry);
    }
    registry.gauge("guide.service.health", services, s -> s.overallHealth().ordinal());
  }

  static double stateValue(CircuitState state) {
    return switch (state) {
      case CLOSED -> 0;
      case HALF_OPEN -> 1;
      case OPEN -> 2;
    };
  }
}
