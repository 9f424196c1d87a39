package com.protocolguide.api.health;

import com.protocolguide.application.resilience.CircuitStats;
import com.protocolguide.application.resilience.ServiceRegistry;
import com.protocolguide.application.resilience.ServiceStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON shapes for breaker status. LinkedHashMap because timestamps may be null.
 */
public final class ServiceStatusView {

  private ServiceStatusView() {}

  public static Map<String, Object> of(ServiceRegistry registry) {
    Map<String, ServiceStatus> statuses = registry.statuses();
    Map<String, Object> services = new LinkedHashMap<>();
    statuses.forEach((name, s) -> services.put(name, of(s)));

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("overall", registry.overallHealth(statuses).name());
    out.put("services", services);
    out.put("ts", Instant.now().toString());
    return out;
  }

  public static Map<String, Object> of(ServiceStatus s) {
    CircuitStats st = s.stats();
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("available", s.available());
    m.put("degraded", s.degraded());
    m.put("state", s.state().name());
    m.put("failures", st.failures());
    m.put("successes", st.successes());
    m.put("lastFailureTime", str(st.lastFailureTime()));
    m.put("lastSuccessTime", str(st.lastSuccessTime()));
    m.put("openedAt", str(st.openedAt()));
    m.put("totalRequests", st.totalRequests());
    m.put("totalFailures", st.totalFailures());
    m.put("totalSuccesses", st.totalSuccesses());
    m.put("timesOpened", st.timesOpened());
    return m;
  }

  private static String str(Instant v) {
    return v == null ? null : v.toString();
  }
}
