package com.protocolguide.api.admin;

import com.protocolguide.api.health.ServiceStatusView;
import com.protocolguide.application.resilience.CircuitState;
import com.protocolguide.application.resilience.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;

/**
 * Operator view and overrides for the breakers. Forced states are in-memory and last until
 * the next transition or restart.
 */
@RestController
@RequestMapping("/api/v1/admin/circuits")
public class AdminCircuitController {

  private static final Logger log = LoggerFactory.getLogger(AdminCircuitController.class);

  private final ServiceRegistry services;

  public AdminCircuitController(ServiceRegistry services) {
    this.services = services;
  }

  @GetMapping
  public Map<String, Object> list() {
    return ServiceStatusView.of(services);
  }

  @PostMapping("/{name}/reset")
  public Map<String, Object> reset(@AuthenticationPrincipal Jwt jwt, @PathVariable String name) {
    var guard = services.guard(name);
    log.warn("Admin {} reset circuit {}", subject(jwt), name);
    guard.tracker().reset();
    return ServiceStatusView.of(services.status(name));
  }

  @PostMapping("/{name}/force")
  public Map<String, Object> force(@AuthenticationPrincipal Jwt jwt, @PathVariable String name,
                                   @RequestParam("state") String state) {
    var guard = services.guard(name);
    CircuitState target;
    try {
      target = CircuitState.valueOf(state.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown circuit state: " + state);
    }
    log.warn("Admin {} forced circuit {} to {}", subject(jwt), name, target);
    guard.tracker().forceState(target);
    return ServiceStatusView.of(services.status(name));
  }

  private static String subject(Jwt jwt) {
    return jwt == null ? "unknown" : jwt.getSubject();
  }
}
