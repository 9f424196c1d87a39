package com.protocolguide.api.admin;

import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.saas.domain.model.SubscriptionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/admin/subscriptions")
public class AdminSubscriptionController {

  private static final Logger log = LoggerFactory.getLogger(AdminSubscriptionController.class);

  private final SubscriptionStore subscriptions;
  private final Clock clock;

  public AdminSubscriptionController(SubscriptionStore subscriptions, Clock clock) {
    this.subscriptions = subscriptions;
    this.clock = clock;
  }

  @GetMapping("/{accountId}")
  public Map<String, Object> get(@PathVariable UUID accountId) {
    return subscriptions.findByAccountId(accountId)
        .map(AdminSubscriptionController::view)
        .orElseGet(() -> Map.of("accountId", accountId, "exists", false));
  }

  /**
   * Creates the FREE record for a new account. Idempotent.
   */
  @PostMapping("/{accountId}/provision")
  public Map<String, Object> provision(@AuthenticationPrincipal Jwt jwt, @PathVariable UUID accountId) {
    SubscriptionRecord r = subscriptions.provision(accountId, clock.instant());
    log.info("Admin {} provisioned subscription record for account {}", jwt == null ? "unknown" : jwt.getSubject(),
        accountId);
    return view(r);
  }

  private static Map<String, Object> view(SubscriptionRecord r) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("accountId", r.accountId());
    m.put("exists", true);
    m.put("tier", r.tier().wireValue());
    m.put("status", r.status().wireValue());
    m.put("billingCustomerId", r.billingCustomerId());
    m.put("billingSubscriptionId", r.billingSubscriptionId());
    m.put("periodEnd", str(r.periodEnd()));
    m.put("updatedAt", str(r.updatedAt()));
    return m;
  }

  private static String str(Instant v) {
    return v == null ? null : v.toString();
  }
}
