package com.protocolguide.api.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Webhook outcome counters:
 * - guide.billing.webhook.received / duplicates / rejected / failed
 */
@Component
public class BillingMetrics {

  private final Counter received;
  private final Counter duplicates;
  private final Counter rejected;
  private final Counter failed;

  public BillingMetrics(MeterRegistry registry) {
    this.received = Counter.builder("guide.billing.webhook.received")
        .description("Webhook events dispatched to subscription sync")
        .register(registry);
    this.duplicates = Counter.builder("guide.billing.webhook.duplicates")
        .description("Webhook events skipped as already processed")
        .register(registry);
    this.rejected = Counter.builder("guide.billing.webhook.rejected")
        .description("Webhook deliveries that failed authentication")
        .register(registry);
    this.failed = Counter.builder("guide.billing.webhook.failed")
        .description("Webhook events whose processing failed")
        .register(registry);
  }

  public void incReceived() {
    received.increment();
  }

  public void incDuplicate() {
    duplicates.increment();
  }

  public void incRejected() {
    rejected.increment();
  }

  public void incFailed() {
    failed.increment();
  }
}
