package com.protocolguide.application.billing;

import com.protocolguide.application.ports.DuplicateEventException;
import com.protocolguide.application.ports.ProcessedEventLedger;
import com.protocolguide.saas.domain.model.BillingEvent;
import com.protocolguide.saas.domain.model.ProcessedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Exactly-once-in-effect handling of at-least-once billing deliveries.
 *
 * The ledger row is written before dispatch. Callers that want a failed dispatch to be
 * retried on redelivery run {@link #process(BillingEvent)} inside one store transaction.
 */
public final class BillingEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(BillingEventProcessor.class);

    private final ProcessedEventLedger ledger;
    private final SubscriptionStateSynchronizer synchronizer;
    private final Clock clock;

    public BillingEventProcessor(ProcessedEventLedger ledger, SubscriptionStateSynchronizer synchronizer, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ProcessingOutcome process(BillingEvent event) {
        Objects.requireNonNull(event, "event");

        if (!event.hasId()) {
            log.warn("Billing event of type {} has no id, dispatching without deduplication", event.type());
            return ProcessingOutcome.received(synchronizer.apply(event));
        }

        String eventId = event.id();
        var existing = ledger.find(eventId);
        if (existing.isPresent()) {
            log.info("Billing event {} already processed at {}, skipping", eventId, existing.get().processedAt());
            return ProcessingOutcome.alreadyProcessed();
        }

        try {
            ledger.record(new ProcessedEvent(eventId, event.type(), clock.instant(), event.rawJson()));
        } catch (DuplicateEventException e) {
            log.info("Billing event {} recorded concurrently by another delivery, skipping", eventId);
            return ProcessingOutcome.alreadyProcessed();
        }

        log.info("Processing billing event {} ({})", eventId, event.type());
        return ProcessingOutcome.received(synchronizer.apply(event));
    }
}
