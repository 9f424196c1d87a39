package com.protocolguide.application.billing;

import com.protocolguide.application.ports.DuplicateEventException;
import com.protocolguide.application.ports.ProcessedEventLedger;
import com.protocolguide.application.ports.ReviewQueue;
import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.saas.domain.model.ProcessedEvent;
import com.protocolguide.saas.domain.model.ReviewFlag;
import com.protocolguide.saas.domain.model.SubscriptionRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Map-backed stand-ins for the persistence ports. The ledger's putIfAbsent plays the unique constraint.
 */
final class InMemoryBillingStores {

    private InMemoryBillingStores() {}

    static final class Ledger implements ProcessedEventLedger {
        final Map<String, ProcessedEvent> rows = new ConcurrentHashMap<>();

        @Override
        public Optional<ProcessedEvent> find(String eventId) {
            return Optional.ofNullable(rows.get(eventId));
        }

        @Override
        public void record(ProcessedEvent event) {
            if (rows.putIfAbsent(event.eventId(), event) != null) {
                throw new DuplicateEventException(event.eventId(), null);
            }
        }
    }

    static final class Subscriptions implements SubscriptionStore {
        final Map<UUID, SubscriptionRecord> rows = new ConcurrentHashMap<>();
        final AtomicInteger saves = new AtomicInteger();

        @Override
        public Optional<SubscriptionRecord> findByAccountId(UUID accountId) {
            return Optional.ofNullable(rows.get(accountId));
        }

        @Override
        public Optional<SubscriptionRecord> findByBillingCustomerId(String billingCustomerId) {
            return rows.values().stream()
                    .filter(r -> billingCustomerId.equals(r.billingCustomerId()))
                    .findFirst();
        }

        @Override
        public SubscriptionRecord save(SubscriptionRecord record) {
            saves.incrementAndGet();
            rows.put(record.accountId(), record);
            return record;
        }

        SubscriptionRecord get(UUID accountId) {
            return rows.get(accountId);
        }
    }

    static final class Reviews implements ReviewQueue {
        final List<ReviewFlag> flags = new CopyOnWriteArrayList<>();

        @Override
        public void flag(ReviewFlag flag) {
            flags.add(flag);
        }
    }
}
