package com.protocolguide.saas.infrastructure.subscription;

import com.protocolguide.application.ports.SubscriptionStore;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.domain.model.SubscriptionRecord;
import com.protocolguide.saas.domain.model.SubscriptionStatus;
import com.protocolguide.saas.domain.model.Tier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Adapter: account_subscriptions rows to {@link SubscriptionRecord}.
 *
 * Fail-closed read policy:
 * - unknown tier value -> FREE
 * - unknown status value -> NONE
 */
@Component
public class JpaSubscriptionStore implements SubscriptionStore {

    private final AccountSubscriptionRepository subscriptions;
    private final GuardedCall database;

    public JpaSubscriptionStore(AccountSubscriptionRepository subscriptions,
                                @Qualifier("databaseGuard") GuardedCall database) {
        this.subscriptions = subscriptions;
        this.database = database;
    }

    @Override
    public Optional<SubscriptionRecord> findByAccountId(UUID accountId) {
        return database.call(() -> subscriptions.findById(accountId).map(JpaSubscriptionStore::toModel));
    }

    @Override
    public Optional<SubscriptionRecord> findByBillingCustomerId(String billingCustomerId) {
        if (billingCustomerId == null || billingCustomerId.isBlank()) return Optional.empty();
        return database.call(() -> subscriptions.findFirstByBillingCustomerIdOrderByUpdatedAtDesc(billingCustomerId)
                .map(JpaSubscriptionStore::toModel));
    }

    @Override
    public SubscriptionRecord save(SubscriptionRecord record) {
        return database.call(() -> {
            AccountSubscriptionEntity e = subscriptions.findById(record.accountId())
                    .orElseGet(() -> new AccountSubscriptionEntity(record.accountId()));
            e.setBillingCustomerId(record.billingCustomerId());
            e.setBillingSubscriptionId(record.billingSubscriptionId());
            e.setStatus(record.status().wireValue());
            e.setTier(record.tier().wireValue());
            e.setPeriodEnd(record.periodEnd());
            e.setUpdatedAt(record.updatedAt());
            return toModel(subscriptions.save(e));
        });
    }

    static SubscriptionRecord toModel(AccountSubscriptionEntity e) {
        return new SubscriptionRecord(
                e.getAccountId(),
                e.getBillingCustomerId(),
                e.getBillingSubscriptionId(),
                SubscriptionStatus.fromProvider(e.getStatus()).orElse(SubscriptionStatus.NONE),
                Tier.parse(e.getTier()),
                e.getPeriodEnd(),
                e.getUpdatedAt()
        );
    }
}
