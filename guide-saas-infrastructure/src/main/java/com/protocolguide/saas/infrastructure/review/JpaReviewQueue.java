package com.protocolguide.saas.infrastructure.review;

import com.protocolguide.application.ports.ReviewQueue;
import com.protocolguide.application.resilience.GuardedCall;
import com.protocolguide.saas.domain.model.ReviewFlag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class JpaReviewQueue implements ReviewQueue {

    private final BillingReviewFlagRepository flags;
    private final GuardedCall database;

    public JpaReviewQueue(BillingReviewFlagRepository flags, @Qualifier("databaseGuard") GuardedCall database) {
        this.flags = flags;
        this.database = database;
    }

    @Override
    public void flag(ReviewFlag f) {
        database.run(() -> flags.save(new BillingReviewFlagEntity(
                f.id(),
                f.kind().name(),
                f.disputeId(),
                f.billingCustomerId(),
                f.accountId(),
                f.detail(),
                f.createdAt()
        )));
    }
}
