package com.protocolguide.saas.infrastructure.review;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BillingReviewFlagRepository extends JpaRepository<BillingReviewFlagEntity, UUID> {

    List<BillingReviewFlagEntity> findByDisputeIdOrderByCreatedAtAsc(String disputeId);
}
