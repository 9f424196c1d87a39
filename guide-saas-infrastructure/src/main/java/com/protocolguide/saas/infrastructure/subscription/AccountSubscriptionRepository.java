package com.protocolguide.saas.infrastructure.subscription;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface AccountSubscriptionRepository extends JpaRepository<AccountSubscriptionEntity, UUID> {

    // The customer id is not unique in the schema (a re-created customer can be re-linked); newest row wins.
    Optional<AccountSubscriptionEntity> findFirstByBillingCustomerIdOrderByUpdatedAtDesc(String billingCustomerId);
}
