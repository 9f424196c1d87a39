package com.protocolguide.saas.infrastructure.review;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "billing_review_flags",
    indexes = {
        @Index(name = "ix_billing_review_flags_created_at", columnList = "created_at"),
        @Index(name = "ix_billing_review_flags_account", columnList = "account_id")
    }
)
public class BillingReviewFlagEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "kind", nullable = false, length = 32)
  private String kind;

  @Column(name = "dispute_id", length = 255)
  private String disputeId;

  @Column(name = "billing_customer_id", length = 255)
  private String billingCustomerId;

  @Column(name = "account_id")
  private UUID accountId;

  @Column(name = "detail", columnDefinition = "text")
  private String detail;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected BillingReviewFlagEntity() {}

  public BillingReviewFlagEntity(UUID id, String kind, String disputeId, String billingCustomerId,
                                 UUID accountId, String detail, Instant createdAt) {
    this.id = id;
    this.kind = kind;
    this.disputeId = disputeId;
    this.billingCustomerId = billingCustomerId;
    this.accountId = accountId;
    this.detail = detail;
    this.createdAt = createdAt;
  }

  public UUID getId() { return id; }
  public String getKind() { return kind; }
  public String getDisputeId() { return disputeId; }
  public String getBillingCustomerId() { return billingCustomerId; }
  public UUID getAccountId() { return accountId; }
  public String getDetail() { return detail; }
  public Instant getCreatedAt() { return createdAt; }
}
