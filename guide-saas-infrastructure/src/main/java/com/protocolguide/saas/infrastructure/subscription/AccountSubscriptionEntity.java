package com.protocolguide.saas.infrastructure.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "account_subscriptions",
    indexes = {
        @Index(name = "ix_account_subscriptions_customer", columnList = "billing_customer_id"),
        @Index(name = "ix_account_subscriptions_status", columnList = "status")
    }
)
public class AccountSubscriptionEntity {

  @Id
  @Column(name = "account_id", nullable = false)
  private UUID accountId;

  @Column(name = "billing_customer_id", length = 255)
  private String billingCustomerId;

  @Column(name = "billing_subscription_id", length = 255)
  private String billingSubscriptionId;

  @Column(name = "status", nullable = false, length = 30)
  private String status;

  @Column(name = "tier", nullable = false, length = 30)
  private String tier;

  @Column(name = "period_end")
  private Instant periodEnd;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected AccountSubscriptionEntity() {}

  public AccountSubscriptionEntity(UUID accountId) {
    this.accountId = accountId;
  }

  public UUID getAccountId() { return accountId; }
  public String getBillingCustomerId() { return billingCustomerId; }
  public String getBillingSubscriptionId() { return billingSubscriptionId; }
  public String getStatus() { return status; }
  public String getTier() { return tier; }
  public Instant getPeriodEnd() { return periodEnd; }
  public Instant getUpdatedAt() { return updatedAt; }

  public void setBillingCustomerId(String billingCustomerId) { this.billingCustomerId = billingCustomerId; }
  public void setBillingSubscriptionId(String billingSubscriptionId) { this.billingSubscriptionId = billingSubscriptionId; }
  public void setStatus(String status) { this.status = status; }
  public void setTier(String tier) { this.tier = tier; }
  public void setPeriodEnd(Instant periodEnd) { this.periodEnd = periodEnd; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
