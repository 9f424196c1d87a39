package com.protocolguide.saas.infrastructure.events;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "processed_events",
    uniqueConstraints = @UniqueConstraint(name = ProcessedEventEntity.EVENT_ID_CONSTRAINT, columnNames = "event_id"),
    indexes = @Index(name = "ix_processed_events_processed_at", columnList = "processed_at")
)
public class ProcessedEventEntity {

  public static final String EVENT_ID_CONSTRAINT = "uk_processed_events_event_id";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "event_id", nullable = false, length = 255)
  private String eventId;

  @Column(name = "event_type", nullable = false, length = 128)
  private String eventType;

  @Column(name = "processed_at", nullable = false)
  private Instant processedAt;

  // TEXT, not @Lob: PostgreSQL would map a @Lob String to an OID.
  @Column(name = "payload_json", columnDefinition = "text")
  private String payloadJson;

  protected ProcessedEventEntity() {}

  public ProcessedEventEntity(UUID id, String eventId, String eventType, Instant processedAt, String payloadJson) {
    this.id = id;
    this.eventId = eventId;
    this.eventType = eventType;
    this.processedAt = processedAt;
    this.payloadJson = payloadJson;
  }

  public UUID getId() { return id; }
  public String getEventId() { return eventId; }
  public String getEventType() { return eventType; }
  public Instant getProcessedAt() { return processedAt; }
  public String getPayloadJson() { return payloadJson; }
}
