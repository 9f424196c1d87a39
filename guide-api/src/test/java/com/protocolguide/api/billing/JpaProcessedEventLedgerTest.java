package com.protocolguide.api.billing;

import com.protocolguide.application.ports.DuplicateEventException;
import com.protocolguide.application.ports.ProcessedEventLedger;
import com.protocolguide.saas.domain.model.ProcessedEvent;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ledger against the migrated schema: only the event_id constraint reads as a duplicate.
 */
@SpringBootTest
@ActiveProfiles("test")
class JpaProcessedEventLedgerTest {

  @Autowired ProcessedEventLedger ledger;

  private static String newId() {
    return "evt_" + UUID.randomUUID().toString().replace("-", "");
  }

  @Test
  void secondRecordOfSameIdIsDuplicate() {
    String id = newId();
    ledger.record(new ProcessedEvent(id, "customer.deleted", Instant.now(), "{}"));

    assertThatThrownBy(() -> ledger.record(new ProcessedEvent(id, "customer.deleted", Instant.now(), "{}")))
        .isInstanceOf(DuplicateEventException.class)
        .satisfies(e -> assertThat(((DuplicateEventException) e).eventId()).isEqualTo(id));
    assertThat(ledger.find(id)).isPresent();
  }

  @Test
  void overLengthTypeIsNotMistakenForDuplicate() {
    String id = newId();

    assertThatThrownBy(() -> ledger.record(new ProcessedEvent(id, "x".repeat(200), Instant.now(), "{}")))
        .isInstanceOf(DataIntegrityViolationException.class)
        .isNotInstanceOf(DuplicateEventException.class);
    assertThat(ledger.find(id)).isEmpty();
  }
}
