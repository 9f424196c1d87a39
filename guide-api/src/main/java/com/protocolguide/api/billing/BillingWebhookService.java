package com.protocolguide.api.billing;

import com.protocolguide.api.metrics.BillingMetrics;
import com.protocolguide.application.billing.BillingEventProcessor;
import com.protocolguide.application.billing.ProcessingOutcome;
import com.protocolguide.saas.domain.model.BillingEvent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction boundary around {@link BillingEventProcessor}.
 *
 * - dispatch throws: ledger row and state changes roll back, the provider redelivers
 * - duplicate: rolled back quietly (a failed insert may have poisoned the transaction)
 */
@Service
public class BillingWebhookService {

  private final BillingEventProcessor processor;
  private final TransactionTemplate tx;
  private final BillingMetrics metrics;

  public BillingWebhookService(BillingEventProcessor processor, PlatformTransactionManager txManager,
                               BillingMetrics metrics) {
    this.processor = processor;
    this.tx = new TransactionTemplate(txManager);
    this.metrics = metrics;
  }

  public ProcessingOutcome handle(BillingEvent event) {
    ProcessingOutcome outcome = tx.execute(status -> {
      ProcessingOutcome o = processor.process(event);
      if (o.skipped()) status.setRollbackOnly();
      return o;
    });

    if (outcome.skipped()) metrics.incDuplicate();
    else metrics.incReceived();
    return outcome;
  }
}
