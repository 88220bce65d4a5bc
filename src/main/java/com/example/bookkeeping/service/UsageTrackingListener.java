package com.example.bookkeeping.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Updates usage counters after imports, off the importing thread. A failure here is logged and
 * dropped; usage counts are not financial data.
 */
@Component
public class UsageTrackingListener {

  private static final Logger log = LoggerFactory.getLogger(UsageTrackingListener.class);

  private final UsageTrackingSink usageTrackingSink;

  public UsageTrackingListener(UsageTrackingSink usageTrackingSink) {
    this.usageTrackingSink = usageTrackingSink;
  }

  @Async("usageTrackingExecutor")
  @EventListener
  public void onTransactionsImported(TransactionsImportedEvent event) {
    try {
      usageTrackingSink.incrementTransactionCount(event.businessId(), event.count());
    } catch (RuntimeException e) {
      log.warn(
          "Failed to record usage of {} transactions for business {}: {}",
          event.count(),
          event.businessId(),
          e.getMessage());
    }
  }
}
