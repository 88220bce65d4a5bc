package com.example.bookkeeping.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UsageTrackingListenerTest {

  @Mock private UsageTrackingSink usageTrackingSink;

  private UsageTrackingListener listener;

  @BeforeEach
  void setUp() {
    listener = new UsageTrackingListener(usageTrackingSink);
  }

  @Test
  void onTransactionsImported_forwardsCountToSink() {
    listener.onTransactionsImported(new TransactionsImportedEvent(1L, 10));

    verify(usageTrackingSink).incrementTransactionCount(1L, 10);
  }

  @Test
  void onTransactionsImported_sinkFailure_isNotPropagated() {
    doThrow(new IllegalStateException("database down"))
        .when(usageTrackingSink)
        .incrementTransactionCount(1L, 10);

    assertDoesNotThrow(
        () -> listener.onTransactionsImported(new TransactionsImportedEvent(1L, 10)));
  }
}
