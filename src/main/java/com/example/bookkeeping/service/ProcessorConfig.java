package com.example.bookkeeping.service;

import java.time.Duration;

/**
 * Tuning for a batch import.
 *
 * @param batchSize transactions per chunk
 * @param transactionTimeout upper bound for one chunk's database transaction
 * @param maxRetries total persistence attempts per chunk, including the first
 * @param baseBackoff wait before the second attempt; doubles for each further attempt
 */
public record ProcessorConfig(
    int batchSize, Duration transactionTimeout, int maxRetries, Duration baseBackoff) {

  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final Duration DEFAULT_TRANSACTION_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(2);

  public ProcessorConfig {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be at least 1");
    }
    if (maxRetries < 1) {
      throw new IllegalArgumentException("Max retries must be at least 1");
    }
    if (transactionTimeout == null
        || transactionTimeout.isNegative()
        || transactionTimeout.isZero()) {
      throw new IllegalArgumentException("Transaction timeout must be positive");
    }
    if (baseBackoff == null || baseBackoff.isNegative()) {
      throw new IllegalArgumentException("Backoff cannot be negative");
    }
  }

  public static ProcessorConfig defaults() {
    return new ProcessorConfig(
        DEFAULT_BATCH_SIZE, DEFAULT_TRANSACTION_TIMEOUT, DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF);
  }
}
