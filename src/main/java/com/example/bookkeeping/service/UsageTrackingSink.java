package com.example.bookkeeping.service;

/**
 * Records how many transactions a business has imported. Best effort; never part of a ledger
 * write.
 */
public interface UsageTrackingSink {

  void incrementTransactionCount(Long businessId, int count);
}
