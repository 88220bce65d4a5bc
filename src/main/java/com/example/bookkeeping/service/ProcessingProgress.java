package com.example.bookkeeping.service;

/** Progress of a batch import, emitted at every chunk boundary. */
public record ProcessingProgress(
    int total, int processed, int currentBatch, int totalBatches, Status status) {

  public enum Status {
    PROCESSING,
    COMPLETED,
    FAILED
  }

  public int percentComplete() {
    return total == 0 ? 100 : (int) Math.round(processed * 100.0 / total);
  }
}
