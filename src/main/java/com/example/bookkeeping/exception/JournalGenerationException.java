package com.example.bookkeeping.exception;

/** A single transaction cannot be turned into balanced journal lines. */
public class JournalGenerationException extends ReconciliationEngineException {

  public JournalGenerationException(String message) {
    super(ErrorCode.SEMANTIC, message);
  }
}
