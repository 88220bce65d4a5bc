package com.example.bookkeeping.exception;

/**
 * A business's chart of accounts lacks an account the import pipeline needs. Fails a whole batch
 * and is never retried.
 */
public class ChartOfAccountsException extends ReconciliationEngineException {

  public ChartOfAccountsException(String message) {
    super(ErrorCode.CONFIGURATION, message);
  }
}
