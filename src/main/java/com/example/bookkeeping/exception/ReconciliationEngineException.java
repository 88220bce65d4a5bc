package com.example.bookkeeping.exception;

/** Base exception for import and reconciliation errors. */
public class ReconciliationEngineException extends RuntimeException {

  private final ErrorCode errorCode;

  public ReconciliationEngineException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public ReconciliationEngineException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}
