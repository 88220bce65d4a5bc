package com.example.bookkeeping.exception;

/** The extraction service failed or returned data that does not fit the expected schema. */
public class DocumentExtractionException extends ReconciliationEngineException {

  public DocumentExtractionException(String message) {
    super(ErrorCode.EXTRACTION, message);
  }

  public DocumentExtractionException(String message, Throwable cause) {
    super(ErrorCode.EXTRACTION, message, cause);
  }
}
