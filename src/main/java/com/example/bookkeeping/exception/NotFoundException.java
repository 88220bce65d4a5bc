package com.example.bookkeeping.exception;

public class NotFoundException extends ReconciliationEngineException {

  public NotFoundException(String entity, Long id) {
    super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
  }
}
