package com.example.bookkeeping.service;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import com.example.bookkeeping.exception.ErrorCode;

/**
 * Outcome of a batch import.
 *
 * @param imported transactions persisted with their journal entries
 * @param failed transactions rejected or lost with a failed chunk
 * @param skipped transactions already imported earlier
 * @param errors one entry per rejected transaction or failed chunk
 * @param transactionIds ids of the persisted transactions, in input order
 */
public record ProcessingResult(
    int imported,
    int failed,
    int skipped,
    List<ProcessingError> errors,
    List<Long> transactionIds) {

  public ProcessingResult {
    errors = List.copyOf(errors);
    transactionIds = List.copyOf(transactionIds);
  }

  public boolean hasFailures() {
    return failed > 0;
  }

  /**
   * A single error. Per-transaction errors carry the chunk, the position in the input and the
   * external id; chunk errors carry the chunk and the number of transactions lost.
   */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ProcessingError(
      Integer chunk,
      Integer index,
      String externalId,
      Integer count,
      ErrorCode kind,
      String message) {

    public static ProcessingError forTransaction(
        int chunk, int index, String externalId, ErrorCode kind, String message) {
      return new ProcessingError(chunk, index, externalId, null, kind, message);
    }

    public static ProcessingError forChunk(int chunk, int count, ErrorCode kind, String message) {
      return new ProcessingError(chunk, null, null, count, kind, message);
    }
  }
}
