package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.bookkeeping.domain.Transaction;

/** The parts of a transaction the matcher looks at. */
public record TransactionCandidate(
    Long transactionId, LocalDate date, BigDecimal amount, String description) {

  public static TransactionCandidate of(Transaction transaction) {
    return new TransactionCandidate(
        transaction.getId(),
        transaction.getDate(),
        transaction.getAmount(),
        transaction.getDescription());
  }
}
