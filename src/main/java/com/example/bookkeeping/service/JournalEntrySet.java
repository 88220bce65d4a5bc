package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.util.List;

import com.example.bookkeeping.domain.JournalLine;

/**
 * The journal lines generated for one transaction.
 *
 * @param entries every debit and credit line; empty for transfers
 * @param requiresSplitTransaction true when the category side was divided into several legs
 * @param splitTransactions the legs of the divided side, empty unless split
 */
public record JournalEntrySet(
    List<JournalLine> entries,
    boolean requiresSplitTransaction,
    List<JournalLine> splitTransactions) {

  public JournalEntrySet {
    entries = List.copyOf(entries);
    splitTransactions = List.copyOf(splitTransactions);
  }

  public static JournalEntrySet empty() {
    return new JournalEntrySet(List.of(), false, List.of());
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public BigDecimal totalDebits() {
    return entries.stream()
        .filter(JournalLine::isDebit)
        .map(JournalLine::amount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  public BigDecimal totalCredits() {
    return entries.stream()
        .filter(line -> !line.isDebit())
        .map(JournalLine::amount)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
