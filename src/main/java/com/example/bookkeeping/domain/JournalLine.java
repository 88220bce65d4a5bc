package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A journal line produced by the journal entry factory before its transaction has an id.
 *
 * @param accountId the ledger account the line posts to
 * @param amount the positive amount, already rounded to the currency's minor unit
 * @param side debit or credit
 * @param description human-readable line memo
 */
public record JournalLine(
    Long accountId, BigDecimal amount, JournalEntry.Side side, String description) {

  public JournalLine {
    Objects.requireNonNull(accountId, "Account cannot be null");
    Objects.requireNonNull(amount, "Amount cannot be null");
    Objects.requireNonNull(side, "Side cannot be null");
    if (amount.signum() <= 0) {
      throw new IllegalArgumentException("Journal line amount must be positive");
    }
  }

  public static JournalLine debit(Long accountId, BigDecimal amount, String description) {
    return new JournalLine(accountId, amount, JournalEntry.Side.DEBIT, description);
  }

  public static JournalLine credit(Long accountId, BigDecimal amount, String description) {
    return new JournalLine(accountId, amount, JournalEntry.Side.CREDIT, description);
  }

  public boolean isDebit() {
    return side == JournalEntry.Side.DEBIT;
  }
}
