package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * One debit or credit line of a transaction's double-entry record. Amounts are always positive;
 * the side says which column the amount belongs to. For any transaction the debit lines and the
 * credit lines sum to the same amount. Entries are immutable once written.
 */
@Entity
@Table(
    name = "journal_entry",
    indexes = {
      @Index(name = "idx_journal_entry_transaction", columnList = "transaction_id"),
      @Index(name = "idx_journal_entry_account", columnList = "account_id")
    })
public class JournalEntry {

  public enum Side {
    DEBIT,
    CREDIT
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "transaction_id", nullable = false)
  private Long transactionId;

  @NotNull
  @Column(name = "account_id", nullable = false)
  private Long accountId;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 10)
  private Side side;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  protected JournalEntry() {}

  public JournalEntry(Long transactionId, JournalLine line) {
    this.transactionId = transactionId;
    this.accountId = line.accountId();
    this.amount = line.amount();
    this.side = line.side();
    this.description = line.description();
  }

  // Getters only - journal entries are immutable after creation
  public Long getId() {
    return id;
  }

  public Long getTransactionId() {
    return transactionId;
  }

  public Long getAccountId() {
    return accountId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public Side getSide() {
    return side;
  }

  public String getDescription() {
    return description;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isDebit() {
    return side == Side.DEBIT;
  }
}
