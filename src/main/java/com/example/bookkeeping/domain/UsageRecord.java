package com.example.bookkeeping.domain;

import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

/** Monthly count of transactions imported for a business. Best-effort, not a ledger record. */
@Entity
@Table(
    name = "usage_record",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_usage_business_month",
          columnNames = {"business_id", "usage_month"})
    })
public class UsageRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "business_id", nullable = false)
  private Long businessId;

  /** First day of the month this record counts. */
  @NotNull
  @Column(name = "usage_month", nullable = false)
  private LocalDate month;

  @Column(name = "transaction_count", nullable = false)
  private long transactionCount;

  public UsageRecord() {}

  public UsageRecord(Long businessId, LocalDate month) {
    this.businessId = businessId;
    this.month = month.withDayOfMonth(1);
  }

  public Long getId() {
    return id;
  }

  public Long getBusinessId() {
    return businessId;
  }

  public LocalDate getMonth() {
    return month;
  }

  public long getTransactionCount() {
    return transactionCount;
  }

  public void addTransactions(int count) {
    this.transactionCount += count;
  }
}
