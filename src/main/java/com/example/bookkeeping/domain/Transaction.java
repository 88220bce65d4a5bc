package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A bank transaction persisted by the import pipeline. The amount is stored unsigned; the direction
 * of the money movement is carried by {@link TransactionType}. Each transaction owns its balanced
 * set of {@link JournalEntry} rows and at most one {@link ReconciliationStatus}.
 */
@Entity
@Table(
    name = "transactions",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_transaction_business_external_id",
          columnNames = {"business_id", "external_id"})
    },
    indexes = {
      @Index(name = "idx_transaction_business_date", columnList = "business_id, transaction_date"),
      @Index(name = "idx_transaction_bank_account", columnList = "bank_account_id")
    })
public class Transaction {

  public enum TransactionType {
    INCOME,
    EXPENSE,
    TRANSFER
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "business_id", nullable = false)
  private Long businessId;

  @NotNull
  @Column(name = "bank_account_id", nullable = false)
  private Long bankAccountId;

  @Column(name = "category_id")
  private Long categoryId;

  @NotNull
  @Column(nullable = false, precision = 19, scale = 2)
  private BigDecimal amount;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private TransactionType type;

  @NotNull
  @Column(name = "transaction_date", nullable = false)
  private LocalDate date;

  @Size(max = 500)
  @Column(length = 500)
  private String description;

  @Size(max = 100)
  @Column(length = 100)
  private String reference;

  @Size(max = 100)
  @Column(name = "external_id", length = 100)
  private String externalId;

  @Size(max = 255)
  @Column(length = 255)
  private String vendor;

  @Column(name = "tax_amount", precision = 19, scale = 2)
  private BigDecimal taxAmount;

  @Column(name = "principal_amount", precision = 19, scale = 2)
  private BigDecimal principalAmount;

  @Column(name = "interest_amount", precision = 19, scale = 2)
  private BigDecimal interestAmount;

  @Column(name = "created_by_id")
  private Long createdById;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public Transaction() {}

  public Transaction(
      Long businessId,
      Long bankAccountId,
      TransactionType type,
      LocalDate date,
      BigDecimal amount) {
    this.businessId = businessId;
    this.bankAccountId = bankAccountId;
    this.type = type;
    this.date = date;
    this.amount = amount;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getBusinessId() {
    return businessId;
  }

  public void setBusinessId(Long businessId) {
    this.businessId = businessId;
  }

  public Long getBankAccountId() {
    return bankAccountId;
  }

  public void setBankAccountId(Long bankAccountId) {
    this.bankAccountId = bankAccountId;
  }

  public Long getCategoryId() {
    return categoryId;
  }

  public void setCategoryId(Long categoryId) {
    this.categoryId = categoryId;
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public void setAmount(BigDecimal amount) {
    this.amount = amount;
  }

  public TransactionType getType() {
    return type;
  }

  public void setType(TransactionType type) {
    this.type = type;
  }

  public LocalDate getDate() {
    return date;
  }

  public void setDate(LocalDate date) {
    this.date = date;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getReference() {
    return reference;
  }

  public void setReference(String reference) {
    this.reference = reference;
  }

  public String getExternalId() {
    return externalId;
  }

  public void setExternalId(String externalId) {
    this.externalId = externalId;
  }

  public String getVendor() {
    return vendor;
  }

  public void setVendor(String vendor) {
    this.vendor = vendor;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public void setTaxAmount(BigDecimal taxAmount) {
    this.taxAmount = taxAmount;
  }

  public BigDecimal getPrincipalAmount() {
    return principalAmount;
  }

  public void setPrincipalAmount(BigDecimal principalAmount) {
    this.principalAmount = principalAmount;
  }

  public BigDecimal getInterestAmount() {
    return interestAmount;
  }

  public void setInterestAmount(BigDecimal interestAmount) {
    this.interestAmount = interestAmount;
  }

  public Long getCreatedById() {
    return createdById;
  }

  public void setCreatedById(Long createdById) {
    this.createdById = createdById;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
