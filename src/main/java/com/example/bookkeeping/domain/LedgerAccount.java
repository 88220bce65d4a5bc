package com.example.bookkeeping.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A node in a business's chart of accounts. Created once during chart-of-accounts setup and only
 * referenced by the import pipeline, never mutated by it.
 */
@Entity
@Table(
    name = "ledger_account",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_ledger_account_business_code",
          columnNames = {"business_id", "code"})
    },
    indexes = {@Index(name = "idx_ledger_account_business", columnList = "business_id")})
public class LedgerAccount {

  public enum AccountType {
    ASSET,
    LIABILITY,
    EQUITY,
    INCOME,
    EXPENSE
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "business_id", nullable = false)
  private Long businessId;

  @NotBlank
  @Size(max = 10)
  @Column(nullable = false, length = 10)
  private String code;

  @NotBlank
  @Size(max = 100)
  @Column(nullable = false, length = 100)
  private String name;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private AccountType type;

  @Size(max = 255)
  @Column(length = 255)
  private String description;

  @Column(nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public LedgerAccount() {}

  public LedgerAccount(Long businessId, String code, String name, AccountType type) {
    this.businessId = businessId;
    this.code = code;
    this.name = name;
    this.type = type;
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

  public String getCode() {
    return code;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public AccountType getType() {
    return type;
  }

  public void setType(AccountType type) {
    this.type = type;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
