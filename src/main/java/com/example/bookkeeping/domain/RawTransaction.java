package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

import com.example.bookkeeping.domain.Transaction.TransactionType;

/**
 * A bank transaction as delivered by an importer, before it is persisted. The amount may be signed;
 * the direction is taken from {@code type}. Only the category may change after creation, through
 * {@link #withCategoryId(Long)}.
 */
public record RawTransaction(
    LocalDate date,
    String description,
    BigDecimal amount,
    TransactionType type,
    Long bankAccountId,
    String externalId,
    String vendor,
    BigDecimal taxAmount,
    BigDecimal principalAmount,
    BigDecimal interestAmount,
    String suggestedCategory,
    Long categoryId,
    String reference,
    JournalKind journalKind) {

  public RawTransaction {
    Objects.requireNonNull(date, "Date cannot be null");
    Objects.requireNonNull(amount, "Amount cannot be null");
    Objects.requireNonNull(type, "Type cannot be null");
    Objects.requireNonNull(bankAccountId, "Bank account cannot be null");
    if (externalId != null && externalId.isBlank()) {
      externalId = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public RawTransaction withCategoryId(Long newCategoryId) {
    return new RawTransaction(
        date,
        description,
        amount,
        type,
        bankAccountId,
        externalId,
        vendor,
        taxAmount,
        principalAmount,
        interestAmount,
        suggestedCategory,
        newCategoryId,
        reference,
        journalKind);
  }

  public BigDecimal absoluteAmount() {
    return amount.abs();
  }

  public boolean hasExternalId() {
    return externalId != null;
  }

  /**
   * The posting pattern for this transaction: the supplied kind, a loan payment when an expense
   * carries a principal or interest amount, and otherwise the kind matching {@code type}. Whether
   * the supplied kind fits the type is checked when the journal is built.
   */
  public JournalKind postingKind() {
    if (type == TransactionType.TRANSFER) {
      return JournalKind.TRANSFER;
    }
    if (journalKind != null) {
      return journalKind;
    }
    if (type == TransactionType.EXPENSE && (principalAmount != null || interestAmount != null)) {
      return JournalKind.LOAN_PAYMENT;
    }
    return type == TransactionType.EXPENSE ? JournalKind.EXPENSE : JournalKind.INCOME;
  }

  /**
   * Converts this raw transaction into an entity ready for persistence.
   *
   * @param postedAmount the amount the journal was built from, rounded to the currency's minor unit
   */
  public Transaction toEntity(
      Long businessId, Long resolvedCategoryId, Long createdById, BigDecimal postedAmount) {
    Transaction transaction = new Transaction(businessId, bankAccountId, type, date, postedAmount);
    transaction.setCategoryId(resolvedCategoryId);
    transaction.setDescription(description);
    transaction.setReference(reference);
    transaction.setExternalId(externalId);
    transaction.setVendor(vendor);
    transaction.setTaxAmount(taxAmount);
    transaction.setPrincipalAmount(principalAmount);
    transaction.setInterestAmount(interestAmount);
    transaction.setCreatedById(createdById);
    return transaction;
  }

  public static final class Builder {
    private LocalDate date;
    private String description;
    private BigDecimal amount;
    private TransactionType type;
    private Long bankAccountId;
    private String externalId;
    private String vendor;
    private BigDecimal taxAmount;
    private BigDecimal principalAmount;
    private BigDecimal interestAmount;
    private String suggestedCategory;
    private Long categoryId;
    private String reference;
    private JournalKind journalKind;

    private Builder() {}

    public Builder date(LocalDate date) {
      this.date = date;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder amount(BigDecimal amount) {
      this.amount = amount;
      return this;
    }

    public Builder amount(String amount) {
      this.amount = new BigDecimal(amount);
      return this;
    }

    public Builder type(TransactionType type) {
      this.type = type;
      return this;
    }

    public Builder bankAccountId(Long bankAccountId) {
      this.bankAccountId = bankAccountId;
      return this;
    }

    public Builder externalId(String externalId) {
      this.externalId = externalId;
      return this;
    }

    public Builder vendor(String vendor) {
      this.vendor = vendor;
      return this;
    }

    public Builder taxAmount(BigDecimal taxAmount) {
      this.taxAmount = taxAmount;
      return this;
    }

    public Builder principalAmount(BigDecimal principalAmount) {
      this.principalAmount = principalAmount;
      return this;
    }

    public Builder interestAmount(BigDecimal interestAmount) {
      this.interestAmount = interestAmount;
      return this;
    }

    public Builder suggestedCategory(String suggestedCategory) {
      this.suggestedCategory = suggestedCategory;
      return this;
    }

    public Builder categoryId(Long categoryId) {
      this.categoryId = categoryId;
      return this;
    }

    public Builder reference(String reference) {
      this.reference = reference;
      return this;
    }

    public Builder journalKind(JournalKind journalKind) {
      this.journalKind = journalKind;
      return this;
    }

    public RawTransaction build() {
      return new RawTransaction(
          date,
          description,
          amount,
          type,
          bankAccountId,
          externalId,
          vendor,
          taxAmount,
          principalAmount,
          interestAmount,
          suggestedCategory,
          categoryId,
          reference,
          journalKind);
    }
  }
}
