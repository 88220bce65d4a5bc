package com.example.bookkeeping.domain;

import java.util.Optional;

/**
 * The bookkeeping pattern a transaction is posted with. Imported rows post as plain income or
 * expense unless the importer supplies a kind, or the row carries a loan principal or interest
 * amount.
 */
public enum JournalKind {
  INCOME(false, null),
  EXPENSE(true, null),
  ASSET_PURCHASE(true, AccountRole.FIXED_ASSETS),
  INVENTORY_PURCHASE(true, AccountRole.INVENTORY),
  LOAN_PAYMENT(true, AccountRole.LOANS_PAYABLE),
  CREDIT_CARD_PAYMENT(true, AccountRole.CREDIT_CARDS),
  TAX_PAYMENT(true, AccountRole.SALES_TAX_PAYABLE),
  TAX_COLLECTION(false, null),
  CUSTOMER_PAYMENT(false, AccountRole.ACCOUNTS_RECEIVABLE),
  VENDOR_PAYMENT(true, AccountRole.ACCOUNTS_PAYABLE),
  PAYROLL(true, AccountRole.SALARIES_WAGES),
  TRANSFER(false, null);

  private final boolean outflow;
  private final AccountRole categoryRole;

  JournalKind(boolean outflow, AccountRole categoryRole) {
    this.outflow = outflow;
    this.categoryRole = categoryRole;
  }

  /** True when money leaves the bank account under this kind. Transfers are neither. */
  public boolean isOutflow() {
    return outflow;
  }

  /**
   * The account the non-bank side posts to when the transaction names no category. Empty when the
   * type's fallback account applies.
   */
  public Optional<AccountRole> categoryRole() {
    return Optional.ofNullable(categoryRole);
  }
}
