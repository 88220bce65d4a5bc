package com.example.bookkeeping.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class JournalKindTest {

  @Test
  void isOutflow_matchesMoneyDirection() {
    assertTrue(JournalKind.VENDOR_PAYMENT.isOutflow());
    assertFalse(JournalKind.CUSTOMER_PAYMENT.isOutflow());
    assertFalse(JournalKind.TAX_COLLECTION.isOutflow());
  }

  @Test
  void categoryRole_fixedPatterns_nameTheirAccount() {
    assertEquals(Optional.of(AccountRole.FIXED_ASSETS), JournalKind.ASSET_PURCHASE.categoryRole());
    assertEquals(
        Optional.of(AccountRole.ACCOUNTS_RECEIVABLE), JournalKind.CUSTOMER_PAYMENT.categoryRole());
    assertEquals(Optional.of(AccountRole.LOANS_PAYABLE), JournalKind.LOAN_PAYMENT.categoryRole());
  }

  @Test
  void categoryRole_plainIncomeAndExpense_useTheTypeFallback() {
    assertTrue(JournalKind.INCOME.categoryRole().isEmpty());
    assertTrue(JournalKind.EXPENSE.categoryRole().isEmpty());
    assertTrue(JournalKind.TRANSFER.categoryRole().isEmpty());
  }
}
