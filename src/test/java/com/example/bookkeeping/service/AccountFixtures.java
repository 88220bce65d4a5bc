package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.Transaction.TransactionType;

/** Account ids and builders shared by the import tests. */
final class AccountFixtures {

  static final Long BUSINESS_ID = 1L;
  static final Long BANK_ACCOUNT_ID = 500L;

  static final Long CASH = 1L;
  static final Long ACCOUNTS_RECEIVABLE = 2L;
  static final Long INVENTORY = 3L;
  static final Long FIXED_ASSETS = 4L;
  static final Long ACCOUNTS_PAYABLE = 5L;
  static final Long CREDIT_CARDS = 6L;
  static final Long PAYROLL_TAX_PAYABLE = 7L;
  static final Long SALES_TAX_PAYABLE = 8L;
  static final Long LOANS_PAYABLE = 9L;
  static final Long SALES_REVENUE = 10L;
  static final Long OTHER_INCOME = 11L;
  static final Long SALARIES_WAGES = 13L;
  static final Long MISCELLANEOUS = 14L;
  static final Long INTEREST_EXPENSE = 15L;
  static final Long OFFICE_SUPPLIES = 20L;

  private AccountFixtures() {}

  /** A complete chart with every role mapped. */
  static ChartOfAccountsMap.Builder fullChart() {
    return ChartOfAccountsMap.builder(BUSINESS_ID)
        .role(AccountRole.CASH, CASH)
        .role(AccountRole.ACCOUNTS_RECEIVABLE, ACCOUNTS_RECEIVABLE)
        .role(AccountRole.INVENTORY, INVENTORY)
        .role(AccountRole.FIXED_ASSETS, FIXED_ASSETS)
        .role(AccountRole.ACCOUNTS_PAYABLE, ACCOUNTS_PAYABLE)
        .role(AccountRole.CREDIT_CARDS, CREDIT_CARDS)
        .role(AccountRole.PAYROLL_TAX_PAYABLE, PAYROLL_TAX_PAYABLE)
        .role(AccountRole.SALES_TAX_PAYABLE, SALES_TAX_PAYABLE)
        .role(AccountRole.LOANS_PAYABLE, LOANS_PAYABLE)
        .role(AccountRole.SALES_REVENUE, SALES_REVENUE)
        .role(AccountRole.OTHER_INCOME, OTHER_INCOME)
        .role(AccountRole.SALARIES_WAGES, SALARIES_WAGES)
        .role(AccountRole.MISCELLANEOUS, MISCELLANEOUS)
        .role(AccountRole.INTEREST_EXPENSE, INTEREST_EXPENSE)
        .named("Office Supplies", OFFICE_SUPPLIES);
  }

  /** Cash and sales revenue only: no expense fallback at all. */
  static ChartOfAccountsMap.Builder minimalChart() {
    return ChartOfAccountsMap.builder(BUSINESS_ID)
        .role(AccountRole.CASH, CASH)
        .role(AccountRole.SALES_REVENUE, SALES_REVENUE);
  }

  static RawTransaction.Builder expense(String amount, String description) {
    return RawTransaction.builder()
        .date(LocalDate.of(2024, 3, 10))
        .type(TransactionType.EXPENSE)
        .amount(new BigDecimal(amount))
        .description(description)
        .bankAccountId(BANK_ACCOUNT_ID);
  }

  static RawTransaction.Builder income(String amount, String description) {
    return RawTransaction.builder()
        .date(LocalDate.of(2024, 3, 10))
        .type(TransactionType.INCOME)
        .amount(new BigDecimal(amount))
        .description(description)
        .bankAccountId(BANK_ACCOUNT_ID);
  }
}
