package com.example.bookkeeping.domain;

import java.util.List;

import com.example.bookkeeping.domain.LedgerAccount.AccountType;

/**
 * The ledger roles the import pipeline posts to. Each role is recognised by one or more account
 * codes, in order of preference.
 */
public enum AccountRole {
  CASH(AccountType.ASSET, "1000", "1010"),
  ACCOUNTS_RECEIVABLE(AccountType.ASSET, "1100"),
  INVENTORY(AccountType.ASSET, "1200"),
  FIXED_ASSETS(AccountType.ASSET, "1400", "1510"),
  ACCOUNTS_PAYABLE(AccountType.LIABILITY, "2000"),
  CREDIT_CARDS(AccountType.LIABILITY, "2100", "2110"),
  PAYROLL_TAX_PAYABLE(AccountType.LIABILITY, "2200", "2320"),
  SALES_TAX_PAYABLE(AccountType.LIABILITY, "2300", "2310"),
  LOANS_PAYABLE(AccountType.LIABILITY, "2400"),
  SALES_REVENUE(AccountType.INCOME, "4000", "4010"),
  SERVICE_REVENUE(AccountType.INCOME, "4020"),
  OTHER_INCOME(AccountType.INCOME, "4100", "4050"),
  COST_OF_GOODS_SOLD(AccountType.EXPENSE, "5000", "5010"),
  SALARIES_WAGES(AccountType.EXPENSE, "6000", "5020"),
  MISCELLANEOUS(AccountType.EXPENSE, "6900", "5999"),
  INTEREST_EXPENSE(AccountType.EXPENSE, "6950", "5200"),
  OTHER_EXPENSE(AccountType.EXPENSE, "5900");

  private final AccountType type;
  private final List<String> codes;

  AccountRole(AccountType type, String... codes) {
    this.type = type;
    this.codes = List.of(codes);
  }

  public AccountType getType() {
    return type;
  }

  /** Codes recognised for this role, in order of preference. */
  public List<String> getCodes() {
    return codes;
  }

  public boolean matches(String code) {
    return codes.contains(code);
  }
}
