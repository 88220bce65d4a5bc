package com.example.bookkeeping.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A business's ledger accounts keyed by the role they play in journal generation, plus a lookup of
 * account names for resolving suggested categories and the ledger account backing each bank
 * account. Instances are immutable; use {@link #builder(Long)} to create one.
 */
public final class ChartOfAccountsMap {

  private final Long businessId;
  private final Map<AccountRole, Long> accountsByRole;
  private final Map<String, Long> accountsByName;
  private final Map<Long, Long> bankLedgerAccounts;

  private ChartOfAccountsMap(Builder builder) {
    this.businessId = builder.businessId;
    this.accountsByRole = Collections.unmodifiableMap(new EnumMap<>(builder.accountsByRole));
    this.accountsByName = Map.copyOf(builder.accountsByName);
    this.bankLedgerAccounts = Map.copyOf(builder.bankLedgerAccounts);
  }

  public static Builder builder(Long businessId) {
    return new Builder(businessId);
  }

  public Long getBusinessId() {
    return businessId;
  }

  public Optional<Long> find(AccountRole role) {
    return Optional.ofNullable(accountsByRole.get(role));
  }

  public boolean has(AccountRole role) {
    return accountsByRole.containsKey(role);
  }

  /** Finds an account by name, ignoring case and surrounding whitespace. */
  public Optional<Long> findByName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(accountsByName.get(normalize(name)));
  }

  /**
   * Returns the asset account that receives and pays money for a bank account: the bank account's
   * own ledger account when one is mapped, otherwise the general cash account.
   */
  public Optional<Long> cashAccountFor(Long bankAccountId) {
    Long mapped = bankAccountId != null ? bankLedgerAccounts.get(bankAccountId) : null;
    return mapped != null ? Optional.of(mapped) : find(AccountRole.CASH);
  }

  public boolean hasIncomeAccount() {
    return has(AccountRole.SALES_REVENUE)
        || has(AccountRole.SERVICE_REVENUE)
        || has(AccountRole.OTHER_INCOME);
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }

  public static final class Builder {
    private final Long businessId;
    private final Map<AccountRole, Long> accountsByRole = new EnumMap<>(AccountRole.class);
    private final Map<String, Long> accountsByName = new HashMap<>();
    private final Map<Long, Long> bankLedgerAccounts = new HashMap<>();

    private Builder(Long businessId) {
      this.businessId = businessId;
    }

    public Builder role(AccountRole role, Long accountId) {
      accountsByRole.put(role, accountId);
      return this;
    }

    /** Registers a role only if it has not been mapped yet. */
    public Builder roleIfAbsent(AccountRole role, Long accountId) {
      accountsByRole.putIfAbsent(role, accountId);
      return this;
    }

    public boolean has(AccountRole role) {
      return accountsByRole.containsKey(role);
    }

    public Builder named(String name, Long accountId) {
      if (name != null && !name.isBlank()) {
        accountsByName.putIfAbsent(normalize(name), accountId);
      }
      return this;
    }

    public Builder bankAccount(Long bankAccountId, Long ledgerAccountId) {
      bankLedgerAccounts.put(bankAccountId, ledgerAccountId);
      return this;
    }

    public ChartOfAccountsMap build() {
      return new ChartOfAccountsMap(this);
    }
  }
}
