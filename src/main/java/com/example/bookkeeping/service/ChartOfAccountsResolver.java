package com.example.bookkeeping.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.Transaction.TransactionType;
import com.example.bookkeeping.exception.ChartOfAccountsException;

/**
 * Resolves the ledger account a transaction's category leg posts to. The order is: the explicit
 * category, then the suggested category name, then the account its journal kind posts to, then the
 * fallback account for the transaction type. Transfers without a category have no category leg.
 * The journal factory posts the non-bank side of every unsplit entry to the resolved account, so
 * the stored category always agrees with the journal.
 */
@Component
public class ChartOfAccountsResolver {

  private static final Logger log = LoggerFactory.getLogger(ChartOfAccountsResolver.class);

  /**
   * Resolves the category account for a transaction.
   *
   * @return the account id, or empty for a transfer without a category
   * @throws ChartOfAccountsException if the type's fallback account does not exist
   */
  public Optional<Long> resolveAccount(RawTransaction transaction, ChartOfAccountsMap accountMap) {
    if (transaction.categoryId() != null) {
      return Optional.of(transaction.categoryId());
    }
    Optional<Long> suggested = accountMap.findByName(transaction.suggestedCategory());
    if (suggested.isPresent()) {
      return suggested;
    }
    Optional<Long> byKind = kindAccount(transaction, accountMap);
    if (byKind.isPresent()) {
      return byKind;
    }
    if (transaction.type() == TransactionType.TRANSFER) {
      return Optional.empty();
    }
    return Optional.of(
        fallbackFor(transaction.type(), accountMap)
            .orElseThrow(
                () ->
                    new ChartOfAccountsException(
                        "No fallback "
                            + transaction.type().name().toLowerCase()
                            + " account configured for business "
                            + accountMap.getBusinessId())));
  }

  /**
   * Checks that every transaction in the input can be resolved without a configuration error: each
   * income or expense transaction that relies on a fallback has one, and each bank account used has
   * a cash account. All problems are reported together.
   *
   * @throws ChartOfAccountsException listing every missing account
   */
  public void verifyFallbacks(List<RawTransaction> transactions, ChartOfAccountsMap accountMap) {
    List<String> problems = new ArrayList<>();
    Set<TransactionType> missingFallbacks = new LinkedHashSet<>();
    Set<Long> missingCash = new LinkedHashSet<>();

    for (int i = 0; i < transactions.size(); i++) {
      RawTransaction transaction = transactions.get(i);
      if (accountMap.cashAccountFor(transaction.bankAccountId()).isEmpty()) {
        missingCash.add(transaction.bankAccountId());
      }
      if (needsFallback(transaction, accountMap)
          && fallbackFor(transaction.type(), accountMap).isEmpty()) {
        missingFallbacks.add(transaction.type());
        problems.add(
            "transaction #"
                + (i + 1)
                + " has no category and no fallback "
                + transaction.type().name().toLowerCase()
                + " account exists");
      }
    }
    for (Long bankAccountId : missingCash) {
      problems.add("no cash account for bank account " + bankAccountId);
    }

    if (!problems.isEmpty()) {
      log.warn(
          "Chart of accounts for business {} is incomplete: missing fallbacks {}, bank accounts {}",
          accountMap.getBusinessId(),
          missingFallbacks,
          missingCash);
      throw new ChartOfAccountsException(
          "Chart of accounts is incomplete: " + String.join("; ", problems));
    }
  }

  private boolean needsFallback(RawTransaction transaction, ChartOfAccountsMap accountMap) {
    return transaction.type() != TransactionType.TRANSFER
        && transaction.categoryId() == null
        && accountMap.findByName(transaction.suggestedCategory()).isEmpty()
        && kindAccount(transaction, accountMap).isEmpty();
  }

  private Optional<Long> kindAccount(RawTransaction transaction, ChartOfAccountsMap accountMap) {
    return transaction.postingKind().categoryRole().flatMap(accountMap::find);
  }

  private Optional<Long> fallbackFor(TransactionType type, ChartOfAccountsMap accountMap) {
    return switch (type) {
      case EXPENSE -> accountMap
          .find(AccountRole.MISCELLANEOUS)
          .or(() -> accountMap.find(AccountRole.OTHER_EXPENSE));
      case INCOME -> accountMap
          .find(AccountRole.OTHER_INCOME)
          .or(() -> accountMap.find(AccountRole.SALES_REVENUE));
      case TRANSFER -> Optional.empty();
    };
  }
}
