package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.JournalKind;
import com.example.bookkeeping.domain.JournalLine;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.Transaction.TransactionType;
import com.example.bookkeeping.exception.ChartOfAccountsException;
import com.example.bookkeeping.exception.JournalGenerationException;

/**
 * Turns a single bank transaction into balanced double-entry journal lines.
 *
 * <p>Money received debits the bank's asset account; money paid credits it. The other side goes to
 * the resolved category account, except for the legs split off for tax or a loan's principal and
 * interest, which go to their fixed accounts. Every line is rounded to the currency's minor unit,
 * and the result is rejected unless total debits and total credits both equal the posted amount.
 *
 * <p>A factory is bound to one business's chart of accounts and is created per import batch.
 */
public class JournalEntryFactory {

  private static final Logger log = LoggerFactory.getLogger(JournalEntryFactory.class);

  public static final int DEFAULT_CURRENCY_SCALE = 2;
  private static final BigDecimal ESTIMATED_INTEREST_SHARE = new BigDecimal("0.20");

  private final ChartOfAccountsMap accounts;
  private final int currencyScale;

  public JournalEntryFactory(ChartOfAccountsMap accounts) {
    this(accounts, DEFAULT_CURRENCY_SCALE);
  }

  /**
   * The bank side of each transaction is looked up per bank account when the transaction is
   * posted, so a chart whose bank accounts all map to their own ledger accounts needs no general
   * cash account.
   *
   * @throws ChartOfAccountsException if the chart has no income account
   */
  public JournalEntryFactory(ChartOfAccountsMap accounts, int currencyScale) {
    if (!accounts.hasIncomeAccount()) {
      throw new ChartOfAccountsException("At least one income account is required");
    }
    if (!accounts.has(AccountRole.MISCELLANEOUS) && !accounts.has(AccountRole.OTHER_EXPENSE)) {
      log.warn(
          "Business {} has no miscellaneous expense account; uncategorised expenses will fail",
          accounts.getBusinessId());
    }
    this.accounts = accounts;
    this.currencyScale = currencyScale;
  }

  /**
   * Creates the journal lines for a transaction.
   *
   * @param transaction the transaction to post
   * @param categoryAccountId the resolved category account, null only for transfers
   * @return the balanced lines, empty for a transfer; they total {@link #postedAmount}
   * @throws JournalGenerationException if the lines cannot be built or do not balance
   * @throws ChartOfAccountsException if the transaction's bank account has no ledger account
   */
  public JournalEntrySet createJournalEntries(RawTransaction transaction, Long categoryAccountId) {
    JournalKind kind = kindOf(transaction);
    if (kind == JournalKind.TRANSFER) {
      // Transfers show up in both bank accounts; posting them here would double count.
      return JournalEntrySet.empty();
    }

    BigDecimal amount = postedAmount(transaction);
    if (amount.signum() == 0) {
      throw new JournalGenerationException("Transaction amount is zero");
    }

    JournalEntrySet set =
        switch (kind) {
          case INCOME, TAX_COLLECTION -> incomeEntries(transaction, amount, categoryAccountId);
          case EXPENSE -> expenseEntries(transaction, amount, categoryAccountId);
          case ASSET_PURCHASE -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Asset purchase: ",
              "Payment for asset: ");
          case INVENTORY_PURCHASE -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Inventory purchase: ",
              "Payment for inventory: ");
          case LOAN_PAYMENT -> loanPaymentEntries(transaction, amount);
          case CREDIT_CARD_PAYMENT -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Credit card payment: ",
              "Payment to credit card: ");
          case TAX_PAYMENT -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Tax payment: ",
              "Payment to tax authority: ");
          case CUSTOMER_PAYMENT -> customerPaymentEntries(
              transaction, amount, requireCategory(categoryAccountId));
          case VENDOR_PAYMENT -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Vendor payment: ",
              "Payment to vendor: ");
          case PAYROLL -> payment(
              transaction,
              amount,
              requireCategory(categoryAccountId),
              "Payroll: ",
              "Payroll payment: ");
          case TRANSFER -> JournalEntrySet.empty();
        };

    verifyBalanced(set, amount);
    return set;
  }

  /** The amount a transaction is posted and stored with: its absolute value in minor units. */
  public BigDecimal postedAmount(RawTransaction transaction) {
    return round(transaction.absoluteAmount());
  }

  /**
   * Determines the posting pattern. Only transfer rows post as transfers; a supplied kind must
   * move money in the direction of the row's type.
   */
  JournalKind kindOf(RawTransaction transaction) {
    JournalKind kind = transaction.postingKind();
    if (transaction.type() == TransactionType.TRANSFER) {
      return kind;
    }
    boolean outflow = transaction.type() == TransactionType.EXPENSE;
    if (kind == JournalKind.TRANSFER || kind.isOutflow() != outflow) {
      throw new JournalGenerationException(
          "Journal kind " + kind + " does not fit a " + transaction.type() + " transaction");
    }
    return kind;
  }

  private JournalEntrySet incomeEntries(
      RawTransaction transaction, BigDecimal amount, Long categoryAccountId) {
    Long cash = cashFor(transaction);
    Long revenue = requireCategory(categoryAccountId);
    BigDecimal tax = positiveOrZero(transaction.taxAmount());

    List<JournalLine> entries = new ArrayList<>();
    entries.add(JournalLine.debit(cash, amount, memo("Cash received: ", transaction)));
    if (tax.signum() == 0) {
      entries.add(JournalLine.credit(revenue, amount, memo("Revenue: ", transaction)));
      return new JournalEntrySet(entries, false, List.of());
    }

    Long salesTax = require(AccountRole.SALES_TAX_PAYABLE, "sales tax payable");
    BigDecimal net = remainder(amount, tax, "Tax amount");
    List<JournalLine> legs =
        List.of(
            JournalLine.credit(revenue, net, memo("Revenue: ", transaction)),
            JournalLine.credit(salesTax, tax, "Sales tax collected"));
    entries.addAll(legs);
    return new JournalEntrySet(entries, true, legs);
  }

  private JournalEntrySet expenseEntries(
      RawTransaction transaction, BigDecimal amount, Long categoryAccountId) {
    Long cash = cashFor(transaction);
    Long expense = requireCategory(categoryAccountId);
    BigDecimal tax = positiveOrZero(transaction.taxAmount());

    List<JournalLine> entries = new ArrayList<>();
    List<JournalLine> legs = new ArrayList<>();
    if (tax.signum() == 0) {
      entries.add(JournalLine.debit(expense, amount, memo("Expense: ", transaction)));
    } else {
      // Input tax is recoverable, so it reduces the tax payable balance.
      Long salesTax = require(AccountRole.SALES_TAX_PAYABLE, "sales tax payable");
      BigDecimal net = remainder(amount, tax, "Tax amount");
      legs.add(JournalLine.debit(expense, net, memo("Expense: ", transaction)));
      legs.add(JournalLine.debit(salesTax, tax, "Sales tax paid"));
      entries.addAll(legs);
    }
    entries.add(JournalLine.credit(cash, amount, memo("Cash payment: ", transaction)));
    return new JournalEntrySet(entries, !legs.isEmpty(), legs);
  }

  private JournalEntrySet loanPaymentEntries(RawTransaction transaction, BigDecimal amount) {
    Long cash = cashFor(transaction);
    Long loans = require(AccountRole.LOANS_PAYABLE, "loans payable");
    Long interestExpense = require(AccountRole.INTEREST_EXPENSE, "interest expense");

    BigDecimal principal = transaction.principalAmount() != null
        ? round(transaction.principalAmount().abs())
        : null;
    BigDecimal interest = transaction.interestAmount() != null
        ? round(transaction.interestAmount().abs())
        : null;
    boolean estimated = principal == null && interest == null;

    if (estimated) {
      interest = round(amount.multiply(ESTIMATED_INTEREST_SHARE));
      principal = amount.subtract(interest);
    } else if (principal == null) {
      principal = amount.subtract(interest);
    } else if (interest == null) {
      interest = amount.subtract(principal);
    }
    if (principal.signum() < 0 || interest.signum() < 0) {
      throw new JournalGenerationException(
          "Loan principal and interest exceed the payment amount " + amount);
    }
    if (principal.add(interest).compareTo(amount) != 0) {
      throw new JournalGenerationException(
          "Loan principal "
              + principal
              + " and interest "
              + interest
              + " do not add up to the payment amount "
              + amount);
    }

    String suffix = estimated ? " (estimated)" : "";
    List<JournalLine> legs = new ArrayList<>();
    if (principal.signum() > 0) {
      legs.add(JournalLine.debit(loans, principal, "Loan principal payment" + suffix));
    }
    if (interest.signum() > 0) {
      legs.add(JournalLine.debit(interestExpense, interest, "Loan interest" + suffix));
    }
    List<JournalLine> entries = new ArrayList<>(legs);
    entries.add(JournalLine.credit(cash, amount, memo("Loan payment: ", transaction)));
    boolean split = legs.size() > 1;
    return new JournalEntrySet(entries, split, split ? legs : List.of());
  }

  private JournalEntrySet customerPaymentEntries(
      RawTransaction transaction, BigDecimal amount, Long receivable) {
    return new JournalEntrySet(
        List.of(
            JournalLine.debit(
                cashFor(transaction), amount, memo("Payment received: ", transaction)),
            JournalLine.credit(receivable, amount, memo("Customer payment: ", transaction))),
        false,
        List.of());
  }

  /** A money-out pattern: debit the given account, credit the bank. */
  private JournalEntrySet payment(
      RawTransaction transaction,
      BigDecimal amount,
      Long debitAccount,
      String debitMemo,
      String creditMemo) {
    return new JournalEntrySet(
        List.of(
            JournalLine.debit(debitAccount, amount, memo(debitMemo, transaction)),
            JournalLine.credit(cashFor(transaction), amount, memo(creditMemo, transaction))),
        false,
        List.of());
  }

  private void verifyBalanced(JournalEntrySet set, BigDecimal amount) {
    BigDecimal debits = set.totalDebits();
    BigDecimal credits = set.totalCredits();
    if (debits.compareTo(credits) != 0) {
      throw new JournalGenerationException(
          "Journal entries do not balance: debits " + debits + ", credits " + credits);
    }
    if (debits.compareTo(amount) != 0) {
      throw new JournalGenerationException(
          "Journal entries total " + debits + " but the transaction amount is " + amount);
    }
  }

  private Long cashFor(RawTransaction transaction) {
    return accounts
        .cashAccountFor(transaction.bankAccountId())
        .orElseThrow(
            () ->
                new ChartOfAccountsException(
                    "No cash account for bank account " + transaction.bankAccountId()));
  }

  private Long require(AccountRole role, String purpose) {
    return accounts
        .find(role)
        .orElseThrow(
            () -> new JournalGenerationException("No " + purpose + " account is configured"));
  }

  private Long requireCategory(Long categoryAccountId) {
    if (categoryAccountId == null) {
      throw new JournalGenerationException("Transaction has no category account");
    }
    return categoryAccountId;
  }

  private BigDecimal remainder(BigDecimal amount, BigDecimal part, String partName) {
    BigDecimal rest = amount.subtract(part);
    if (rest.signum() <= 0) {
      throw new JournalGenerationException(
          partName + " " + part + " must be less than the transaction amount " + amount);
    }
    return rest;
  }

  private BigDecimal positiveOrZero(BigDecimal value) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value.signum() < 0) {
      throw new JournalGenerationException("Tax amount cannot be negative: " + value);
    }
    return round(value);
  }

  private BigDecimal round(BigDecimal value) {
    return value.setScale(currencyScale, RoundingMode.HALF_EVEN);
  }

  private static String memo(String prefix, RawTransaction transaction) {
    if (transaction.description() == null || transaction.description().isBlank()) {
      return prefix.substring(0, prefix.length() - 2);
    }
    return prefix + transaction.description();
  }
}
