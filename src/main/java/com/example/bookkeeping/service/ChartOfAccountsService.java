package com.example.bookkeeping.service;

import static com.example.bookkeeping.domain.LedgerAccount.AccountType.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.LedgerAccount;
import com.example.bookkeeping.domain.LedgerAccount.AccountType;
import com.example.bookkeeping.repository.LedgerAccountRepository;

/** Sets up a business's chart of accounts and maps it to the roles used for posting. */
@Service
@Transactional
public class ChartOfAccountsService {

  private static final Logger log = LoggerFactory.getLogger(ChartOfAccountsService.class);

  private static final List<DefaultAccount> DEFAULT_CHART =
      List.of(
          // Assets
          of("1000", "Cash", ASSET, "Funds held in checking or savings accounts."),
          of("1010", "Petty Cash", ASSET, "Small cash on hand for minor expenses."),
          of("1100", "Accounts Receivable", ASSET, "Amounts owed to the business by customers."),
          of("1200", "Inventory", ASSET, "Value of goods held for sale."),
          of("1300", "Prepaid Expenses", ASSET, "Payments made in advance for services."),
          of("1400", "Fixed Assets", ASSET, "Equipment, furniture and other long-term assets."),
          of("1410", "Accumulated Depreciation", ASSET, "Depreciation of fixed assets to date."),
          of("1500", "Other Assets", ASSET, "Other long-term assets."),
          // Liabilities
          of("2000", "Accounts Payable", LIABILITY, "Amounts owed to suppliers."),
          of("2100", "Credit Cards Payable", LIABILITY, "Balances owed on business credit cards."),
          of("2200", "Payroll Liabilities", LIABILITY, "Withholdings owed for employee pay."),
          of("2300", "Sales Tax Payable", LIABILITY, "Sales tax owed to the government."),
          of("2400", "Loans Payable", LIABILITY, "Outstanding loan balances."),
          of("2500", "Other Current Liabilities", LIABILITY, "Other short-term liabilities."),
          of("2600", "Long-Term Liabilities", LIABILITY, "Debts due beyond one year."),
          // Equity
          of("3000", "Owner's Equity", EQUITY, "Owner's investment in the business."),
          of("3050", "Opening Balance Equity", EQUITY, "Offsets bank opening balances."),
          of("3100", "Retained Earnings", EQUITY, "Accumulated profits or losses."),
          of("3200", "Drawings/Distributions", EQUITY, "Withdrawals made by the owner."),
          // Income
          of("4000", "Sales Revenue", INCOME, "Income from sale of products or services."),
          of("4100", "Other Revenue", INCOME, "Non-operating income such as interest."),
          // Expenses
          of("5000", "Cost of Goods Sold (COGS)", EXPENSE, "Direct costs of goods sold."),
          of("6000", "Salaries and Wages", EXPENSE, "Employee compensation."),
          of("6100", "Rent Expense", EXPENSE, "Office, store or warehouse rental."),
          of("6200", "Utilities Expense", EXPENSE, "Electricity, water, gas and internet."),
          of("6300", "Office Supplies", EXPENSE, "Consumables used in daily operations."),
          of("6400", "Advertising & Marketing", EXPENSE, "Promotion and marketing."),
          of("6500", "Travel & Meals", EXPENSE, "Business travel, lodging and meals."),
          of("6600", "Professional Fees", EXPENSE, "Legal, consulting and accounting services."),
          of("6700", "Insurance Expense", EXPENSE, "Business insurance premiums."),
          of("6800", "Depreciation Expense", EXPENSE, "Depreciation of fixed assets."),
          of("6900", "Miscellaneous Expense", EXPENSE, "Expenses not categorised elsewhere."),
          of("6950", "Interest Expense", EXPENSE, "Interest on loans and credit."),
          of("7000", "Tax Expense", EXPENSE, "Income tax expense."));

  private final LedgerAccountRepository accountRepository;

  public ChartOfAccountsService(LedgerAccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  /**
   * Creates the default chart of accounts for a business. Codes the business already has are left
   * alone, so the call can be repeated safely.
   *
   * @return the accounts created by this call
   */
  public List<LedgerAccount> createDefaultChart(Long businessId) {
    List<LedgerAccount> created = new ArrayList<>();
    for (DefaultAccount template : DEFAULT_CHART) {
      if (accountRepository.findByBusinessIdAndCode(businessId, template.code()).isPresent()) {
        continue;
      }
      LedgerAccount account =
          new LedgerAccount(businessId, template.code(), template.name(), template.type());
      account.setDescription(template.description());
      created.add(account);
    }
    List<LedgerAccount> saved = accountRepository.saveAll(created);
    log.info("Created {} default accounts for business {}", saved.size(), businessId);
    return saved;
  }

  /**
   * Builds the role map for a business from its active accounts.
   *
   * @param businessId the business
   * @param bankLedgerAccounts bank account id to the asset account backing it; may be empty
   */
  @Transactional(readOnly = true)
  public ChartOfAccountsMap buildAccountMap(Long businessId, Map<Long, Long> bankLedgerAccounts) {
    List<LedgerAccount> accounts =
        accountRepository.findByBusinessIdAndActiveTrueOrderByCode(businessId);
    Map<String, LedgerAccount> byCode = new HashMap<>();
    for (LedgerAccount account : accounts) {
      byCode.put(account.getCode(), account);
    }

    ChartOfAccountsMap.Builder builder = ChartOfAccountsMap.builder(businessId);
    for (AccountRole role : AccountRole.values()) {
      for (String code : role.getCodes()) {
        LedgerAccount account = byCode.get(code);
        if (account != null) {
          builder.role(role, account.getId());
          break;
        }
      }
    }
    for (LedgerAccount account : accounts) {
      builder.named(account.getName(), account.getId());
    }
    bankLedgerAccounts.forEach(builder::bankAccount);

    if (!builder.has(AccountRole.MISCELLANEOUS) && !builder.has(AccountRole.OTHER_EXPENSE)) {
      accounts.stream()
          .filter(account -> account.getType() == AccountType.EXPENSE)
          .filter(account -> isOperatingExpenseCode(account.getCode()))
          .findFirst()
          .ifPresentOrElse(
              fallback -> {
                builder.role(AccountRole.MISCELLANEOUS, fallback.getId());
                log.warn(
                    "Using {} ({}) as fallback expense account for business {}",
                    fallback.getName(),
                    fallback.getCode(),
                    businessId);
              },
              () ->
                  log.warn(
                      "No miscellaneous expense account for business {}; "
                          + "uncategorised expenses cannot be imported",
                      businessId));
    }
    return builder.build();
  }

  private static boolean isOperatingExpenseCode(String code) {
    try {
      int value = Integer.parseInt(code);
      return value >= 5000 && value < 8000;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static DefaultAccount of(
      String code, String name, AccountType type, String description) {
    return new DefaultAccount(code, name, type, description);
  }

  private record DefaultAccount(String code, String name, AccountType type, String description) {}
}
