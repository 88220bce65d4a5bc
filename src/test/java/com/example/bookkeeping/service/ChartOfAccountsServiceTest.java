package com.example.bookkeeping.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.LedgerAccount;
import com.example.bookkeeping.domain.LedgerAccount.AccountType;
import com.example.bookkeeping.repository.LedgerAccountRepository;

@ExtendWith(MockitoExtension.class)
class ChartOfAccountsServiceTest {

  private static final Long BUSINESS_ID = 1L;

  @Mock private LedgerAccountRepository accountRepository;

  private ChartOfAccountsService chartOfAccountsService;

  @BeforeEach
  void setUp() {
    chartOfAccountsService = new ChartOfAccountsService(accountRepository);
  }

  @Test
  void createDefaultChart_newBusiness_createsEveryDefaultAccount() {
    // Given
    when(accountRepository.findByBusinessIdAndCode(any(), any())).thenReturn(Optional.empty());
    when(accountRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

    // When
    List<LedgerAccount> created = chartOfAccountsService.createDefaultChart(BUSINESS_ID);

    // Then
    assertEquals(34, created.size());
    List<String> codes = created.stream().map(LedgerAccount::getCode).toList();
    assertTrue(codes.containsAll(List.of("1000", "2300", "4000", "6900", "6950")));
    assertTrue(created.stream().allMatch(account -> BUSINESS_ID.equals(account.getBusinessId())));
  }

  @Test
  void createDefaultChart_existingCodes_areLeftAlone() {
    // Given
    when(accountRepository.findByBusinessIdAndCode(any(), any()))
        .thenAnswer(
            inv ->
                "1000".equals(inv.getArgument(1))
                    ? Optional.of(account(1L, "1000", "Checking", AccountType.ASSET))
                    : Optional.empty());
    when(accountRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

    // When
    List<LedgerAccount> created = chartOfAccountsService.createDefaultChart(BUSINESS_ID);

    // Then
    assertEquals(33, created.size());
    assertTrue(created.stream().noneMatch(account -> "1000".equals(account.getCode())));
  }

  @Test
  void buildAccountMap_defaultChart_mapsEveryPostingRole() {
    // Given
    when(accountRepository.findByBusinessIdAndActiveTrueOrderByCode(BUSINESS_ID))
        .thenReturn(
            List.of(
                account(1L, "1000", "Cash", AccountType.ASSET),
                account(2L, "1100", "Accounts Receivable", AccountType.ASSET),
                account(3L, "2300", "Sales Tax Payable", AccountType.LIABILITY),
                account(4L, "2400", "Loans Payable", AccountType.LIABILITY),
                account(5L, "4000", "Sales Revenue", AccountType.INCOME),
                account(6L, "4100", "Other Revenue", AccountType.INCOME),
                account(7L, "6300", "Office Supplies", AccountType.EXPENSE),
                account(8L, "6900", "Miscellaneous Expense", AccountType.EXPENSE),
                account(9L, "6950", "Interest Expense", AccountType.EXPENSE)));

    // When
    ChartOfAccountsMap map = chartOfAccountsService.buildAccountMap(BUSINESS_ID, Map.of());

    // Then
    assertEquals(Optional.of(1L), map.find(AccountRole.CASH));
    assertEquals(Optional.of(2L), map.find(AccountRole.ACCOUNTS_RECEIVABLE));
    assertEquals(Optional.of(3L), map.find(AccountRole.SALES_TAX_PAYABLE));
    assertEquals(Optional.of(4L), map.find(AccountRole.LOANS_PAYABLE));
    assertEquals(Optional.of(5L), map.find(AccountRole.SALES_REVENUE));
    assertEquals(Optional.of(6L), map.find(AccountRole.OTHER_INCOME));
    assertEquals(Optional.of(8L), map.find(AccountRole.MISCELLANEOUS));
    assertEquals(Optional.of(9L), map.find(AccountRole.INTEREST_EXPENSE));
    assertEquals(Optional.of(7L), map.findByName("office supplies"));
    assertFalse(map.has(AccountRole.CREDIT_CARDS));
  }

  @Test
  void buildAccountMap_withoutMiscellaneous_fallsBackToFirstOperatingExpense() {
    when(accountRepository.findByBusinessIdAndActiveTrueOrderByCode(BUSINESS_ID))
        .thenReturn(
            List.of(
                account(1L, "1000", "Cash", AccountType.ASSET),
                account(5L, "4000", "Sales Revenue", AccountType.INCOME),
                account(7L, "6100", "Rent Expense", AccountType.EXPENSE),
                account(8L, "6300", "Office Supplies", AccountType.EXPENSE)));

    ChartOfAccountsMap map = chartOfAccountsService.buildAccountMap(BUSINESS_ID, Map.of());

    assertEquals(Optional.of(7L), map.find(AccountRole.MISCELLANEOUS));
  }

  @Test
  void buildAccountMap_bankLedgerAccounts_backTheirBankAccounts() {
    when(accountRepository.findByBusinessIdAndActiveTrueOrderByCode(BUSINESS_ID))
        .thenReturn(List.of(account(1L, "1000", "Cash", AccountType.ASSET)));

    ChartOfAccountsMap map = chartOfAccountsService.buildAccountMap(BUSINESS_ID, Map.of(500L, 77L));

    assertEquals(Optional.of(77L), map.cashAccountFor(500L));
    assertEquals(Optional.of(1L), map.cashAccountFor(501L));
  }

  private static LedgerAccount account(Long id, String code, String name, AccountType type) {
    LedgerAccount account = new LedgerAccount(BUSINESS_ID, code, name, type);
    account.setId(id);
    return account;
  }
}
