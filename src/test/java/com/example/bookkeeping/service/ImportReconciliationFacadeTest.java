package com.example.bookkeeping.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import com.example.bookkeeping.domain.AccountRole;
import com.example.bookkeeping.domain.ChartOfAccountsMap;
import com.example.bookkeeping.domain.ExtractedDocumentData;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.ReconciliationStatus.State;
import com.example.bookkeeping.exception.ChartOfAccountsException;
import com.example.bookkeeping.exception.DocumentExtractionException;
import com.example.bookkeeping.exception.ErrorCode;
import com.example.bookkeeping.exception.NotFoundException;
import com.example.bookkeeping.security.AccessDecision;
import com.example.bookkeeping.security.ActingScope;
import com.example.bookkeeping.security.ReconciliationAccessGuard;
import com.example.bookkeeping.service.ReconciliationService.AutoReconcileResult;
import com.example.bookkeeping.service.ReconciliationService.ReconciliationSummary;

@ExtendWith(MockitoExtension.class)
class ImportReconciliationFacadeTest {

  private static final Long BUSINESS_ID = 1L;
  private static final Long USER_ID = 42L;

  @Mock private TransactionBatchProcessor batchProcessor;
  @Mock private ChartOfAccountsService chartOfAccountsService;
  @Mock private DocumentMatchingService documentMatchingService;
  @Mock private ReconciliationService reconciliationService;

  private final ActingScope scope = ActingScope.permitted(BUSINESS_ID, USER_ID);
  private final ChartOfAccountsMap accountMap =
      ChartOfAccountsMap.builder(BUSINESS_ID)
          .role(AccountRole.CASH, 1L)
          .role(AccountRole.SALES_REVENUE, 2L)
          .build();

  private ImportReconciliationFacade facade;

  @BeforeEach
  void setUp() {
    facade =
        new ImportReconciliationFacade(
            batchProcessor,
            chartOfAccountsService,
            documentMatchingService,
            reconciliationService,
            new ReconciliationMatcher(MatcherSettings.defaults()),
            new ReconciliationAccessGuard(),
            ProcessorConfig.defaults(),
            MatcherSettings.defaults(),
            Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void importStatement_buildsContextAndAppliesDefaults() {
    // Given
    List<RawTransaction> statement = List.of(AccountFixtures.income("10.00", "Sale").build());
    ProcessingResult processed = new ProcessingResult(1, 0, 0, List.of(), List.of(100L));
    when(chartOfAccountsService.buildAccountMap(BUSINESS_ID, Map.of())).thenReturn(accountMap);
    when(batchProcessor.processTransactions(any(), any(), any(), any())).thenReturn(processed);

    // When
    OperationResult<ProcessingResult> result =
        facade.importStatement(scope, statement, 300L, null, null);

    // Then
    assertTrue(result.success());
    assertSame(processed, result.data());
    ArgumentCaptor<ProcessingContext> context = ArgumentCaptor.forClass(ProcessingContext.class);
    verify(batchProcessor)
        .processTransactions(
            eq(statement),
            context.capture(),
            eq(ProcessorConfig.defaults()),
            eq(ProgressChannel.DISCARD));
    assertEquals(USER_ID, context.getValue().actorId());
    assertEquals(300L, context.getValue().importDocumentId());
    assertSame(accountMap, context.getValue().accountMap());
  }

  @Test
  void importStatement_configurationProblem_returnsConfigurationError() {
    when(chartOfAccountsService.buildAccountMap(BUSINESS_ID, Map.of())).thenReturn(accountMap);
    when(batchProcessor.processTransactions(any(), any(), any(), any()))
        .thenThrow(new ChartOfAccountsException("transaction #6 has no fallback"));

    OperationResult<ProcessingResult> result =
        facade.importStatement(scope, List.of(), null, null, null);

    assertFalse(result.success());
    assertEquals(ErrorCode.CONFIGURATION, result.errorCode());
    assertEquals("transaction #6 has no fallback", result.error());
  }

  @Test
  void importStatement_deniedScope_neverReachesProcessor() {
    ActingScope denied = new ActingScope(BUSINESS_ID, USER_ID, AccessDecision.DENIED);

    OperationResult<ProcessingResult> result =
        facade.importStatement(denied, List.of(), null, null, null);

    assertEquals(ErrorCode.ACCESS_DENIED, result.errorCode());
    verifyNoInteractions(batchProcessor, chartOfAccountsService);
  }

  @Test
  void processTransactions_contextOfAnotherBusiness_isDenied() {
    ChartOfAccountsMap foreignMap =
        ChartOfAccountsMap.builder(2L)
            .role(AccountRole.CASH, 1L)
            .role(AccountRole.SALES_REVENUE, 2L)
            .build();
    ProcessingContext foreign = new ProcessingContext(2L, USER_ID, null, foreignMap);

    OperationResult<ProcessingResult> result =
        facade.processTransactions(scope, List.of(), foreign, null, null);

    assertEquals(ErrorCode.ACCESS_DENIED, result.errorCode());
    verifyNoInteractions(batchProcessor);
  }

  @Test
  void manualMatch_unknownTransaction_returnsNotFound() {
    when(reconciliationService.manualMatch(scope, 99L, 10L, null))
        .thenThrow(new NotFoundException("Transaction", 99L));

    OperationResult<ReconciliationStatus> result = facade.manualMatch(scope, 99L, 10L, null);

    assertEquals(ErrorCode.NOT_FOUND, result.errorCode());
    assertNull(result.data());
  }

  @Test
  void updateStatus_invalidArguments_returnsInvalidInput() {
    when(reconciliationService.updateStatus(scope, 1L, State.MATCHED, null, null))
        .thenThrow(new IllegalArgumentException("State MATCHED requires a document"));

    OperationResult<ReconciliationStatus> result =
        facade.updateStatus(scope, 1L, State.MATCHED, null, null);

    assertEquals(ErrorCode.INVALID_INPUT, result.errorCode());
  }

  @Test
  void autoReconcile_databaseTimeout_returnsPersistenceError() {
    when(reconciliationService.autoReconcile(scope))
        .thenThrow(new QueryTimeoutException("statement timeout"));

    OperationResult<AutoReconcileResult> result = facade.autoReconcile(scope);

    assertEquals(ErrorCode.PERSISTENCE, result.errorCode());
  }

  @Test
  void unmatch_unexpectedFailure_returnsInternalError() {
    when(reconciliationService.unmatch(scope, 1L, null))
        .thenThrow(new IllegalStateException("boom"));

    OperationResult<ReconciliationStatus> result = facade.unmatch(scope, 1L, null);

    assertEquals(ErrorCode.INTERNAL, result.errorCode());
    assertEquals("Unexpected error: boom", result.error());
  }

  @Test
  void processDocument_extractionFailure_returnsExtractionError() {
    when(documentMatchingService.processDocument(scope, 10L, MatcherSettings.defaults()))
        .thenThrow(new DocumentExtractionException("Service unavailable"));

    assertEquals(ErrorCode.EXTRACTION, facade.processDocument(scope, 10L).errorCode());
  }

  @Test
  void summarize_withoutDates_coversTheLastNinetyDays() {
    ReconciliationSummary summary =
        ReconciliationSummary.empty(LocalDate.of(2023, 12, 16), LocalDate.of(2024, 3, 15));
    when(reconciliationService.summarize(
            scope, LocalDate.of(2023, 12, 16), LocalDate.of(2024, 3, 15)))
        .thenReturn(summary);

    OperationResult<ReconciliationSummary> result = facade.summarize(scope, null, null);

    assertTrue(result.success());
    assertSame(summary, result.data());
  }

  @Test
  void findMatches_returnsScoredSuggestions() {
    ExtractedDocumentData receipt =
        new ExtractedDocumentData(
            "Staples", new BigDecimal("52.30"), LocalDate.of(2024, 3, 10), null, 0.9, List.of());
    TransactionCandidate candidate =
        new TransactionCandidate(
            1L, LocalDate.of(2024, 3, 10), new BigDecimal("52.30"), "STAPLES STORE #4421");

    OperationResult<List<MatchSuggestion>> result =
        facade.findMatches(receipt, List.of(candidate));

    assertTrue(result.success());
    assertEquals(1, result.data().size());
  }
}
