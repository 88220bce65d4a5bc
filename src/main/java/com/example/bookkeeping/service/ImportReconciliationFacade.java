package com.example.bookkeeping.service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.example.bookkeeping.domain.ExtractedDocumentData;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.ReconciliationStatus.State;
import com.example.bookkeeping.exception.ErrorCode;
import com.example.bookkeeping.exception.ReconciliationEngineException;
import com.example.bookkeeping.security.ActingScope;
import com.example.bookkeeping.security.ReconciliationAccessGuard;
import com.example.bookkeeping.service.DocumentMatchingService.DocumentProcessingResult;
import com.example.bookkeeping.service.ReconciliationService.AutoReconcileResult;
import com.example.bookkeeping.service.ReconciliationService.BulkReconcileResult;
import com.example.bookkeeping.service.ReconciliationService.ReconciliationRequest;
import com.example.bookkeeping.service.ReconciliationService.ReconciliationSummary;
import com.example.bookkeeping.service.ReconciliationService.UnmatchedTransaction;

/**
 * Entry point for the surrounding application. Every operation returns an {@link OperationResult};
 * exceptions are logged and turned into failures with an error code.
 */
@Service
public class ImportReconciliationFacade {

  private static final Logger log = LoggerFactory.getLogger(ImportReconciliationFacade.class);

  static final int DEFAULT_SUMMARY_DAYS = 90;

  private final TransactionBatchProcessor batchProcessor;
  private final ChartOfAccountsService chartOfAccountsService;
  private final DocumentMatchingService documentMatchingService;
  private final ReconciliationService reconciliationService;
  private final ReconciliationMatcher matcher;
  private final ReconciliationAccessGuard accessGuard;
  private final ProcessorConfig defaultProcessorConfig;
  private final MatcherSettings defaultMatcherSettings;
  private final Clock clock;

  public ImportReconciliationFacade(
      TransactionBatchProcessor batchProcessor,
      ChartOfAccountsService chartOfAccountsService,
      DocumentMatchingService documentMatchingService,
      ReconciliationService reconciliationService,
      ReconciliationMatcher matcher,
      ReconciliationAccessGuard accessGuard,
      ProcessorConfig defaultProcessorConfig,
      MatcherSettings defaultMatcherSettings,
      Clock clock) {
    this.batchProcessor = batchProcessor;
    this.chartOfAccountsService = chartOfAccountsService;
    this.documentMatchingService = documentMatchingService;
    this.reconciliationService = reconciliationService;
    this.matcher = matcher;
    this.accessGuard = accessGuard;
    this.defaultProcessorConfig = defaultProcessorConfig;
    this.defaultMatcherSettings = defaultMatcherSettings;
    this.clock = clock;
  }

  /**
   * Imports bank transactions using the business's current chart of accounts, posting cash to the
   * general cash account.
   *
   * @param importDocumentId the uploaded statement, or null
   * @param config chunking and retry settings, or null for the configured defaults
   */
  public OperationResult<ProcessingResult> importStatement(
      ActingScope scope,
      List<RawTransaction> transactions,
      Long importDocumentId,
      ProcessorConfig config,
      ProgressChannel progress) {
    return run(
        "importStatement",
        () -> {
          accessGuard.checkPermitted(scope);
          ProcessingContext context =
              new ProcessingContext(
                  scope.businessId(),
                  scope.actorId(),
                  importDocumentId,
                  chartOfAccountsService.buildAccountMap(scope.businessId(), Map.of()));
          return batchProcessor.processTransactions(
              transactions,
              context,
              config != null ? config : defaultProcessorConfig,
              progress != null ? progress : ProgressChannel.DISCARD);
        });
  }

  /** Imports bank transactions with an explicit processing context. */
  public OperationResult<ProcessingResult> processTransactions(
      ActingScope scope,
      List<RawTransaction> transactions,
      ProcessingContext context,
      ProcessorConfig config,
      ProgressChannel progress) {
    return run(
        "processTransactions",
        () -> {
          accessGuard.checkPermitted(scope);
          if (!scope.businessId().equals(context.businessId())) {
            throw new AccessDeniedException("Import context belongs to another business");
          }
          return batchProcessor.processTransactions(
              transactions,
              context,
              config != null ? config : defaultProcessorConfig,
              progress != null ? progress : ProgressChannel.DISCARD);
        });
  }

  public OperationResult<DocumentProcessingResult> processDocument(
      ActingScope scope, Long documentId) {
    return run(
        "processDocument",
        () -> documentMatchingService.processDocument(scope, documentId, defaultMatcherSettings));
  }

  public OperationResult<List<MatchSuggestion>> findMatches(
      ExtractedDocumentData extracted, List<TransactionCandidate> candidates) {
    return run(
        "findMatches",
        () -> matcher.findMatches(extracted, candidates, defaultMatcherSettings));
  }

  public OperationResult<AutoReconcileResult> autoReconcile(ActingScope scope) {
    return run("autoReconcile", () -> reconciliationService.autoReconcile(scope));
  }

  public OperationResult<ReconciliationStatus> manualMatch(
      ActingScope scope, Long transactionId, Long documentId, String notes) {
    return run(
        "manualMatch",
        () -> reconciliationService.manualMatch(scope, transactionId, documentId, notes));
  }

  public OperationResult<BulkReconcileResult> bulkReconcile(
      ActingScope scope, List<ReconciliationRequest> requests) {
    return run("bulkReconcile", () -> reconciliationService.bulkReconcile(scope, requests));
  }

  public OperationResult<ReconciliationStatus> unmatch(
      ActingScope scope, Long transactionId, String notes) {
    return run("unmatch", () -> reconciliationService.unmatch(scope, transactionId, notes));
  }

  public OperationResult<ReconciliationStatus> exclude(
      ActingScope scope, Long transactionId, String notes) {
    return run("exclude", () -> reconciliationService.exclude(scope, transactionId, notes));
  }

  public OperationResult<ReconciliationStatus> updateStatus(
      ActingScope scope, Long transactionId, State state, Long documentId, String notes) {
    return run(
        "updateStatus",
        () -> reconciliationService.updateStatus(scope, transactionId, state, documentId, notes));
  }

  /** Summarises reconciliation; missing dates default to the last 90 days. */
  public OperationResult<ReconciliationSummary> summarize(
      ActingScope scope, LocalDate from, LocalDate to) {
    LocalDate end = to != null ? to : LocalDate.now(clock);
    LocalDate start = from != null ? from : end.minusDays(DEFAULT_SUMMARY_DAYS);
    return run("summarize", () -> reconciliationService.summarize(scope, start, end));
  }

  public OperationResult<Page<UnmatchedTransaction>> findUnmatched(
      ActingScope scope, LocalDate from, LocalDate to, Pageable pageable) {
    LocalDate end = to != null ? to : LocalDate.now(clock);
    LocalDate start = from != null ? from : end.minusDays(DEFAULT_SUMMARY_DAYS);
    return run(
        "findUnmatched", () -> reconciliationService.findUnmatched(scope, start, end, pageable));
  }

  private <T> OperationResult<T> run(String operation, Supplier<T> action) {
    try {
      return OperationResult.success(action.get());
    } catch (ReconciliationEngineException e) {
      log.warn("{} failed: {}", operation, e.getMessage());
      return OperationResult.failure(e.getErrorCode(), e.getMessage());
    } catch (AccessDeniedException e) {
      log.warn("{} denied: {}", operation, e.getMessage());
      return OperationResult.failure(ErrorCode.ACCESS_DENIED, e.getMessage());
    } catch (IllegalArgumentException e) {
      log.warn("{} rejected: {}", operation, e.getMessage());
      return OperationResult.failure(ErrorCode.INVALID_INPUT, e.getMessage());
    } catch (DataAccessException | TransactionException e) {
      log.error("{} failed in the database", operation, e);
      return OperationResult.failure(ErrorCode.PERSISTENCE, e.getMessage());
    } catch (RuntimeException e) {
      log.error("{} failed unexpectedly", operation, e);
      return OperationResult.failure(ErrorCode.INTERNAL, "Unexpected error: " + e.getMessage());
    }
  }
}
