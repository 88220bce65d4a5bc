package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.example.bookkeeping.domain.Document.ProcessingStatus;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.JournalLine;
import com.example.bookkeeping.domain.RawTransaction;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.ChartOfAccountsException;
import com.example.bookkeeping.exception.ErrorCode;
import com.example.bookkeeping.exception.ReconciliationEngineException;
import com.example.bookkeeping.persistence.ImportPersistencePort;
import com.example.bookkeeping.service.ProcessingProgress.Status;
import com.example.bookkeeping.service.ProcessingResult.ProcessingError;

/**
 * Imports bank transactions into the ledger in chunks.
 *
 * <p>Chunks run one after another. Within a chunk, transactions already imported are skipped,
 * transactions that cannot be posted are recorded as failed, and the rest are written together
 * with their journal entries in one bounded database transaction. A chunk whose write fails with a
 * transient database error is retried as a whole with exponential backoff; once the attempts are
 * used up every transaction of the chunk counts as failed. Because the chunk transaction is all or
 * nothing, a retry never finds rows from an earlier attempt.
 */
@Service
public class TransactionBatchProcessor {

  private static final Logger log = LoggerFactory.getLogger(TransactionBatchProcessor.class);

  private final ImportPersistencePort persistence;
  private final ChartOfAccountsResolver resolver;
  private final ApplicationEventPublisher eventPublisher;
  private final Sleeper sleeper;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public TransactionBatchProcessor(
      ImportPersistencePort persistence,
      ChartOfAccountsResolver resolver,
      ApplicationEventPublisher eventPublisher,
      Sleeper sleeper,
      ObjectMapper objectMapper,
      Clock clock) {
    this.persistence = persistence;
    this.resolver = resolver;
    this.eventPublisher = eventPublisher;
    this.sleeper = sleeper;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Imports the transactions for the context's business.
   *
   * @param transactions the transactions, in statement order
   * @param context business, actor, import document and chart of accounts
   * @param config chunk size, timeout and retry settings
   * @param progress receives one event per chunk and a final one
   * @return counts, errors and the ids of the persisted transactions
   * @throws ChartOfAccountsException if the chart of accounts cannot post the input; nothing is
   *     persisted in that case
   */
  public ProcessingResult processTransactions(
      List<RawTransaction> transactions,
      ProcessingContext context,
      ProcessorConfig config,
      ProgressChannel progress) {
    int total = transactions.size();
    int totalBatches = (total + config.batchSize() - 1) / config.batchSize();
    log.info(
        "Importing {} transactions for business {} in {} chunks",
        total,
        context.businessId(),
        totalBatches);

    JournalEntryFactory factory;
    try {
      factory = new JournalEntryFactory(context.accountMap());
      resolver.verifyFallbacks(transactions, context.accountMap());
    } catch (ChartOfAccountsException e) {
      log.error("Import for business {} rejected: {}", context.businessId(), e.getMessage());
      progress.publish(new ProcessingProgress(total, 0, 0, totalBatches, Status.FAILED));
      updateImportDocument(
          context,
          ProcessingStatus.FAILED,
          new ProcessingResult(
              0,
              total,
              0,
              List.of(
                  new ProcessingError(
                      null, null, null, total, e.getErrorCode(), e.getMessage())),
              List.of()));
      throw e;
    }

    RetryTemplate retryTemplate = retryTemplate(config);
    // External ids written by an earlier chunk of this import.
    Set<String> committedExternalIds = new HashSet<>();
    List<ProcessingError> errors = new ArrayList<>();
    List<Long> transactionIds = new ArrayList<>();
    int imported = 0;
    int failed = 0;
    int skipped = 0;

    for (int batch = 0; batch < totalBatches; batch++) {
      int chunkNumber = batch + 1;
      int start = batch * config.batchSize();
      int end = Math.min(start + config.batchSize(), total);
      List<RawTransaction> chunk = transactions.subList(start, end);

      Set<String> existing;
      try {
        existing = retryTemplate.execute(ctx -> existingExternalIds(context, chunk));
      } catch (RuntimeException e) {
        log.error(
            "Chunk {} of business {} failed looking up existing transactions: {}",
            chunkNumber,
            context.businessId(),
            e.getMessage());
        failed += chunk.size();
        errors.add(
            ProcessingError.forChunk(
                chunkNumber, chunk.size(), ErrorCode.PERSISTENCE, describe(e)));
        progress.publish(
            new ProcessingProgress(total, end, chunkNumber, totalBatches, Status.PROCESSING));
        continue;
      }

      List<PreparedTransaction> prepared = new ArrayList<>();
      Set<String> pendingExternalIds = new HashSet<>();
      for (int i = start; i < end; i++) {
        RawTransaction transaction = transactions.get(i);
        if (transaction.hasExternalId()
            && (existing.contains(transaction.externalId())
                || committedExternalIds.contains(transaction.externalId())
                || pendingExternalIds.contains(transaction.externalId()))) {
          skipped++;
          continue;
        }
        try {
          Long categoryAccountId =
              resolver.resolveAccount(transaction, context.accountMap()).orElse(null);
          JournalEntrySet entries = factory.createJournalEntries(transaction, categoryAccountId);
          prepared.add(
              new PreparedTransaction(
                  transaction, categoryAccountId, factory.postedAmount(transaction), entries));
          if (transaction.hasExternalId()) {
            pendingExternalIds.add(transaction.externalId());
          }
        } catch (ReconciliationEngineException | IllegalArgumentException e) {
          log.debug("Transaction #{} rejected: {}", i + 1, e.getMessage());
          failed++;
          errors.add(
              ProcessingError.forTransaction(
                  chunkNumber,
                  i,
                  transaction.externalId(),
                  e instanceof ReconciliationEngineException engineError
                      ? engineError.getErrorCode()
                      : ErrorCode.INVALID_INPUT,
                  e.getMessage()));
        }
      }

      if (!prepared.isEmpty()) {
        try {
          List<Long> ids =
              retryTemplate.execute(
                  ctx ->
                      persistence.inBoundedTransaction(
                          config.transactionTimeout(), () -> insertChunk(prepared, context)));
          imported += ids.size();
          transactionIds.addAll(ids);
          committedExternalIds.addAll(pendingExternalIds);
          log.info(
              "Chunk {}/{} for business {}: {} transactions imported",
              chunkNumber,
              totalBatches,
              context.businessId(),
              ids.size());
          publishUsage(context, ids.size());
        } catch (DataAccessException | TransactionException e) {
          log.error(
              "Chunk {}/{} for business {} failed after {} attempts: {}",
              chunkNumber,
              totalBatches,
              context.businessId(),
              config.maxRetries(),
              e.getMessage());
          failed += prepared.size();
          errors.add(
              ProcessingError.forChunk(
                  chunkNumber, prepared.size(), ErrorCode.PERSISTENCE, describe(e)));
        } catch (RuntimeException e) {
          log.error(
              "Chunk {}/{} for business {} failed unexpectedly",
              chunkNumber,
              totalBatches,
              context.businessId(),
              e);
          failed += prepared.size();
          errors.add(
              ProcessingError.forChunk(
                  chunkNumber, prepared.size(), ErrorCode.INTERNAL, describe(e)));
        }
      }

      progress.publish(
          new ProcessingProgress(total, end, chunkNumber, totalBatches, Status.PROCESSING));
    }

    ProcessingResult result =
        new ProcessingResult(imported, failed, skipped, errors, transactionIds);
    log.info(
        "Import for business {} finished: {} imported, {} skipped, {} failed",
        context.businessId(),
        imported,
        skipped,
        failed);
    progress.publish(
        new ProcessingProgress(total, total, totalBatches, totalBatches, Status.COMPLETED));
    updateImportDocument(
        context,
        result.hasFailures() ? ProcessingStatus.FAILED : ProcessingStatus.COMPLETED,
        result);
    return result;
  }

  private Set<String> existingExternalIds(ProcessingContext context, List<RawTransaction> chunk) {
    Set<String> externalIds =
        chunk.stream()
            .filter(RawTransaction::hasExternalId)
            .map(RawTransaction::externalId)
            .collect(Collectors.toSet());
    if (externalIds.isEmpty()) {
      return Set.of();
    }
    return persistence.existingExternalIds(context.businessId(), externalIds);
  }

  /** Writes one chunk. Runs inside the bounded transaction, once per attempt. */
  private List<Long> insertChunk(List<PreparedTransaction> prepared, ProcessingContext context) {
    List<Transaction> entities = new ArrayList<>(prepared.size());
    for (PreparedTransaction item : prepared) {
      entities.add(
          item.transaction()
              .toEntity(
                  context.businessId(),
                  item.categoryAccountId(),
                  context.actorId(),
                  item.postedAmount()));
    }
    List<Transaction> saved = persistence.bulkInsertTransactions(entities);

    List<JournalEntry> entries = new ArrayList<>();
    List<Long> ids = new ArrayList<>(saved.size());
    for (int i = 0; i < saved.size(); i++) {
      Long transactionId = saved.get(i).getId();
      ids.add(transactionId);
      for (JournalLine line : prepared.get(i).entries().entries()) {
        entries.add(new JournalEntry(transactionId, line));
      }
    }
    if (!entries.isEmpty()) {
      persistence.bulkInsertJournalEntries(entries);
    }
    return ids;
  }

  private void publishUsage(ProcessingContext context, int count) {
    try {
      eventPublisher.publishEvent(new TransactionsImportedEvent(context.businessId(), count));
    } catch (RuntimeException e) {
      log.warn("Could not publish usage for business {}: {}", context.businessId(), e.getMessage());
    }
  }

  /** Records the outcome on the import document. Failures are logged, never propagated. */
  private void updateImportDocument(
      ProcessingContext context, ProcessingStatus status, ProcessingResult result) {
    if (context.importDocumentId() == null) {
      return;
    }
    try {
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("imported", result.imported());
      metadata.put("failed", result.failed());
      metadata.put("skipped", result.skipped());
      metadata.put("errors", result.errors());
      metadata.put("importedAt", Instant.now(clock).toString());
      persistence.updateImportDocument(
          context.importDocumentId(), status, objectMapper.writeValueAsString(metadata));
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn(
          "Failed to update import document {}: {}", context.importDocumentId(), e.getMessage());
    }
  }

  private RetryTemplate retryTemplate(ProcessorConfig config) {
    Map<Class<? extends Throwable>, Boolean> retryable =
        Map.of(DataAccessException.class, true, TransactionException.class, true);

    ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
    long initial = Math.max(1L, config.baseBackoff().toMillis());
    backOff.setInitialInterval(initial);
    backOff.setMultiplier(2.0);
    backOff.setMaxInterval(initial << Math.min(config.maxRetries(), 16));
    backOff.setSleeper(sleeper);

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(new SimpleRetryPolicy(config.maxRetries(), retryable, true));
    template.setBackOffPolicy(backOff);
    template.registerListener(
        new RetryListener() {
          @Override
          public <T, E extends Throwable> void onError(
              RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            log.warn(
                "Attempt {} of {} failed: {}",
                context.getRetryCount(),
                config.maxRetries(),
                throwable.getMessage());
          }
        });
    return template;
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private record PreparedTransaction(
      RawTransaction transaction,
      Long categoryAccountId,
      BigDecimal postedAmount,
      JournalEntrySet entries) {}
}
