package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.bookkeeping.domain.Document;
import com.example.bookkeeping.domain.DocumentMatch;
import com.example.bookkeeping.domain.DocumentMatch.MatchStatus;
import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.ReconciliationStatus.State;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.NotFoundException;
import com.example.bookkeeping.repository.DocumentMatchRepository;
import com.example.bookkeeping.repository.DocumentRepository;
import com.example.bookkeeping.repository.ReconciliationStatusRepository;
import com.example.bookkeeping.repository.TransactionRepository;
import com.example.bookkeeping.security.ActingScope;
import com.example.bookkeeping.security.ReconciliationAccessGuard;

/**
 * Moves transactions through their reconciliation states.
 *
 * <p>A transaction without a status row is unmatched, or pending review when it has suggested
 * matches. The automatic sweep only creates status rows, so it never overrides a decision a user
 * made. Manual actions always record the reviewer and mark the row as manually set.
 *
 * <p>Whenever a status points at a document, that document points back at the same transaction.
 * Every mutating operation checks the acting scope before it writes anything.
 */
@Service
@Transactional
public class ReconciliationService {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

  private static final Set<State> DOCUMENT_STATES =
      EnumSet.of(State.MATCHED, State.MANUALLY_MATCHED, State.PARTIALLY_MATCHED);

  private final TransactionRepository transactionRepository;
  private final DocumentRepository documentRepository;
  private final DocumentMatchRepository documentMatchRepository;
  private final ReconciliationStatusRepository statusRepository;
  private final ReconciliationAccessGuard accessGuard;
  private final MatcherSettings matcherSettings;

  public ReconciliationService(
      TransactionRepository transactionRepository,
      DocumentRepository documentRepository,
      DocumentMatchRepository documentMatchRepository,
      ReconciliationStatusRepository statusRepository,
      ReconciliationAccessGuard accessGuard,
      MatcherSettings matcherSettings) {
    this.transactionRepository = transactionRepository;
    this.documentRepository = documentRepository;
    this.documentMatchRepository = documentMatchRepository;
    this.statusRepository = statusRepository;
    this.accessGuard = accessGuard;
    this.matcherSettings = matcherSettings;
  }

  /**
   * Reconciles every transaction of the business that has no status yet and a suggested match at
   * or above the auto-reconcile threshold, using its best match.
   */
  public AutoReconcileResult autoReconcile(ActingScope scope) {
    accessGuard.checkPermitted(scope);

    List<DocumentMatch> candidates =
        documentMatchRepository.findAutoReconcileCandidates(
            scope.businessId(), MatchStatus.SUGGESTED, matcherSettings.autoReconcileThreshold());

    Set<Long> processed = new HashSet<>();
    int matched = 0;
    for (DocumentMatch match : candidates) {
      // Candidates are ordered best first within each transaction.
      if (!processed.add(match.getTransactionId())) {
        continue;
      }
      Document document =
          documentRepository
              .findByIdAndBusinessId(match.getDocumentId(), scope.businessId())
              .orElse(null);
      if (document == null
          || (document.getTransactionId() != null
              && !document.getTransactionId().equals(match.getTransactionId()))) {
        log.debug(
            "Skipping auto-match of transaction {}: document {} unavailable",
            match.getTransactionId(),
            match.getDocumentId());
        continue;
      }

      ReconciliationStatus status = new ReconciliationStatus(match.getTransactionId());
      status.markMatched(document.getId(), match.getConfidence(), null);
      statusRepository.save(status);

      match.setStatus(MatchStatus.CONFIRMED);
      documentMatchRepository.save(match);

      document.linkTo(match.getTransactionId());
      documentRepository.save(document);
      matched++;
    }

    log.info(
        "Auto-reconciled {} of {} candidate transactions for business {}",
        matched,
        processed.size(),
        scope.businessId());
    return new AutoReconcileResult(processed.size(), matched);
  }

  /**
   * Links a document to a transaction on a user's instruction. Calling it again with the same pair
   * leaves the state unchanged. A document linked to another transaction is moved, and that
   * transaction returns to unmatched.
   */
  public ReconciliationStatus manualMatch(
      ActingScope scope, Long transactionId, Long documentId, String notes) {
    Transaction transaction = loadTransaction(scope, transactionId);
    Document document = loadDocument(scope, documentId);

    ReconciliationStatus status = applyManualMatch(scope, transaction, document, 1.0, notes);
    log.info(
        "Transaction {} manually matched to document {} by user {}",
        transactionId,
        documentId,
        scope.actorId());
    return status;
  }

  /**
   * Applies manual matches in bulk. Requests for transactions that already have a status, repeats
   * of a transaction or document within the list, and documents linked elsewhere are skipped.
   */
  public BulkReconcileResult bulkReconcile(
      ActingScope scope, List<ReconciliationRequest> requests) {
    accessGuard.checkPermitted(scope);
    if (requests.isEmpty()) {
      return new BulkReconcileResult(0, 0);
    }

    Set<Long> transactionIds =
        requests.stream().map(ReconciliationRequest::transactionId).collect(Collectors.toSet());
    Set<Long> documentIds =
        requests.stream().map(ReconciliationRequest::documentId).collect(Collectors.toSet());

    Map<Long, Transaction> transactions =
        transactionRepository.findAllById(transactionIds).stream()
            .collect(Collectors.toMap(Transaction::getId, Function.identity()));
    Map<Long, Document> documents =
        documentRepository.findAllById(documentIds).stream()
            .collect(Collectors.toMap(Document::getId, Function.identity()));

    // Check everything before the first write.
    for (Long id : transactionIds) {
      Transaction transaction = transactions.get(id);
      if (transaction == null) {
        throw new NotFoundException("Transaction", id);
      }
      accessGuard.checkTransaction(scope, transaction);
    }
    for (Long id : documentIds) {
      Document document = documents.get(id);
      if (document == null) {
        throw new NotFoundException("Document", id);
      }
      accessGuard.checkDocument(scope, document);
    }

    Set<Long> reconciled =
        statusRepository.findByTransactionIdIn(transactionIds).stream()
            .map(ReconciliationStatus::getTransactionId)
            .collect(Collectors.toSet());

    Set<Long> seenTransactions = new HashSet<>();
    Set<Long> seenDocuments = new HashSet<>();
    List<ReconciliationStatus> statuses = new ArrayList<>();
    List<DocumentMatch> matches = new ArrayList<>();
    List<Document> linked = new ArrayList<>();
    int skipped = 0;

    for (ReconciliationRequest request : requests) {
      Document document = documents.get(request.documentId());
      boolean linkedElsewhere =
          document.getTransactionId() != null
              && !document.getTransactionId().equals(request.transactionId());
      if (reconciled.contains(request.transactionId())
          || linkedElsewhere
          || !seenTransactions.add(request.transactionId())
          || !seenDocuments.add(request.documentId())) {
        skipped++;
        continue;
      }

      ReconciliationStatus status = new ReconciliationStatus(request.transactionId());
      status.markManuallyMatched(
          request.documentId(), request.confidence(), scope.actorId(), "Bulk reconciled");
      statuses.add(status);

      DocumentMatch match =
          documentMatchRepository
              .findByDocumentIdAndTransactionId(request.documentId(), request.transactionId())
              .orElseGet(
                  () ->
                      new DocumentMatch(
                          request.documentId(),
                          request.transactionId(),
                          request.confidence(),
                          MatchStatus.MANUAL,
                          null));
      match.markManual("Bulk reconciled");
      match.setConfidence(request.confidence());
      matches.add(match);

      document.linkTo(request.transactionId());
      linked.add(document);
    }

    statusRepository.saveAll(statuses);
    documentMatchRepository.saveAll(matches);
    documentRepository.saveAll(linked);

    log.info(
        "Bulk reconciled {} transactions for business {}, {} skipped",
        statuses.size(),
        scope.businessId(),
        skipped);
    return new BulkReconcileResult(statuses.size(), skipped);
  }

  /** Removes a transaction's document link and returns it to unmatched. */
  public ReconciliationStatus unmatch(ActingScope scope, Long transactionId, String notes) {
    Transaction transaction = loadTransaction(scope, transactionId);
    ReconciliationStatus status = detach(scope, transaction, State.UNMATCHED, notes);
    log.info("Transaction {} unmatched by user {}", transactionId, scope.actorId());
    return status;
  }

  /** Marks a transaction as not needing reconciliation. */
  public ReconciliationStatus exclude(ActingScope scope, Long transactionId, String notes) {
    Transaction transaction = loadTransaction(scope, transactionId);
    ReconciliationStatus status = detach(scope, transaction, State.EXCLUDED, notes);
    log.info("Transaction {} excluded by user {}", transactionId, scope.actorId());
    return status;
  }

  /**
   * Sets a state chosen by the user. States that carry a document require one and link it like a
   * manual match; the others clear any link.
   */
  public ReconciliationStatus updateStatus(
      ActingScope scope, Long transactionId, State state, Long documentId, String notes) {
    Objects.requireNonNull(state, "State cannot be null");
    if (DOCUMENT_STATES.contains(state)) {
      if (documentId == null) {
        throw new IllegalArgumentException("State " + state + " requires a document");
      }
      Transaction transaction = loadTransaction(scope, transactionId);
      Document document = loadDocument(scope, documentId);
      ReconciliationStatus status = applyManualMatch(scope, transaction, document, 1.0, notes);
      status.setStatus(state);
      return statusRepository.save(status);
    }
    Transaction transaction = loadTransaction(scope, transactionId);
    return detach(scope, transaction, state, notes);
  }

  /** Returns the state a transaction is in, deriving pending review from open suggestions. */
  @Transactional(readOnly = true)
  public State currentState(ActingScope scope, Long transactionId) {
    Transaction transaction = loadTransaction(scope, transactionId);
    return statusRepository
        .findByTransactionId(transaction.getId())
        .map(ReconciliationStatus::getStatus)
        .orElseGet(
            () ->
                documentMatchRepository
                        .findByTransactionIdInAndStatusOrderByConfidenceDesc(
                            List.of(transaction.getId()), MatchStatus.SUGGESTED)
                        .isEmpty()
                    ? State.UNMATCHED
                    : State.PENDING_REVIEW);
  }

  /** Summarises reconciliation progress for transactions dated within the range. */
  @Transactional(readOnly = true)
  public ReconciliationSummary summarize(ActingScope scope, LocalDate from, LocalDate to) {
    accessGuard.checkPermitted(scope);
    List<Transaction> transactions =
        transactionRepository.findByBusinessIdAndDateBetweenOrderByDateDesc(
            scope.businessId(), from, to);
    if (transactions.isEmpty()) {
      return ReconciliationSummary.empty(from, to);
    }

    List<Long> ids = transactions.stream().map(Transaction::getId).toList();
    Map<Long, State> states = new HashMap<>();
    for (ReconciliationStatus status : statusRepository.findByTransactionIdIn(ids)) {
      states.put(status.getTransactionId(), status.getStatus());
    }
    Set<Long> withSuggestions =
        documentMatchRepository
            .findByTransactionIdInAndStatusOrderByConfidenceDesc(ids, MatchStatus.SUGGESTED)
            .stream()
            .map(DocumentMatch::getTransactionId)
            .collect(Collectors.toSet());

    int matched = 0;
    int pendingReview = 0;
    int excluded = 0;
    int unmatched = 0;
    BigDecimal totalAmount = BigDecimal.ZERO;
    BigDecimal matchedAmount = BigDecimal.ZERO;
    BigDecimal unmatchedAmount = BigDecimal.ZERO;

    for (Transaction transaction : transactions) {
      State state = states.get(transaction.getId());
      if (state == null) {
        state =
            withSuggestions.contains(transaction.getId())
                ? State.PENDING_REVIEW
                : State.UNMATCHED;
      }
      totalAmount = totalAmount.add(transaction.getAmount());
      switch (state) {
        case MATCHED, MANUALLY_MATCHED, PARTIALLY_MATCHED -> {
          matched++;
          matchedAmount = matchedAmount.add(transaction.getAmount());
        }
        case PENDING_REVIEW -> {
          pendingReview++;
          unmatchedAmount = unmatchedAmount.add(transaction.getAmount());
        }
        case EXCLUDED -> excluded++;
        case UNMATCHED -> {
          unmatched++;
          unmatchedAmount = unmatchedAmount.add(transaction.getAmount());
        }
      }
    }

    int reconcilable = transactions.size() - excluded;
    BigDecimal matchedPercentage =
        reconcilable == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(matched * 100L)
                .divide(BigDecimal.valueOf(reconcilable), 1, RoundingMode.HALF_UP);

    return new ReconciliationSummary(
        from,
        to,
        transactions.size(),
        matched,
        unmatched,
        pendingReview,
        excluded,
        matchedPercentage,
        totalAmount,
        matchedAmount,
        unmatchedAmount);
  }

  /** Lists transactions still needing a document, with their open suggestions. */
  @Transactional(readOnly = true)
  public Page<UnmatchedTransaction> findUnmatched(
      ActingScope scope, LocalDate from, LocalDate to, Pageable pageable) {
    accessGuard.checkPermitted(scope);
    Page<Transaction> page =
        transactionRepository.findUnreconciled(
            scope.businessId(), from, to, State.UNMATCHED, pageable);
    if (page.isEmpty()) {
      return page.map(transaction -> new UnmatchedTransaction(transaction, List.of()));
    }

    List<Long> ids = page.getContent().stream().map(Transaction::getId).toList();
    Map<Long, List<DocumentMatch>> suggestions =
        documentMatchRepository
            .findByTransactionIdInAndStatusOrderByConfidenceDesc(ids, MatchStatus.SUGGESTED)
            .stream()
            .collect(Collectors.groupingBy(DocumentMatch::getTransactionId));
    return page.map(
        transaction ->
            new UnmatchedTransaction(
                transaction, suggestions.getOrDefault(transaction.getId(), List.of())));
  }

  private ReconciliationStatus applyManualMatch(
      ActingScope scope,
      Transaction transaction,
      Document document,
      double confidence,
      String notes) {
    Long transactionId = transaction.getId();
    Long documentId = document.getId();

    if (document.getTransactionId() != null && !document.getTransactionId().equals(transactionId)) {
      releaseLink(
          scope,
          document.getTransactionId(),
          documentId,
          "Document moved to transaction " + transactionId);
    }

    ReconciliationStatus status =
        statusRepository
            .findByTransactionId(transactionId)
            .orElseGet(() -> new ReconciliationStatus(transactionId));
    if (status.getDocumentId() != null && !status.getDocumentId().equals(documentId)) {
      Long previousDocumentId = status.getDocumentId();
      documentRepository
          .findById(previousDocumentId)
          .filter(previous -> transactionId.equals(previous.getTransactionId()))
          .ifPresent(
              previous -> {
                previous.unlink();
                documentRepository.save(previous);
              });
      rejectMatch(previousDocumentId, transactionId);
    }
    status.markManuallyMatched(documentId, confidence, scope.actorId(), notes);
    status = statusRepository.save(status);

    DocumentMatch match =
        documentMatchRepository
            .findByDocumentIdAndTransactionId(documentId, transactionId)
            .orElseGet(
                () ->
                    new DocumentMatch(
                        documentId, transactionId, confidence, MatchStatus.MANUAL, null));
    match.markManual("Manually matched by user");
    documentMatchRepository.save(match);

    document.linkTo(transactionId);
    documentRepository.save(document);
    return status;
  }

  /** Sets a document-less state and clears every document link of the transaction. */
  private ReconciliationStatus detach(
      ActingScope scope, Transaction transaction, State state, String notes) {
    Long transactionId = transaction.getId();
    ReconciliationStatus status =
        statusRepository
            .findByTransactionId(transactionId)
            .orElseGet(() -> new ReconciliationStatus(transactionId));

    Set<Long> documentIds = new LinkedHashSet<>();
    if (status.getDocumentId() != null) {
      documentIds.add(status.getDocumentId());
    }
    List<Document> linkedDocuments = documentRepository.findByTransactionId(transactionId);
    for (Document document : linkedDocuments) {
      accessGuard.checkDocument(scope, document);
      documentIds.add(document.getId());
    }

    for (Document document : linkedDocuments) {
      document.unlink();
      documentRepository.save(document);
    }
    for (Long documentId : documentIds) {
      rejectMatch(documentId, transactionId);
    }
    status.markUnlinked(state, scope.actorId(), notes);
    return statusRepository.save(status);
  }

  /** Returns another transaction to unmatched after its document was taken away. */
  private void releaseLink(ActingScope scope, Long transactionId, Long documentId, String notes) {
    statusRepository
        .findByTransactionId(transactionId)
        .filter(previous -> documentId.equals(previous.getDocumentId()))
        .ifPresent(
            previous -> {
              previous.markUnlinked(State.UNMATCHED, scope.actorId(), notes);
              statusRepository.save(previous);
            });
    rejectMatch(documentId, transactionId);
  }

  private void rejectMatch(Long documentId, Long transactionId) {
    documentMatchRepository
        .findByDocumentIdAndTransactionId(documentId, transactionId)
        .ifPresent(
            match -> {
              match.setStatus(MatchStatus.REJECTED);
              match.setUserConfirmed(false);
              documentMatchRepository.save(match);
            });
  }

  private Transaction loadTransaction(ActingScope scope, Long transactionId) {
    Transaction transaction =
        transactionRepository
            .findById(transactionId)
            .orElseThrow(() -> new NotFoundException("Transaction", transactionId));
    accessGuard.checkTransaction(scope, transaction);
    return transaction;
  }

  private Document loadDocument(ActingScope scope, Long documentId) {
    Document document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new NotFoundException("Document", documentId));
    accessGuard.checkDocument(scope, document);
    return document;
  }

  public record AutoReconcileResult(int processed, int matched) {}

  public record BulkReconcileResult(int processed, int skipped) {}

  /** One transaction/document pair to reconcile in bulk. */
  public record ReconciliationRequest(Long transactionId, Long documentId, double confidence) {
    public ReconciliationRequest {
      Objects.requireNonNull(transactionId, "Transaction cannot be null");
      Objects.requireNonNull(documentId, "Document cannot be null");
      if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
        throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
      }
    }
  }

  public record ReconciliationSummary(
      LocalDate from,
      LocalDate to,
      int totalTransactions,
      int matched,
      int unmatched,
      int pendingReview,
      int excluded,
      BigDecimal matchedPercentage,
      BigDecimal totalAmount,
      BigDecimal matchedAmount,
      BigDecimal unmatchedAmount) {

    static ReconciliationSummary empty(LocalDate from, LocalDate to) {
      return new ReconciliationSummary(
          from, to, 0, 0, 0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
          BigDecimal.ZERO);
    }
  }

  public record UnmatchedTransaction(
      Transaction transaction, List<DocumentMatch> potentialMatches) {}
}
