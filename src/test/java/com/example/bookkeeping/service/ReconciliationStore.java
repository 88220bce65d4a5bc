package com.example.bookkeeping.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.lenient;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import com.example.bookkeeping.domain.Document;
import com.example.bookkeeping.domain.Document.DocumentKind;
import com.example.bookkeeping.domain.DocumentMatch;
import com.example.bookkeeping.domain.DocumentMatch.MatchStatus;
import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.domain.Transaction.TransactionType;
import com.example.bookkeeping.repository.DocumentMatchRepository;
import com.example.bookkeeping.repository.DocumentRepository;
import com.example.bookkeeping.repository.ReconciliationStatusRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/**
 * Backs mocked reconciliation repositories with maps, so services can be tested against state
 * rather than against individual repository calls.
 */
final class ReconciliationStore {

  final Map<Long, Transaction> transactions = new LinkedHashMap<>();
  final Map<Long, Document> documents = new LinkedHashMap<>();
  final Map<Long, ReconciliationStatus> statuses = new LinkedHashMap<>();
  final List<DocumentMatch> matches = new ArrayList<>();

  private final AtomicLong ids = new AtomicLong(900);

  Transaction addTransaction(
      Long id, Long businessId, LocalDate date, String amount, String description) {
    Transaction transaction =
        new Transaction(businessId, 500L, TransactionType.EXPENSE, date, new BigDecimal(amount));
    transaction.setId(id);
    transaction.setDescription(description);
    transactions.put(id, transaction);
    return transaction;
  }

  Document addDocument(Long id, Long businessId) {
    Document document = new Document(businessId, "receipt-" + id + ".pdf", DocumentKind.RECEIPT);
    document.setId(id);
    document.setUrl("https://files.example.com/receipt-" + id + ".pdf");
    document.setMimeType("application/pdf");
    documents.put(id, document);
    return document;
  }

  DocumentMatch addMatch(Long documentId, Long transactionId, double confidence, MatchStatus s) {
    DocumentMatch match = new DocumentMatch(documentId, transactionId, confidence, s, null);
    match.setId(ids.incrementAndGet());
    matches.add(match);
    return match;
  }

  Optional<DocumentMatch> match(Long documentId, Long transactionId) {
    return matches.stream()
        .filter(m -> m.getDocumentId().equals(documentId))
        .filter(m -> m.getTransactionId().equals(transactionId))
        .findFirst();
  }

  void bind(
      TransactionRepository transactionRepository,
      DocumentRepository documentRepository,
      DocumentMatchRepository documentMatchRepository,
      ReconciliationStatusRepository statusRepository) {
    bindTransactions(transactionRepository);
    bindDocuments(documentRepository);
    bindMatches(documentMatchRepository);
    bindStatuses(statusRepository);
  }

  private void bindTransactions(TransactionRepository repository) {
    lenient()
        .when(repository.findById(any()))
        .thenAnswer(inv -> Optional.ofNullable(transactions.get((Long) inv.getArgument(0))));
    lenient()
        .when(repository.findAllById(any()))
        .thenAnswer(inv -> found(transactions, inv.getArgument(0)));
    lenient()
        .when(repository.findByIdAndBusinessId(any(), any()))
        .thenAnswer(
            inv ->
                Optional.ofNullable(transactions.get((Long) inv.getArgument(0)))
                    .filter(t -> t.getBusinessId().equals(inv.getArgument(1))));
    lenient()
        .when(repository.findByBusinessIdAndDateBetweenOrderByDateDesc(any(), any(), any()))
        .thenAnswer(
            inv -> {
              Long businessId = inv.getArgument(0);
              LocalDate from = inv.getArgument(1);
              LocalDate to = inv.getArgument(2);
              return transactions.values().stream()
                  .filter(t -> t.getBusinessId().equals(businessId))
                  .filter(t -> !t.getDate().isBefore(from) && !t.getDate().isAfter(to))
                  .sorted(Comparator.comparing(Transaction::getDate).reversed())
                  .toList();
            });
  }

  private void bindDocuments(DocumentRepository repository) {
    lenient()
        .when(repository.findById(any()))
        .thenAnswer(inv -> Optional.ofNullable(documents.get((Long) inv.getArgument(0))));
    lenient()
        .when(repository.findAllById(any()))
        .thenAnswer(inv -> found(documents, inv.getArgument(0)));
    lenient()
        .when(repository.findByIdAndBusinessId(any(), any()))
        .thenAnswer(
            inv ->
                Optional.ofNullable(documents.get((Long) inv.getArgument(0)))
                    .filter(d -> d.getBusinessId().equals(inv.getArgument(1))));
    lenient()
        .when(repository.findByTransactionId(any()))
        .thenAnswer(
            inv ->
                documents.values().stream()
                    .filter(d -> inv.getArgument(0).equals(d.getTransactionId()))
                    .toList());
    lenient().when(repository.save(any(Document.class))).thenAnswer(inv -> inv.getArgument(0));
    lenient()
        .when(repository.saveAll(any()))
        .thenAnswer(inv -> copyOf(inv.getArgument(0)));
  }

  private void bindMatches(DocumentMatchRepository repository) {
    lenient()
        .when(repository.findByDocumentIdAndTransactionId(any(), any()))
        .thenAnswer(inv -> match(inv.getArgument(0), inv.getArgument(1)));
    lenient()
        .when(repository.findByTransactionIdInAndStatusOrderByConfidenceDesc(any(), any()))
        .thenAnswer(
            inv -> {
              Collection<Long> transactionIds = inv.getArgument(0);
              MatchStatus status = inv.getArgument(1);
              return matches.stream()
                  .filter(m -> transactionIds.contains(m.getTransactionId()))
                  .filter(m -> m.getStatus() == status)
                  .sorted(Comparator.comparingDouble(DocumentMatch::getConfidence).reversed())
                  .toList();
            });
    lenient()
        .when(repository.findAutoReconcileCandidates(any(), any(), anyDouble()))
        .thenAnswer(
            inv -> {
              Long businessId = inv.getArgument(0);
              MatchStatus status = inv.getArgument(1);
              double minConfidence = (Double) inv.getArgument(2);
              return matches.stream()
                  .filter(m -> m.getStatus() == status && m.getConfidence() >= minConfidence)
                  .filter(m -> !statuses.containsKey(m.getTransactionId()))
                  .filter(
                      m -> {
                        Transaction t = transactions.get(m.getTransactionId());
                        return t != null && t.getBusinessId().equals(businessId);
                      })
                  .sorted(
                      Comparator.comparing(DocumentMatch::getTransactionId)
                          .thenComparing(
                              Comparator.comparingDouble(DocumentMatch::getConfidence).reversed())
                          .thenComparing(DocumentMatch::getId))
                  .toList();
            });
    lenient()
        .when(repository.save(any(DocumentMatch.class)))
        .thenAnswer(inv -> saveMatch(inv.getArgument(0)));
    lenient()
        .when(repository.saveAll(any()))
        .thenAnswer(
            inv -> {
              List<DocumentMatch> saved = new ArrayList<>();
              for (Object match : (Iterable<?>) inv.getArgument(0)) {
                saved.add(saveMatch((DocumentMatch) match));
              }
              return saved;
            });
  }

  private void bindStatuses(ReconciliationStatusRepository repository) {
    lenient()
        .when(repository.findByTransactionId(any()))
        .thenAnswer(inv -> Optional.ofNullable(statuses.get((Long) inv.getArgument(0))));
    lenient()
        .when(repository.findByTransactionIdIn(any()))
        .thenAnswer(
            inv -> {
              Collection<Long> transactionIds = inv.getArgument(0);
              return statuses.values().stream()
                  .filter(s -> transactionIds.contains(s.getTransactionId()))
                  .toList();
            });
    lenient()
        .when(repository.existsByTransactionId(any()))
        .thenAnswer(inv -> statuses.containsKey((Long) inv.getArgument(0)));
    lenient()
        .when(repository.save(any(ReconciliationStatus.class)))
        .thenAnswer(inv -> saveStatus(inv.getArgument(0)));
    lenient()
        .when(repository.saveAll(any()))
        .thenAnswer(
            inv -> {
              List<ReconciliationStatus> saved = new ArrayList<>();
              for (Object status : (Iterable<?>) inv.getArgument(0)) {
                saved.add(saveStatus((ReconciliationStatus) status));
              }
              return saved;
            });
  }

  private DocumentMatch saveMatch(DocumentMatch match) {
    if (match.getId() == null) {
      match.setId(ids.incrementAndGet());
      matches.add(match);
    }
    return match;
  }

  private ReconciliationStatus saveStatus(ReconciliationStatus status) {
    if (status.getId() == null) {
      status.setId(ids.incrementAndGet());
    }
    statuses.put(status.getTransactionId(), status);
    return status;
  }

  private static <T> List<T> found(Map<Long, T> source, Iterable<Long> requested) {
    List<T> result = new ArrayList<>();
    for (Long id : requested) {
      T value = source.get(id);
      if (value != null) {
        result.add(value);
      }
    }
    return result;
  }

  private static List<Object> copyOf(Iterable<?> values) {
    List<Object> result = new ArrayList<>();
    values.forEach(result::add);
    return result;
  }
}
