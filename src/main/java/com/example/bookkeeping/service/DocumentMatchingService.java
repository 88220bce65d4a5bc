package com.example.bookkeeping.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.example.bookkeeping.domain.Document;
import com.example.bookkeeping.domain.Document.ProcessingStatus;
import com.example.bookkeeping.domain.DocumentMatch;
import com.example.bookkeeping.domain.DocumentMatch.MatchStatus;
import com.example.bookkeeping.domain.ExtractedDocumentData;
import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.DocumentExtractionException;
import com.example.bookkeeping.exception.NotFoundException;
import com.example.bookkeeping.repository.DocumentMatchRepository;
import com.example.bookkeeping.repository.DocumentRepository;
import com.example.bookkeeping.repository.ReconciliationStatusRepository;
import com.example.bookkeeping.repository.TransactionRepository;
import com.example.bookkeeping.security.ActingScope;
import com.example.bookkeeping.security.ReconciliationAccessGuard;

/**
 * Processes uploaded receipts and invoices: extracts their data, stores it on the document and
 * records the best matching transactions. A match above the confirm threshold links the document
 * straight away when its transaction has not been reconciled yet.
 */
@Service
@Transactional
public class DocumentMatchingService {

  private static final Logger log = LoggerFactory.getLogger(DocumentMatchingService.class);

  private final DocumentRepository documentRepository;
  private final DocumentMatchRepository documentMatchRepository;
  private final TransactionRepository transactionRepository;
  private final ReconciliationStatusRepository statusRepository;
  private final DocumentExtractor documentExtractor;
  private final ReconciliationMatcher matcher;
  private final ReconciliationAccessGuard accessGuard;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public DocumentMatchingService(
      DocumentRepository documentRepository,
      DocumentMatchRepository documentMatchRepository,
      TransactionRepository transactionRepository,
      ReconciliationStatusRepository statusRepository,
      DocumentExtractor documentExtractor,
      ReconciliationMatcher matcher,
      ReconciliationAccessGuard accessGuard,
      ObjectMapper objectMapper,
      Clock clock) {
    this.documentRepository = documentRepository;
    this.documentMatchRepository = documentMatchRepository;
    this.transactionRepository = transactionRepository;
    this.statusRepository = statusRepository;
    this.documentExtractor = documentExtractor;
    this.matcher = matcher;
    this.accessGuard = accessGuard;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Extracts a document's data and records its best transaction matches.
   *
   * @throws DocumentExtractionException if extraction fails; the document is left FAILED
   */
  @Transactional(noRollbackFor = DocumentExtractionException.class)
  public DocumentProcessingResult processDocument(
      ActingScope scope, Long documentId, MatcherSettings settings) {
    Document document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new NotFoundException("Document", documentId));
    accessGuard.checkDocument(scope, document);

    document.setProcessingStatus(ProcessingStatus.PROCESSING);
    documentRepository.save(document);

    ExtractedDocumentData extracted;
    try {
      extracted = validate(documentExtractor.extract(document.getUrl(), document.getMimeType()));
    } catch (RuntimeException e) {
      log.warn("Extraction of document {} failed: {}", documentId, e.getMessage());
      document.setProcessingStatus(ProcessingStatus.FAILED);
      document.setProcessingMetadata(metadata(Map.of("error", String.valueOf(e.getMessage()))));
      documentRepository.save(document);
      if (e instanceof DocumentExtractionException extractionError) {
        throw extractionError;
      }
      throw new DocumentExtractionException("Extraction failed: " + e.getMessage(), e);
    }

    document.setExtractedVendor(extracted.vendor());
    document.setExtractedAmount(extracted.amount());
    document.setExtractedDate(extracted.date());
    document.setExtractedTax(extracted.tax());
    document.setExtractedConfidence(extracted.confidence());
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("extractedAt", Instant.now(clock).toString());
    metadata.put("items", extracted.items());
    document.setProcessingMetadata(metadata(metadata));
    document.setProcessingStatus(ProcessingStatus.COMPLETED);
    documentRepository.save(document);

    if (!extracted.isMatchable()) {
      log.info("Document {} has no amount or date; nothing to match", documentId);
      return new DocumentProcessingResult(documentId, extracted, List.of(), null);
    }

    List<DocumentMatch> matches = recordMatches(scope, document, extracted, settings);
    Long linkedTransactionId = linkConfidentMatch(document, matches, settings);
    log.info(
        "Document {} processed: {} matches, linked to {}",
        documentId,
        matches.size(),
        linkedTransactionId);
    return new DocumentProcessingResult(documentId, extracted, matches, linkedTransactionId);
  }

  /** Checks an extraction payload against the expected schema. */
  ExtractedDocumentData validate(ExtractionPayload payload) {
    if (payload == null) {
      throw new DocumentExtractionException("Extraction returned no data");
    }
    if (payload.confidence() == null) {
      throw new DocumentExtractionException("Extraction result has no confidence");
    }
    List<ExtractedDocumentData.LineItem> items = new ArrayList<>();
    if (payload.items() != null) {
      for (ExtractionPayload.Item item : payload.items()) {
        items.add(
            new ExtractedDocumentData.LineItem(item.description(), item.quantity(), item.amount()));
      }
    }
    try {
      return new ExtractedDocumentData(
          payload.vendor(),
          payload.amount(),
          parseDate(payload.date()),
          payload.tax(),
          payload.confidence(),
          items);
    } catch (IllegalArgumentException e) {
      throw new DocumentExtractionException("Invalid extraction result: " + e.getMessage(), e);
    }
  }

  private List<DocumentMatch> recordMatches(
      ActingScope scope,
      Document document,
      ExtractedDocumentData extracted,
      MatcherSettings settings) {
    LocalDate date = extracted.date();
    List<TransactionCandidate> candidates =
        transactionRepository
            .findByBusinessIdAndDateBetweenOrderByDateDesc(
                scope.businessId(),
                date.minusDays(settings.dateWindowDays()),
                date.plusDays(settings.dateWindowDays()))
            .stream()
            .map(TransactionCandidate::of)
            .toList();

    List<MatchSuggestion> suggestions = matcher.findMatches(extracted, candidates, settings);
    List<DocumentMatch> recorded = new ArrayList<>();
    for (MatchSuggestion suggestion :
        suggestions.subList(0, Math.min(settings.maxSuggestions(), suggestions.size()))) {
      MatchStatus status =
          suggestion.confidence() > settings.confirmThreshold()
              ? MatchStatus.CONFIRMED
              : MatchStatus.SUGGESTED;
      DocumentMatch match =
          documentMatchRepository
              .findByDocumentIdAndTransactionId(document.getId(), suggestion.transactionId())
              .orElse(null);
      if (match == null) {
        match =
            new DocumentMatch(
                document.getId(),
                suggestion.transactionId(),
                suggestion.confidence(),
                status,
                suggestion.matchReason());
      } else if (match.getStatus() == MatchStatus.SUGGESTED) {
        match.setConfidence(suggestion.confidence());
        match.setMatchReason(suggestion.matchReason());
        match.setStatus(status);
      }
      // Confirmed, manual and rejected matches keep the user's or an earlier decision.
      recorded.add(documentMatchRepository.save(match));
    }
    return recorded;
  }

  private Long linkConfidentMatch(
      Document document, List<DocumentMatch> matches, MatcherSettings settings) {
    if (matches.isEmpty() || document.getTransactionId() != null) {
      return document.getTransactionId();
    }
    DocumentMatch best = matches.get(0);
    if (best.getStatus() != MatchStatus.CONFIRMED
        || best.getConfidence() <= settings.confirmThreshold()
        || statusRepository.existsByTransactionId(best.getTransactionId())) {
      return null;
    }
    Transaction transaction =
        transactionRepository
            .findByIdAndBusinessId(best.getTransactionId(), document.getBusinessId())
            .orElseThrow(() -> new NotFoundException("Transaction", best.getTransactionId()));

    ReconciliationStatus status = new ReconciliationStatus(transaction.getId());
    status.markMatched(document.getId(), best.getConfidence(), null);
    statusRepository.save(status);
    document.linkTo(transaction.getId());
    documentRepository.save(document);
    return transaction.getId();
  }

  private static LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(value).toLocalDate();
      } catch (DateTimeParseException second) {
        throw new DocumentExtractionException("Date is not ISO-8601: " + value, second);
      }
    }
  }

  private String metadata(Map<String, Object> values) {
    try {
      return objectMapper.writeValueAsString(values);
    } catch (JsonProcessingException e) {
      log.warn("Could not serialise processing metadata: {}", e.getMessage());
      return "{}";
    }
  }

  /**
   * Outcome of processing a document.
   *
   * @param linkedTransactionId the transaction the document is now linked to, or null
   */
  public record DocumentProcessingResult(
      Long documentId,
      ExtractedDocumentData extracted,
      List<DocumentMatch> matches,
      Long linkedTransactionId) {}
}
