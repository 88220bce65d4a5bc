package com.example.bookkeeping.persistence;

import java.time.Duration;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.bookkeeping.domain.Document;
import com.example.bookkeeping.domain.Document.ProcessingStatus;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;
import com.example.bookkeeping.exception.NotFoundException;
import com.example.bookkeeping.repository.DocumentRepository;
import com.example.bookkeeping.repository.JournalEntryRepository;
import com.example.bookkeeping.repository.TransactionRepository;

/** {@link ImportPersistencePort} backed by the Spring Data repositories. */
@Component
public class JpaImportPersistence implements ImportPersistencePort {

  private static final Logger log = LoggerFactory.getLogger(JpaImportPersistence.class);

  private final PlatformTransactionManager transactionManager;
  private final TransactionRepository transactionRepository;
  private final JournalEntryRepository journalEntryRepository;
  private final DocumentRepository documentRepository;

  public JpaImportPersistence(
      PlatformTransactionManager transactionManager,
      TransactionRepository transactionRepository,
      JournalEntryRepository journalEntryRepository,
      DocumentRepository documentRepository) {
    this.transactionManager = transactionManager;
    this.transactionRepository = transactionRepository;
    this.journalEntryRepository = journalEntryRepository;
    this.documentRepository = documentRepository;
  }

  @Override
  public <T> T inBoundedTransaction(Duration timeout, Supplier<T> work) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    template.setTimeout((int) Math.max(1, timeout.toSeconds()));
    return template.execute(status -> work.get());
  }

  @Override
  public Set<String> existingExternalIds(Long businessId, Collection<String> externalIds) {
    if (externalIds.isEmpty()) {
      return Set.of();
    }
    return new HashSet<>(transactionRepository.findExistingExternalIds(businessId, externalIds));
  }

  @Override
  public List<Transaction> bulkInsertTransactions(List<Transaction> transactions) {
    List<Transaction> saved = transactionRepository.saveAll(transactions);
    // Flush so constraint violations surface inside the bounded transaction.
    transactionRepository.flush();
    return saved;
  }

  @Override
  public void bulkInsertJournalEntries(List<JournalEntry> entries) {
    journalEntryRepository.saveAll(entries);
    journalEntryRepository.flush();
  }

  @Override
  public void updateImportDocument(
      Long documentId, ProcessingStatus status, String processingMetadata) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.executeWithoutResult(
        tx -> {
          Document document =
              documentRepository
                  .findById(documentId)
                  .orElseThrow(() -> new NotFoundException("Document", documentId));
          document.setProcessingStatus(status);
          document.setProcessingMetadata(processingMetadata);
          documentRepository.save(document);
        });
    log.debug("Import document {} marked {}", documentId, status);
  }
}
