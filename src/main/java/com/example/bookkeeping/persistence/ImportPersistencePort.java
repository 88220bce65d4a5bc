package com.example.bookkeeping.persistence;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import com.example.bookkeeping.domain.Document.ProcessingStatus;
import com.example.bookkeeping.domain.JournalEntry;
import com.example.bookkeeping.domain.Transaction;

/**
 * Storage operations needed by the batch import. Writes made inside {@link #inBoundedTransaction}
 * are committed together or not at all.
 */
public interface ImportPersistencePort {

  /**
   * Runs the work in a new transaction that is rolled back if it throws or outlives the timeout.
   * Infrastructure failures surface as Spring {@code DataAccessException} or {@code
   * TransactionException}.
   */
  <T> T inBoundedTransaction(Duration timeout, Supplier<T> work);

  /** Returns the subset of the given external ids already used by the business. */
  Set<String> existingExternalIds(Long businessId, Collection<String> externalIds);

  /** Inserts transactions and returns them with their generated ids, in the same order. */
  List<Transaction> bulkInsertTransactions(List<Transaction> transactions);

  void bulkInsertJournalEntries(List<JournalEntry> entries);

  /** Sets the import document's processing status and metadata. */
  void updateImportDocument(Long documentId, ProcessingStatus status, String processingMetadata);
}
