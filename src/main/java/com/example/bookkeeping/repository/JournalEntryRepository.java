package com.example.bookkeeping.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.JournalEntry;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, Long> {

  List<JournalEntry> findByTransactionId(Long transactionId);

  List<JournalEntry> findByTransactionIdIn(Collection<Long> transactionIds);
}
