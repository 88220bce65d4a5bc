package com.example.bookkeeping.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.Document;

@Repository
public interface DocumentRepository extends JpaRepository<Document, Long> {

  Optional<Document> findByIdAndBusinessId(Long id, Long businessId);

  /** Find documents currently linked to a transaction. */
  List<Document> findByTransactionId(Long transactionId);
}
