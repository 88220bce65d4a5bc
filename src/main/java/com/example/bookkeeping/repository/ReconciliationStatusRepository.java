package com.example.bookkeeping.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.ReconciliationStatus;

@Repository
public interface ReconciliationStatusRepository extends JpaRepository<ReconciliationStatus, Long> {

  Optional<ReconciliationStatus> findByTransactionId(Long transactionId);

  List<ReconciliationStatus> findByTransactionIdIn(Collection<Long> transactionIds);

  boolean existsByTransactionId(Long transactionId);
}
