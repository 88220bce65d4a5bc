package com.example.bookkeeping.repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.ReconciliationStatus;
import com.example.bookkeeping.domain.Transaction;

/**
 * Repository for imported transactions. Every query is filtered by business id; there is no
 * cross-business access path.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

  Optional<Transaction> findByIdAndBusinessId(Long id, Long businessId);

  List<Transaction> findByBusinessIdAndIdIn(Long businessId, Collection<Long> ids);

  /** Returns which of the given external ids are already taken within the business. */
  @Query(
      "SELECT t.externalId FROM Transaction t "
          + "WHERE t.businessId = :businessId AND t.externalId IN :externalIds")
  List<String> findExistingExternalIds(
      @Param("businessId") Long businessId,
      @Param("externalIds") Collection<String> externalIds);

  /** Finds transactions within a date range, newest first. Used for match candidates. */
  List<Transaction> findByBusinessIdAndDateBetweenOrderByDateDesc(
      Long businessId, LocalDate from, LocalDate to);

  /**
   * Finds transactions in a date range that have no reconciliation status other than UNMATCHED.
   */
  @Query(
      "SELECT t FROM Transaction t "
          + "WHERE t.businessId = :businessId AND t.date BETWEEN :from AND :to "
          + "AND NOT EXISTS (SELECT r.id FROM ReconciliationStatus r "
          + "WHERE r.transactionId = t.id AND r.status <> :unmatched) "
          + "ORDER BY t.date DESC, t.id DESC")
  Page<Transaction> findUnreconciled(
      @Param("businessId") Long businessId,
      @Param("from") LocalDate from,
      @Param("to") LocalDate to,
      @Param("unmatched") ReconciliationStatus.State unmatched,
      Pageable pageable);
}
