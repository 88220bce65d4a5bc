package com.example.bookkeeping.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.bookkeeping.domain.DocumentMatch;
import com.example.bookkeeping.domain.DocumentMatch.MatchStatus;

/** Repository for scored document-to-transaction match candidates. */
@Repository
public interface DocumentMatchRepository extends JpaRepository<DocumentMatch, Long> {

  Optional<DocumentMatch> findByDocumentIdAndTransactionId(Long documentId, Long transactionId);

  List<DocumentMatch> findByDocumentIdOrderByConfidenceDesc(Long documentId);

  List<DocumentMatch> findByTransactionIdInAndStatusOrderByConfidenceDesc(
      Collection<Long> transactionIds, MatchStatus status);

  /**
   * Finds matches eligible for automatic reconciliation: the given status, at or above the minimum
   * confidence, on transactions of the business that have no reconciliation status yet. Ordered so
   * that the first match seen for a transaction is its best one.
   */
  @Query(
      "SELECT m FROM DocumentMatch m, Transaction t "
          + "WHERE m.transactionId = t.id AND t.businessId = :businessId "
          + "AND m.status = :status AND m.confidence >= :minConfidence "
          + "AND NOT EXISTS (SELECT r.id FROM ReconciliationStatus r "
          + "WHERE r.transactionId = t.id) "
          + "ORDER BY m.transactionId, m.confidence DESC, m.id")
  List<DocumentMatch> findAutoReconcileCandidates(
      @Param("businessId") Long businessId,
      @Param("status") MatchStatus status,
      @Param("minConfidence") double minConfidence);
}
