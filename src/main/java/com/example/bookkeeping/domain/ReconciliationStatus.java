package com.example.bookkeeping.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Reconciliation state of a single transaction. The row is created lazily: a transaction without
 * one is implicitly {@link State#UNMATCHED}. When {@code documentId} is set, the referenced
 * document links back to the same transaction.
 */
@Entity
@Table(
    name = "reconciliation_status",
    uniqueConstraints = {
      @UniqueConstraint(name = "uk_reconciliation_transaction", columnNames = "transaction_id")
    })
public class ReconciliationStatus {

  public enum State {
    UNMATCHED,
    MATCHED, // Matched automatically by the sweep or a high-confidence document match
    PARTIALLY_MATCHED, // Only part of a split transaction's amount is covered
    PENDING_REVIEW,
    MANUALLY_MATCHED,
    EXCLUDED // Marked by a user as not reconcilable
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "transaction_id", nullable = false)
  private Long transactionId;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private State status = State.UNMATCHED;

  @Column(name = "document_id")
  private Long documentId;

  @Column
  private Double confidence;

  @Column(name = "manually_set", nullable = false)
  private boolean manuallySet = false;

  @Column(name = "reviewed_by")
  private Long reviewedBy;

  @Column(name = "reviewed_at")
  private Instant reviewedAt;

  @Size(max = 1000)
  @Column(length = 1000)
  private String notes;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @PrePersist
  @PreUpdate
  protected void touch() {
    updatedAt = Instant.now();
  }

  public ReconciliationStatus() {}

  public ReconciliationStatus(Long transactionId) {
    this.transactionId = transactionId;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getTransactionId() {
    return transactionId;
  }

  public State getStatus() {
    return status;
  }

  public void setStatus(State status) {
    this.status = status;
  }

  public Long getDocumentId() {
    return documentId;
  }

  public void setDocumentId(Long documentId) {
    this.documentId = documentId;
  }

  public Double getConfidence() {
    return confidence;
  }

  public void setConfidence(Double confidence) {
    this.confidence = confidence;
  }

  public boolean isManuallySet() {
    return manuallySet;
  }

  public void setManuallySet(boolean manuallySet) {
    this.manuallySet = manuallySet;
  }

  public Long getReviewedBy() {
    return reviewedBy;
  }

  public Instant getReviewedAt() {
    return reviewedAt;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Records the system auto-match of a document. */
  public void markMatched(Long documentId, double confidence, Long reviewer) {
    this.status = State.MATCHED;
    this.documentId = documentId;
    this.confidence = confidence;
    this.manuallySet = false;
    review(reviewer);
  }

  /** Records a user-confirmed match of a document. */
  public void markManuallyMatched(Long documentId, double confidence, Long reviewer, String notes) {
    this.status = State.MANUALLY_MATCHED;
    this.documentId = documentId;
    this.confidence = confidence;
    this.manuallySet = true;
    if (notes != null) {
      this.notes = notes;
    }
    review(reviewer);
  }

  /**
   * Sets a state that carries no document (unmatched, pending review, excluded). Always a manual
   * action.
   */
  public void markUnlinked(State state, Long reviewer, String notes) {
    this.status = state;
    this.documentId = null;
    this.confidence = null;
    this.manuallySet = true;
    if (notes != null) {
      this.notes = notes;
    }
    review(reviewer);
  }

  private void review(Long reviewer) {
    this.reviewedBy = reviewer;
    this.reviewedAt = Instant.now();
  }
}
