package com.example.bookkeeping.domain;

import java.time.Instant;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * A candidate pairing of a document with a transaction. Created by the matcher as a suggestion (or
 * directly confirmed when the score is high enough), and by users when they match manually. At
 * most one row exists per (document, transaction) pair.
 */
@Entity
@Table(
    name = "document_match",
    uniqueConstraints = {
      @UniqueConstraint(
          name = "uk_document_match_pair",
          columnNames = {"document_id", "transaction_id"})
    },
    indexes = {
      @Index(name = "idx_document_match_transaction", columnList = "transaction_id, status")
    })
public class DocumentMatch {

  public enum MatchStatus {
    SUGGESTED, // Scored by the matcher, awaiting review
    CONFIRMED, // Accepted, either automatically or by reconciliation
    REJECTED, // Dismissed or unmatched
    MANUAL // Chosen by a user
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "document_id", nullable = false)
  private Long documentId;

  @NotNull
  @Column(name = "transaction_id", nullable = false)
  private Long transactionId;

  @Column(nullable = false)
  private double confidence;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private MatchStatus status = MatchStatus.SUGGESTED;

  @Size(max = 500)
  @Column(name = "match_reason", length = 500)
  private String matchReason;

  @Column(name = "is_user_confirmed", nullable = false)
  private boolean userConfirmed = false;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  public DocumentMatch() {}

  public DocumentMatch(
      Long documentId,
      Long transactionId,
      double confidence,
      MatchStatus status,
      String matchReason) {
    this.documentId = documentId;
    this.transactionId = transactionId;
    this.confidence = confidence;
    this.status = status;
    this.matchReason = matchReason;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getDocumentId() {
    return documentId;
  }

  public Long getTransactionId() {
    return transactionId;
  }

  public double getConfidence() {
    return confidence;
  }

  public void setConfidence(double confidence) {
    this.confidence = confidence;
  }

  public MatchStatus getStatus() {
    return status;
  }

  public void setStatus(MatchStatus status) {
    this.status = status;
  }

  public String getMatchReason() {
    return matchReason;
  }

  public void setMatchReason(String matchReason) {
    this.matchReason = matchReason;
  }

  public boolean isUserConfirmed() {
    return userConfirmed;
  }

  public void setUserConfirmed(boolean userConfirmed) {
    this.userConfirmed = userConfirmed;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Records that a user picked this pairing. */
  public void markManual(String reason) {
    this.status = MatchStatus.MANUAL;
    this.userConfirmed = true;
    this.confidence = 1.0;
    this.matchReason = reason;
  }
}
