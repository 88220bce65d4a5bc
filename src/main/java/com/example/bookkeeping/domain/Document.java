package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * An uploaded receipt, invoice or bank statement. Receipts and invoices carry the fields extracted
 * from them and may link to at most one transaction; statements carry the processing outcome of
 * the import that read them.
 */
@Entity
@Table(
    name = "document",
    indexes = {
      @Index(name = "idx_document_business", columnList = "business_id"),
      @Index(name = "idx_document_transaction", columnList = "transaction_id")
    })
public class Document {

  public enum DocumentKind {
    RECEIPT,
    INVOICE,
    BANK_STATEMENT,
    OTHER
  }

  public enum ProcessingStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotNull
  @Column(name = "business_id", nullable = false)
  private Long businessId;

  @NotBlank
  @Size(max = 255)
  @Column(nullable = false, length = 255)
  private String name;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 20)
  private DocumentKind kind = DocumentKind.RECEIPT;

  @Size(max = 1000)
  @Column(length = 1000)
  private String url;

  @Size(max = 100)
  @Column(name = "mime_type", length = 100)
  private String mimeType;

  @NotNull
  @Enumerated(EnumType.STRING)
  @Column(name = "processing_status", nullable = false, length = 20)
  private ProcessingStatus processingStatus = ProcessingStatus.PENDING;

  @Size(max = 255)
  @Column(name = "extracted_vendor", length = 255)
  private String extractedVendor;

  @Column(name = "extracted_amount", precision = 19, scale = 2)
  private BigDecimal extractedAmount;

  @Column(name = "extracted_date")
  private LocalDate extractedDate;

  @Column(name = "extracted_tax", precision = 19, scale = 2)
  private BigDecimal extractedTax;

  @Column(name = "extracted_confidence")
  private Double extractedConfidence;

  /** JSON describing the last processing run (extraction output or import statistics). */
  @Column(name = "processing_metadata", columnDefinition = "TEXT")
  private String processingMetadata;

  /** The transaction this document is evidence for, if any. */
  @Column(name = "transaction_id")
  private Long transactionId;

  @Column(name = "verified_at")
  private Instant verifiedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
  }

  public Document() {}

  public Document(Long businessId, String name, DocumentKind kind) {
    this.businessId = businessId;
    this.name = name;
    this.kind = kind;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public Long getBusinessId() {
    return businessId;
  }

  public void setBusinessId(Long businessId) {
    this.businessId = businessId;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public DocumentKind getKind() {
    return kind;
  }

  public void setKind(DocumentKind kind) {
    this.kind = kind;
  }

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getMimeType() {
    return mimeType;
  }

  public void setMimeType(String mimeType) {
    this.mimeType = mimeType;
  }

  public ProcessingStatus getProcessingStatus() {
    return processingStatus;
  }

  public void setProcessingStatus(ProcessingStatus processingStatus) {
    this.processingStatus = processingStatus;
  }

  public String getExtractedVendor() {
    return extractedVendor;
  }

  public void setExtractedVendor(String extractedVendor) {
    this.extractedVendor = extractedVendor;
  }

  public BigDecimal getExtractedAmount() {
    return extractedAmount;
  }

  public void setExtractedAmount(BigDecimal extractedAmount) {
    this.extractedAmount = extractedAmount;
  }

  public LocalDate getExtractedDate() {
    return extractedDate;
  }

  public void setExtractedDate(LocalDate extractedDate) {
    this.extractedDate = extractedDate;
  }

  public BigDecimal getExtractedTax() {
    return extractedTax;
  }

  public void setExtractedTax(BigDecimal extractedTax) {
    this.extractedTax = extractedTax;
  }

  public Double getExtractedConfidence() {
    return extractedConfidence;
  }

  public void setExtractedConfidence(Double extractedConfidence) {
    this.extractedConfidence = extractedConfidence;
  }

  public String getProcessingMetadata() {
    return processingMetadata;
  }

  public void setProcessingMetadata(String processingMetadata) {
    this.processingMetadata = processingMetadata;
  }

  public Long getTransactionId() {
    return transactionId;
  }

  public void setTransactionId(Long transactionId) {
    this.transactionId = transactionId;
  }

  public Instant getVerifiedAt() {
    return verifiedAt;
  }

  public void setVerifiedAt(Instant verifiedAt) {
    this.verifiedAt = verifiedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  /** Links this document to a transaction as its supporting evidence. */
  public void linkTo(Long transactionId) {
    this.transactionId = transactionId;
    this.verifiedAt = Instant.now();
  }

  /** Removes the link to a transaction. */
  public void unlink() {
    this.transactionId = null;
  }
}
