package com.example.bookkeeping.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Validated result of reading a receipt or invoice. Vendor, amount, date and tax are optional
 * because extraction is often partial; a document without amount and date cannot be matched.
 *
 * @param vendor merchant name as printed on the document
 * @param amount total amount, unsigned
 * @param date document date
 * @param tax tax included in the total
 * @param confidence how sure the extractor is of its reading, between 0 and 1
 * @param items individual line items, possibly empty
 */
public record ExtractedDocumentData(
    String vendor,
    BigDecimal amount,
    LocalDate date,
    BigDecimal tax,
    double confidence,
    List<LineItem> items) {

  public ExtractedDocumentData {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
    }
    if (amount != null) {
      amount = amount.abs();
    }
    if (tax != null && tax.signum() < 0) {
      throw new IllegalArgumentException("Tax cannot be negative");
    }
    if (vendor != null && vendor.isBlank()) {
      vendor = null;
    }
    items = items == null ? List.of() : List.copyOf(items);
  }

  public boolean isMatchable() {
    return amount != null && date != null;
  }

  public record LineItem(String description, BigDecimal quantity, BigDecimal amount) {}
}
