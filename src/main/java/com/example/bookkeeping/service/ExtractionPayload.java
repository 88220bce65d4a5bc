package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw response of a {@link DocumentExtractor}. Values are as reported by the extraction service
 * and have not been checked; the date is an ISO-8601 string.
 */
public record ExtractionPayload(
    String vendor,
    BigDecimal amount,
    String date,
    BigDecimal tax,
    Double confidence,
    List<Item> items) {

  public record Item(String description, BigDecimal quantity, BigDecimal amount) {}
}
