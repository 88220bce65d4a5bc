package com.example.bookkeeping.service;

/**
 * Reads vendor, amount, date and tax from a stored receipt or invoice. Implementations call an
 * external extraction service.
 */
@FunctionalInterface
public interface DocumentExtractor {

  /**
   * @param documentUrl where the document can be fetched
   * @param mimeType the document's content type
   * @return the unvalidated extraction result
   * @throws com.example.bookkeeping.exception.DocumentExtractionException if extraction fails
   */
  ExtractionPayload extract(String documentUrl, String mimeType);
}
