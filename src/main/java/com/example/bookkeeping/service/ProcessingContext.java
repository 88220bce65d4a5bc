package com.example.bookkeeping.service;

import java.util.Objects;

import com.example.bookkeeping.domain.ChartOfAccountsMap;

/**
 * Who is importing, for which business, and with which chart of accounts.
 *
 * @param businessId the owning business
 * @param actorId the user running the import, recorded as creator
 * @param importDocumentId the uploaded statement being processed, or null
 * @param accountMap the business's ledger accounts
 */
public record ProcessingContext(
    Long businessId, Long actorId, Long importDocumentId, ChartOfAccountsMap accountMap) {

  public ProcessingContext {
    Objects.requireNonNull(businessId, "Business cannot be null");
    Objects.requireNonNull(accountMap, "Account map cannot be null");
    if (!businessId.equals(accountMap.getBusinessId())) {
      throw new IllegalArgumentException("Account map belongs to another business");
    }
  }
}
