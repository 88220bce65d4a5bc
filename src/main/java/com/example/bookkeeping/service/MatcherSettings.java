package com.example.bookkeeping.service;

/**
 * Thresholds and weights for document-to-transaction matching.
 *
 * @param dateWindowDays maximum days between document and transaction dates
 * @param amountTolerance maximum amount difference as a fraction of the transaction amount
 * @param baseScore score every eligible candidate starts from
 * @param dateWeight score added for a same-day match, falling to zero at the window edge
 * @param amountWeight score added for an exact amount match
 * @param vendorWeight score added for a full vendor/description similarity
 * @param maxSuggestions matches kept per document
 * @param confirmThreshold confidence above which a new match is confirmed immediately
 * @param autoReconcileThreshold minimum confidence for the auto-reconcile sweep
 */
public record MatcherSettings(
    int dateWindowDays,
    double amountTolerance,
    double baseScore,
    double dateWeight,
    double amountWeight,
    double vendorWeight,
    int maxSuggestions,
    double confirmThreshold,
    double autoReconcileThreshold) {

  public MatcherSettings {
    if (dateWindowDays < 0) {
      throw new IllegalArgumentException("Date window cannot be negative");
    }
    if (amountTolerance < 0) {
      throw new IllegalArgumentException("Amount tolerance cannot be negative");
    }
    if (maxSuggestions < 1) {
      throw new IllegalArgumentException("At least one suggestion must be kept");
    }
  }

  public static MatcherSettings defaults() {
    return new MatcherSettings(7, 0.05, 0.5, 0.3, 0.3, 0.2, 3, 0.9, 0.8);
  }
}
