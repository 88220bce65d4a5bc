package com.example.bookkeeping.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.example.bookkeeping.domain.ExtractedDocumentData;

/**
 * Scores how well an extracted document matches candidate transactions. Pure and stateless.
 *
 * <p>A candidate is eligible only if its date is within the window and its amount within the
 * tolerance; others are dropped, not down-scored. The score starts at the base and adds a date
 * term, an amount term and, when both vendor and description are known, a vendor term. Results
 * are sorted by confidence, highest first, keeping input order for ties.
 */
@Component
public class ReconciliationMatcher {

  private final MatcherSettings defaultSettings;

  public ReconciliationMatcher(MatcherSettings defaultSettings) {
    this.defaultSettings = defaultSettings;
  }

  public List<MatchSuggestion> findMatches(
      ExtractedDocumentData extracted, List<TransactionCandidate> candidates) {
    return findMatches(extracted, candidates, defaultSettings);
  }

  public List<MatchSuggestion> findMatches(
      ExtractedDocumentData extracted,
      List<TransactionCandidate> candidates,
      MatcherSettings settings) {
    if (!extracted.isMatchable()) {
      return List.of();
    }
    BigDecimal documentAmount = extracted.amount().abs();
    BigDecimal tolerance = BigDecimal.valueOf(settings.amountTolerance());

    List<MatchSuggestion> matches = new ArrayList<>();
    for (TransactionCandidate candidate : candidates) {
      if (candidate.date() == null || candidate.amount() == null) {
        continue;
      }
      long days = Math.abs(ChronoUnit.DAYS.between(extracted.date(), candidate.date()));
      if (days > settings.dateWindowDays()) {
        continue;
      }
      BigDecimal transactionAmount = candidate.amount().abs();
      BigDecimal difference = documentAmount.subtract(transactionAmount).abs();
      if (difference.compareTo(transactionAmount.multiply(tolerance)) > 0) {
        continue;
      }

      double confidence = settings.baseScore();
      confidence += dateProximity(days, settings) * settings.dateWeight();
      confidence += amountAccuracy(difference, transactionAmount) * settings.amountWeight();
      boolean vendorCompared = extracted.vendor() != null && candidate.description() != null;
      if (vendorCompared) {
        confidence +=
            stringSimilarity(
                    extracted.vendor().toLowerCase(Locale.ROOT),
                    candidate.description().toLowerCase(Locale.ROOT))
                * settings.vendorWeight();
      }

      matches.add(
          new MatchSuggestion(
              candidate.transactionId(),
              Math.min(confidence, 1.0),
              days,
              matchReason(documentAmount, transactionAmount, days, vendorCompared)));
    }

    // List.sort is stable, so equal confidences keep the candidates' order.
    matches.sort(Comparator.comparingDouble(MatchSuggestion::confidence).reversed());
    return matches;
  }

  /**
   * Fraction of characters of the shorter string that also occur in the longer one, relative to
   * the longer string's length.
   */
  static double stringSimilarity(String first, String second) {
    String longer = first.length() > second.length() ? first : second;
    String shorter = first.length() > second.length() ? second : first;
    if (longer.isEmpty()) {
      return 1.0;
    }
    int matches = 0;
    for (int i = 0; i < shorter.length(); i++) {
      if (longer.indexOf(shorter.charAt(i)) >= 0) {
        matches++;
      }
    }
    return (double) matches / longer.length();
  }

  private static double dateProximity(long days, MatcherSettings settings) {
    if (settings.dateWindowDays() == 0) {
      return 1.0;
    }
    return (double) (settings.dateWindowDays() - days) / settings.dateWindowDays();
  }

  private static double amountAccuracy(BigDecimal difference, BigDecimal transactionAmount) {
    if (transactionAmount.signum() == 0) {
      // Only an exact match passes the tolerance for a zero amount.
      return 1.0;
    }
    return 1.0 - difference.divide(transactionAmount, MathContext.DECIMAL64).doubleValue();
  }

  private static String matchReason(
      BigDecimal documentAmount, BigDecimal transactionAmount, long days, boolean vendorCompared) {
    StringBuilder reason =
        new StringBuilder("Amount match: ")
            .append(documentAmount.setScale(2, RoundingMode.HALF_EVEN).toPlainString())
            .append(" vs ")
            .append(transactionAmount.setScale(2, RoundingMode.HALF_EVEN).toPlainString());
    if (days == 0) {
      reason.append(", Same date");
    } else {
      reason.append(", ").append(days).append(days == 1 ? " day" : " days").append(" apart");
    }
    if (vendorCompared) {
      reason.append(", Vendor similarity");
    }
    return reason.toString();
  }
}
