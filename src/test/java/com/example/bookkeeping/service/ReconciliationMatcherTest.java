package com.example.bookkeeping.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.bookkeeping.domain.ExtractedDocumentData;

class ReconciliationMatcherTest {

  private static final LocalDate RECEIPT_DATE = LocalDate.of(2024, 3, 10);

  // Low base score so that close candidates are not all capped at 1.0.
  private static final MatcherSettings UNCAPPED =
      new MatcherSettings(7, 0.05, 0.2, 0.3, 0.3, 0.2, 3, 0.9, 0.8);

  private final ReconciliationMatcher matcher =
      new ReconciliationMatcher(MatcherSettings.defaults());

  @Test
  void findMatches_staplesReceipt_scoresSameDayExactAmountAsConfident() {
    // Given
    ExtractedDocumentData receipt = receipt("Staples", "52.30", RECEIPT_DATE);
    List<TransactionCandidate> candidates =
        List.of(candidate(1L, RECEIPT_DATE, "52.30", "STAPLES STORE #4421"));

    // When
    List<MatchSuggestion> matches = matcher.findMatches(receipt, candidates);

    // Then
    assertEquals(1, matches.size());
    MatchSuggestion match = matches.get(0);
    assertEquals(1L, match.transactionId());
    assertTrue(match.confidence() >= 0.9);
    assertTrue(match.confidence() <= 1.0);
    assertEquals(0, match.daysApart());
    assertEquals("Amount match: 52.30 vs 52.30, Same date, Vendor similarity", match.matchReason());
  }

  @Test
  void findMatches_outsideDateWindow_isDropped() {
    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "52.30", RECEIPT_DATE),
            List.of(
                candidate(1L, RECEIPT_DATE.plusDays(7), "52.30", null),
                candidate(2L, RECEIPT_DATE.minusDays(8), "52.30", null)));

    assertEquals(1, matches.size());
    assertEquals(1L, matches.get(0).transactionId());
    assertEquals("Amount match: 52.30 vs 52.30, 7 days apart", matches.get(0).matchReason());
  }

  @Test
  void findMatches_outsideAmountTolerance_isDropped() {
    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "52.30", RECEIPT_DATE),
            List.of(
                candidate(1L, RECEIPT_DATE, "55.00", null),
                candidate(2L, RECEIPT_DATE, "56.00", null)));

    assertEquals(1, matches.size());
    assertEquals(1L, matches.get(0).transactionId());
  }

  @Test
  void findMatches_signedAmounts_areComparedByMagnitude() {
    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "52.30", RECEIPT_DATE),
            List.of(candidate(1L, RECEIPT_DATE, "-52.30", null)));

    assertEquals(1, matches.size());
  }

  @Test
  void findMatches_closerDate_neverScoresLower() {
    List<TransactionCandidate> candidates =
        List.of(
            candidate(3L, RECEIPT_DATE.plusDays(3), "52.30", "Staples"),
            candidate(1L, RECEIPT_DATE.plusDays(1), "52.30", "Staples"),
            candidate(2L, RECEIPT_DATE.plusDays(2), "52.30", "Staples"));

    List<MatchSuggestion> matches =
        matcher.findMatches(receipt(null, "52.30", RECEIPT_DATE), candidates, UNCAPPED);

    assertEquals(List.of(1L, 2L, 3L), ids(matches));
    assertTrue(matches.get(0).confidence() > matches.get(1).confidence());
    assertTrue(matches.get(1).confidence() > matches.get(2).confidence());
    assertEquals("Amount match: 52.30 vs 52.30, 1 day apart", matches.get(0).matchReason());
  }

  @Test
  void findMatches_closerAmount_neverScoresLower() {
    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "100.00", RECEIPT_DATE),
            List.of(
                candidate(1L, RECEIPT_DATE, "103.00", null),
                candidate(2L, RECEIPT_DATE, "101.00", null)),
            UNCAPPED);

    assertEquals(2L, matches.get(0).transactionId());
    assertTrue(matches.get(0).confidence() > matches.get(1).confidence());
  }

  @Test
  void findMatches_equalScores_keepCandidateOrder() {
    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "20.00", RECEIPT_DATE),
            List.of(
                candidate(5L, RECEIPT_DATE, "20.00", null),
                candidate(4L, RECEIPT_DATE, "20.00", null),
                candidate(6L, RECEIPT_DATE, "20.00", null)));

    assertEquals(List.of(5L, 4L, 6L), ids(matches));
  }

  @Test
  void findMatches_scoresStayWithinBounds() {
    List<TransactionCandidate> candidates =
        List.of(
            candidate(1L, RECEIPT_DATE, "52.30", "staples"),
            candidate(2L, RECEIPT_DATE.plusDays(7), "50.00", "zzz"),
            candidate(3L, RECEIPT_DATE.minusDays(4), "54.00", ""));

    for (MatchSuggestion match :
        matcher.findMatches(receipt("Staples", "52.30", RECEIPT_DATE), candidates)) {
      assertTrue(match.confidence() >= 0.0 && match.confidence() <= 1.0);
    }
  }

  @Test
  void findMatches_documentWithoutDateOrAmount_hasNoMatches() {
    List<TransactionCandidate> candidates =
        List.of(candidate(1L, RECEIPT_DATE, "52.30", "Staples"));

    assertTrue(matcher.findMatches(receipt("Staples", null, RECEIPT_DATE), candidates).isEmpty());
    assertTrue(matcher.findMatches(receipt("Staples", "52.30", null), candidates).isEmpty());
  }

  @Test
  void findMatches_customSettings_overrideDefaults() {
    MatcherSettings strict = new MatcherSettings(0, 0.0, 0.5, 0.3, 0.3, 0.2, 3, 0.9, 0.8);

    List<MatchSuggestion> matches =
        matcher.findMatches(
            receipt(null, "52.30", RECEIPT_DATE),
            List.of(
                candidate(1L, RECEIPT_DATE, "52.31", null),
                candidate(2L, RECEIPT_DATE.plusDays(1), "52.30", null),
                candidate(3L, RECEIPT_DATE, "52.30", null)),
            strict);

    assertEquals(1, matches.size());
    assertEquals(3L, matches.get(0).transactionId());
  }

  @Test
  void stringSimilarity_comparesCharactersOfShorterAgainstLonger() {
    assertEquals(1.0, ReconciliationMatcher.stringSimilarity("abc", "abc"));
    assertEquals(1.0, ReconciliationMatcher.stringSimilarity("", ""));
    assertEquals(0.5, ReconciliationMatcher.stringSimilarity("ab", "abcd"));
    assertEquals(0.0, ReconciliationMatcher.stringSimilarity("xyz", "abc"));
    assertEquals(0.0, ReconciliationMatcher.stringSimilarity("", "abc"));
  }

  private static List<Long> ids(List<MatchSuggestion> matches) {
    return matches.stream().map(MatchSuggestion::transactionId).toList();
  }

  private static ExtractedDocumentData receipt(String vendor, String amount, LocalDate date) {
    return new ExtractedDocumentData(
        vendor, amount == null ? null : new BigDecimal(amount), date, null, 0.95, List.of());
  }

  private static TransactionCandidate candidate(
      Long id, LocalDate date, String amount, String description) {
    return new TransactionCandidate(id, date, new BigDecimal(amount), description);
  }
}
