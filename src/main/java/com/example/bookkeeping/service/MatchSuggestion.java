package com.example.bookkeeping.service;

/** A scored candidate transaction for a document. */
public record MatchSuggestion(
    Long transactionId, double confidence, long daysApart, String matchReason) {}
