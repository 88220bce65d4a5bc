package com.example.bookkeeping.service;

/** Published after a chunk of transactions has been committed. */
public record TransactionsImportedEvent(Long businessId, int count) {}
