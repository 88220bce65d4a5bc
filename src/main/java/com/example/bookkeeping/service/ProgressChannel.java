package com.example.bookkeeping.service;

/**
 * Receives progress events from a batch import. Events are delivered synchronously on the
 * importing thread, so implementations must not block.
 */
@FunctionalInterface
public interface ProgressChannel {

  ProgressChannel DISCARD = progress -> {};

  void publish(ProcessingProgress progress);
}
