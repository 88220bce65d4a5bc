package com.example.bookkeeping.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * A progress channel that buffers events so another thread (a socket or polling endpoint) can
 * consume them.
 */
public class QueueProgressChannel implements ProgressChannel {

  private final ConcurrentLinkedQueue<ProcessingProgress> events = new ConcurrentLinkedQueue<>();

  @Override
  public void publish(ProcessingProgress progress) {
    events.add(progress);
  }

  /** Returns the oldest event not yet consumed, or null. */
  public ProcessingProgress poll() {
    return events.poll();
  }

  /** Removes and returns every buffered event, oldest first. */
  public List<ProcessingProgress> drain() {
    List<ProcessingProgress> drained = new ArrayList<>();
    ProcessingProgress next;
    while ((next = events.poll()) != null) {
      drained.add(next);
    }
    return drained;
  }
}
