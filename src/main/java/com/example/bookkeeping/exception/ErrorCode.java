package com.example.bookkeeping.exception;

/** Machine-readable failure categories reported to callers. */
public enum ErrorCode {
  CONFIGURATION,
  SEMANTIC,
  PERSISTENCE,
  EXTRACTION,
  ACCESS_DENIED,
  NOT_FOUND,
  INVALID_INPUT,
  INTERNAL
}
