package com.example.bookkeeping.security;

/** Result of the caller's authorization check, made outside this module. */
public enum AccessDecision {
  PERMITTED,
  DENIED
}
