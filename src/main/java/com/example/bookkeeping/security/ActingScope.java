package com.example.bookkeeping.security;

import java.util.Objects;

/**
 * The business a reconciliation action runs for, the user performing it, and whether the caller's
 * authorization layer allowed it.
 */
public record ActingScope(Long businessId, Long actorId, AccessDecision decision) {

  public ActingScope {
    Objects.requireNonNull(businessId, "Business cannot be null");
    Objects.requireNonNull(decision, "Access decision cannot be null");
  }

  public static ActingScope permitted(Long businessId, Long actorId) {
    return new ActingScope(businessId, actorId, AccessDecision.PERMITTED);
  }

  public boolean isPermitted() {
    return decision == AccessDecision.PERMITTED;
  }
}
