package com.example.bookkeeping.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

import com.example.bookkeeping.domain.Document;
import com.example.bookkeeping.domain.Transaction;

/**
 * Checks the acting scope before reconciliation state changes. Every check runs before any write,
 * so a rejected call leaves no trace.
 */
@Component
public class ReconciliationAccessGuard {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationAccessGuard.class);

  /** Requires the caller to have been permitted. */
  public void checkPermitted(ActingScope scope) {
    if (!scope.isPermitted()) {
      log.warn(
          "Reconciliation denied for user {} in business {}", scope.actorId(), scope.businessId());
      throw new AccessDeniedException("Not permitted to reconcile for this business");
    }
  }

  public void checkTransaction(ActingScope scope, Transaction transaction) {
    checkPermitted(scope);
    if (!scope.businessId().equals(transaction.getBusinessId())) {
      log.warn(
          "User {} attempted to reconcile transaction {} outside business {}",
          scope.actorId(),
          transaction.getId(),
          scope.businessId());
      throw new AccessDeniedException("Transaction does not belong to this business");
    }
  }

  public void checkDocument(ActingScope scope, Document document) {
    checkPermitted(scope);
    if (!scope.businessId().equals(document.getBusinessId())) {
      log.warn(
          "User {} attempted to use document {} outside business {}",
          scope.actorId(),
          document.getId(),
          scope.businessId());
      throw new AccessDeniedException("Document does not belong to this business");
    }
  }
}
