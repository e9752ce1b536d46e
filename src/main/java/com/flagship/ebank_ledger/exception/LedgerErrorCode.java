package com.flagship.ebank_ledger.exception;

/**
 * Closed set of failures the ledger reports to its callers.
 *
 * Only {@link #CONFLICT} is retryable; every other code describes a caller or
 * input error and the same request will fail again.
 */
public enum LedgerErrorCode {
    NOT_FOUND,
    DUPLICATE_MOBILE,
    DUPLICATE_ACCOUNT_NUMBER,
    INVALID_PIN,
    INVALID_AMOUNT,
    INVALID_MERCHANT,
    INSUFFICIENT_FUNDS,
    BALANCE_LIMIT_EXCEEDED,
    SAME_ACCOUNT,
    IDEMPOTENCY_KEY_REUSED,
    CONFLICT,
    EXHAUSTED_KEYSPACE;

    public boolean isRetryable() {
        return this == CONFLICT;
    }
}
