package com.flagship.ebank_ledger.exception;

import lombok.Getter;

/**
 * Failure raised by the account store and the ledger engine.
 *
 * The {@link LedgerErrorCode} is what callers inspect; the message is for logs
 * and API responses.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public LedgerException(LedgerErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static LedgerException accountNotFound(String accountNumber) {
        return new LedgerException(LedgerErrorCode.NOT_FOUND, "Account not found: " + accountNumber);
    }

    public static LedgerException invalidPin() {
        return new LedgerException(LedgerErrorCode.INVALID_PIN, "Invalid PIN");
    }

    public static LedgerException insufficientFunds(String accountNumber) {
        return new LedgerException(LedgerErrorCode.INSUFFICIENT_FUNDS,
            "Insufficient balance on account " + accountNumber);
    }

    public static LedgerException conflict(String message, Throwable cause) {
        return new LedgerException(LedgerErrorCode.CONFLICT, message, cause);
    }
}
