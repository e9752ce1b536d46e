package com.flagship.ebank_ledger.idempotency;

import com.flagship.ebank_ledger.ledger.TransactionType;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What an Idempotency-Key produced the first time it was used.
 */
@Value
public class IdempotencyRecord {
    Long transactionId;
    TransactionType type;
    BigDecimal amount;

    /**
     * True when a repeated request is the same kind of operation for the same amount.
     */
    public boolean matches(TransactionType requestedType, BigDecimal requestedAmount) {
        return type == requestedType
            && requestedAmount != null
            && amount.compareTo(requestedAmount) == 0;
    }
}
