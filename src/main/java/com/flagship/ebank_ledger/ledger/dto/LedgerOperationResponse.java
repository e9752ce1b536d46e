package com.flagship.ebank_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Acknowledgment of a ledger mutation. {@code replayed} is true when the
 * Idempotency-Key had already been used and nothing was applied again.
 */
@Value
public class LedgerOperationResponse {

    @JsonProperty("ok")
    boolean ok;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("replayed")
    boolean replayed;

    public static LedgerOperationResponse applied(Long transactionId) {
        return new LedgerOperationResponse(true, transactionId, false);
    }

    public static LedgerOperationResponse replayed(Long transactionId) {
        return new LedgerOperationResponse(true, transactionId, true);
    }
}
