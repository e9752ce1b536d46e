package com.flagship.ebank_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every failed request.
 *
 * {@code code} carries the {@link LedgerErrorCode} name when the failure came
 * from the ledger, so clients can branch without parsing messages.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    String code;
    String message;
    Boolean retryable;
    Map<String, String> details;
    Instant timestamp;
}
