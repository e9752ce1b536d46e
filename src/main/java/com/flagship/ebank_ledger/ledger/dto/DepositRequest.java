package com.flagship.ebank_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Customer deposit. The PIN may be omitted; when present it is checked.
 */
@Value
@Builder
@Jacksonized
public class DepositRequest {

    @NotBlank(message = "Account number is required")
    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("pin")
    String pin;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 12, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;
}
