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

@Value
@Builder
@Jacksonized
public class TransferRequest {

    @NotBlank(message = "Source account number is required")
    @JsonProperty("from_account_number")
    String fromAccountNumber;

    @NotBlank(message = "Destination account number is required")
    @JsonProperty("to_account_number")
    String toAccountNumber;

    @NotBlank(message = "PIN is required")
    @JsonProperty("pin")
    String pin;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @Digits(integer = 12, fraction = 2, message = "Amount must have at most 2 decimal places")
    @JsonProperty("amount")
    BigDecimal amount;
}
