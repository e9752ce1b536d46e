package com.flagship.ebank_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ebank_ledger.account.AccountUpdate;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Both fields optional. PIN format is checked by the account store so a bad
 * PIN is reported as INVALID_PIN.
 */
@Value
@Builder
@Jacksonized
public class UpdateAccountRequest {

    @Size(max = 255, message = "Address must be at most 255 characters")
    @JsonProperty("address")
    String address;

    @JsonProperty("pin")
    String pin;

    public AccountUpdate toUpdate() {
        return new AccountUpdate(address, pin);
    }
}
