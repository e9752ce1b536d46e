package com.flagship.ebank_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UserLoginRequest {

    @NotBlank(message = "Mobile is required")
    @JsonProperty("mobile")
    String mobile;

    @NotBlank(message = "PIN is required")
    @JsonProperty("pin")
    String pin;
}
