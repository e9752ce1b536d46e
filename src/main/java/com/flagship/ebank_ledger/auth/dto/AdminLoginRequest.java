package com.flagship.ebank_ledger.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class AdminLoginRequest {

    @NotBlank(message = "Admin ID is required")
    @JsonProperty("admin_id")
    String adminId;

    @NotBlank(message = "Password is required")
    @JsonProperty("password")
    String password;
}
