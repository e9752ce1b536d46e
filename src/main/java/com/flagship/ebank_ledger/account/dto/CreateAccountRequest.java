package com.flagship.ebank_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ebank_ledger.account.AccountProfile;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CreateAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @NotBlank(message = "Mobile is required")
    @Size(max = 20, message = "Mobile must be at most 20 characters")
    @JsonProperty("mobile")
    String mobile;

    @NotBlank(message = "Address is required")
    @Size(max = 255, message = "Address must be at most 255 characters")
    @JsonProperty("address")
    String address;

    @NotNull(message = "Date of birth is required")
    @Past(message = "Date of birth must be in the past")
    @JsonProperty("dob")
    LocalDate dateOfBirth;

    /**
     * National ID (Aadhaar number); named {@code aadhar} on the wire.
     */
    @NotBlank(message = "Aadhar is required")
    @Size(max = 20, message = "Aadhar must be at most 20 characters")
    @JsonProperty("aadhar")
    String nationalId;

    /**
     * Optional; the configured default PIN applies when absent.
     */
    @Pattern(regexp = "^\\d{4}$", message = "PIN must be 4 digits")
    @JsonProperty("pin")
    String pin;

    public AccountProfile toProfile() {
        return new AccountProfile(name, mobile, address, dateOfBirth, nationalId);
    }
}
