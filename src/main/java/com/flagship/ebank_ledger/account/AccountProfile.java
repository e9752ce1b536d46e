package com.flagship.ebank_ledger.account;

import lombok.Value;

import java.time.LocalDate;

/**
 * Customer details supplied when an account is opened.
 */
@Value
public class AccountProfile {
    String name;
    String mobile;
    String address;
    LocalDate dateOfBirth;
    String nationalId;
}
