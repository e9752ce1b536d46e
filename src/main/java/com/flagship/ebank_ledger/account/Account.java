package com.flagship.ebank_ledger.account;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Read model of a customer account.
 *
 * The PIN hash never leaves {@link AccountEntity}.
 */
@Value
public class Account {
    Long id;
    String accountNumber;
    String name;
    String mobile;
    String address;
    LocalDate dateOfBirth;
    String nationalId;
    BigDecimal balance;
    BigDecimal walletBalance;
    Instant createdAt;
}
