package com.flagship.ebank_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ebank_ledger.account.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("name")
    String name;

    @JsonProperty("mobile")
    String mobile;

    @JsonProperty("address")
    String address;

    @JsonProperty("dob")
    LocalDate dateOfBirth;

    @JsonProperty("aadhar")
    String nationalId;

    @JsonProperty("account_number")
    String accountNumber;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("wallet_balance")
    BigDecimal walletBalance;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .name(account.getName())
            .mobile(account.getMobile())
            .address(account.getAddress())
            .dateOfBirth(account.getDateOfBirth())
            .nationalId(account.getNationalId())
            .accountNumber(account.getAccountNumber())
            .balance(account.getBalance())
            .walletBalance(account.getWalletBalance())
            .build();
    }
}
