package com.flagship.ebank_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ebank_ledger.account.AccountStats;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class AdminStatsResponse {

    @JsonProperty("totalCustomers")
    long totalCustomers;

    @JsonProperty("totalBankBalance")
    BigDecimal totalBankBalance;

    @JsonProperty("totalWalletBalance")
    BigDecimal totalWalletBalance;

    public static AdminStatsResponse from(AccountStats stats) {
        return new AdminStatsResponse(
            stats.getTotalAccounts(),
            stats.getTotalBankBalance(),
            stats.getTotalWalletBalance()
        );
    }
}
