package com.flagship.ebank_ledger.account;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Point-in-time totals over all accounts.
 */
@Value
public class AccountStats {
    long totalAccounts;
    BigDecimal totalBankBalance;
    BigDecimal totalWalletBalance;
}
