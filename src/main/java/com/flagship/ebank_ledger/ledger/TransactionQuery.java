package com.flagship.ebank_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional filters for transaction history. Date bounds are inclusive
 * calendar days.
 */
@Value
@Builder
public class TransactionQuery {
    String accountNumber;
    LocalDate startDate;
    LocalDate endDate;

    public static TransactionQuery all() {
        return TransactionQuery.builder().build();
    }
}
