package com.flagship.ebank_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ebank_ledger.ledger.LedgerTransaction;
import com.flagship.ebank_ledger.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("fromAccount")
    String fromAccount;

    @JsonProperty("toAccount")
    String toAccount;

    @JsonProperty("merchant")
    String merchant;

    public static TransactionResponse from(LedgerTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .date(transaction.getCreatedAt())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .fromAccount(transaction.getFromAccountNumber())
            .toAccount(transaction.getToAccountNumber())
            .merchant(transaction.getMerchant())
            .build();
    }
}
