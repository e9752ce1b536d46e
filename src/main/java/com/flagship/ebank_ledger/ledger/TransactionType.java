package com.flagship.ebank_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of balance movement recorded in the transaction log.
 *
 * The wire value is what is stored in transactions.type and shown to clients.
 */
public enum TransactionType {
    DEPOSIT("deposit"),
    WITHDRAWAL_TO_WALLET("withdrawal-to-wallet"),
    TRANSFER("transfer"),
    WALLET_PAYMENT("wallet-payment"),
    ADMIN_DEPOSIT("admin-deposit");

    private final String wireValue;

    TransactionType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public static TransactionType fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown transaction type: " + value));
    }
}
