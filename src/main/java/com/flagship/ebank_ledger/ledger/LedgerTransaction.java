package com.flagship.ebank_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable record of one balance movement.
 *
 * Accounts are referenced by account number; at least one of
 * {@code fromAccountNumber} and {@code toAccountNumber} is set.
 */
@Value
public class LedgerTransaction {
    Long id;
    Instant createdAt;
    TransactionType type;
    BigDecimal amount;
    String fromAccountNumber;
    String toAccountNumber;
    String merchant;
}
