package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.account.AccountEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA entity for the append-only transactions table.
 *
 * Rows are inserted once and never updated or deleted; Hibernate treats the
 * entity as immutable and a database trigger rejects UPDATE/DELETE.
 */
@Entity
@Immutable
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Convert(converter = TransactionTypeConverter.class)
    @Column(nullable = false, length = 32, updatable = false)
    private TransactionType type;

    @Column(nullable = false, precision = 14, scale = 2, updatable = false)
    private BigDecimal amount;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "from_account_id", updatable = false)
    private AccountEntity fromAccount;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "to_account_id", updatable = false)
    private AccountEntity toAccount;

    @Column(length = 100, updatable = false)
    private String merchant;

    @Column(name = "idempotency_key", unique = true, length = 100, updatable = false)
    private String idempotencyKey;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static TransactionEntity record(TransactionType type, BigDecimal amount,
                                    AccountEntity fromAccount, AccountEntity toAccount,
                                    String merchant, String idempotencyKey) {
        if (fromAccount == null && toAccount == null) {
            throw new IllegalArgumentException("A transaction must reference at least one account");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Transaction amount must be positive");
        }
        TransactionEntity entity = new TransactionEntity();
        entity.type = type;
        entity.amount = amount;
        entity.fromAccount = fromAccount;
        entity.toAccount = toAccount;
        entity.merchant = merchant;
        entity.idempotencyKey = idempotencyKey;
        return entity;
    }

    public LedgerTransaction toDomain() {
        return new LedgerTransaction(
            id,
            createdAt,
            type,
            amount,
            fromAccount != null ? fromAccount.getAccountNumber() : null,
            toAccount != null ? toAccount.getAccountNumber() : null,
            merchant
        );
    }
}
