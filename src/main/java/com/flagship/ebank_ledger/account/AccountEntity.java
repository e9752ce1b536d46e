package com.flagship.ebank_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for the accounts table.
 *
 * Key design principles:
 * - No setters: balances change only through the credit/debit methods,
 *   which refuse to take either balance below zero
 * - Identity fields (account number, mobile, created_at) are updatable = false
 * - Dynamic updates so a profile change never rewrites balance columns
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@DynamicUpdate
public class AccountEntity {

    private static final int SCALE = 2;

    /**
     * Largest value a NUMERIC(14,2) balance column holds.
     */
    public static final BigDecimal MAX_BALANCE = new BigDecimal("999999999999.99");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_number", nullable = false, unique = true, length = 8, updatable = false)
    private String accountNumber;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 20, updatable = false)
    private String mobile;

    @Column(nullable = false)
    private String address;

    @Column(name = "date_of_birth", nullable = false)
    private LocalDate dateOfBirth;

    @Column(name = "national_id", nullable = false, length = 20)
    private String nationalId;

    @Column(name = "pin_hash", nullable = false, length = 100)
    private String pinHash;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal balance;

    @Column(name = "wallet_balance", nullable = false, precision = 14, scale = 2)
    private BigDecimal walletBalance;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Opens a new account with both balances at zero.
     */
    public static AccountEntity open(AccountProfile profile, String accountNumber, String pinHash) {
        AccountEntity entity = new AccountEntity();
        entity.accountNumber = accountNumber;
        entity.name = profile.getName();
        entity.mobile = profile.getMobile();
        entity.address = profile.getAddress();
        entity.dateOfBirth = profile.getDateOfBirth();
        entity.nationalId = profile.getNationalId();
        entity.pinHash = pinHash;
        entity.balance = BigDecimal.ZERO.setScale(SCALE);
        entity.walletBalance = BigDecimal.ZERO.setScale(SCALE);
        return entity;
    }

    public Account toDomain() {
        return new Account(
            id,
            accountNumber,
            name,
            mobile,
            address,
            dateOfBirth,
            nationalId,
            balance,
            walletBalance,
            createdAt
        );
    }

    void changeAddress(String address) {
        this.address = address;
    }

    void changePinHash(String pinHash) {
        this.pinHash = pinHash;
    }

    public void creditBalance(BigDecimal amount) {
        this.balance = requireWithinLimit(this.balance.add(requirePositive(amount)), "balance")
            .setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public void debitBalance(BigDecimal amount) {
        BigDecimal updated = this.balance.subtract(requirePositive(amount));
        if (updated.signum() < 0) {
            throw new IllegalStateException(
                "Debit of " + amount + " would take balance of account " + accountNumber + " below zero");
        }
        this.balance = updated.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public void creditWallet(BigDecimal amount) {
        this.walletBalance = requireWithinLimit(this.walletBalance.add(requirePositive(amount)), "wallet")
            .setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    public void debitWallet(BigDecimal amount) {
        BigDecimal updated = this.walletBalance.subtract(requirePositive(amount));
        if (updated.signum() < 0) {
            throw new IllegalStateException(
                "Debit of " + amount + " would take wallet of account " + accountNumber + " below zero");
        }
        this.walletBalance = updated.setScale(SCALE, RoundingMode.UNNECESSARY);
    }

    private BigDecimal requireWithinLimit(BigDecimal updated, String column) {
        if (updated.compareTo(MAX_BALANCE) > 0) {
            throw new IllegalStateException(
                "Credit would take " + column + " of account " + accountNumber + " above " + MAX_BALANCE);
        }
        return updated;
    }

    private static BigDecimal requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        return amount;
    }
}
