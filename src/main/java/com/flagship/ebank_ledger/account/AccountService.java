package com.flagship.ebank_ledger.account;

import com.flagship.ebank_ledger.config.LedgerProperties;
import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;
import com.flagship.ebank_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Account store: opening accounts, profile changes and account reads.
 *
 * Balances are never written here; only the ledger engine moves money.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    static final String MOBILE_CONSTRAINT = "uk_accounts_mobile";
    static final String ACCOUNT_NUMBER_CONSTRAINT = "uk_accounts_account_number";

    private final AccountRepository accountRepository;
    private final AccountNumberGenerator numberGenerator;
    private final PinPolicy pinPolicy;
    private final RowLockTimeout lockTimeout;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final LedgerMetrics metrics;

    /**
     * Opens an account under a freshly drawn account number.
     *
     * @param profile customer details
     * @param pin 4-digit PIN, or null for the configured default PIN
     * @return the new account with zero balances
     * @throws LedgerException DUPLICATE_MOBILE, INVALID_PIN, EXHAUSTED_KEYSPACE,
     *         or CONFLICT when a concurrent insert took the drawn number
     */
    @Transactional
    public Account createAccount(AccountProfile profile, String pin) {
        String pinHash = pinPolicy.hash(effectivePin(pin));
        ensureMobileAvailable(profile.getMobile());
        String accountNumber = drawAccountNumber();
        return insert(profile, accountNumber, pinHash);
    }

    /**
     * Opens an account under a caller-chosen account number. Used by
     * deployment tooling that needs stable demo account numbers.
     */
    @Transactional
    public Account createAccount(AccountProfile profile, String pin, String accountNumber) {
        if (!AccountNumberGenerator.isWellFormed(accountNumber)) {
            throw new IllegalArgumentException("Account number must be 8 digits: " + accountNumber);
        }
        String pinHash = pinPolicy.hash(effectivePin(pin));
        ensureMobileAvailable(profile.getMobile());
        if (accountRepository.existsByAccountNumber(accountNumber)) {
            throw new LedgerException(LedgerErrorCode.DUPLICATE_ACCOUNT_NUMBER,
                "Account number already in use: " + accountNumber);
        }
        return insert(profile, accountNumber, pinHash);
    }

    @Transactional(readOnly = true)
    public Account getByAccountNumber(String accountNumber) {
        return accountRepository.findByAccountNumber(accountNumber)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> LedgerException.accountNotFound(accountNumber));
    }

    @Transactional(readOnly = true)
    public Account getByMobile(String mobile) {
        return accountRepository.findByMobile(mobile)
            .map(AccountEntity::toDomain)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.NOT_FOUND,
                "No account registered for mobile " + mobile));
    }

    /**
     * Changes address and/or PIN. The row is locked so the change cannot
     * interleave with a ledger operation on the same account.
     *
     * @throws LedgerException INVALID_PIN, NOT_FOUND, or CONFLICT when the row
     *         lock is not granted within ebank.ledger.lock-timeout
     */
    @Transactional
    public Account updateProfile(String accountNumber, AccountUpdate update) {
        // Hash first so a malformed PIN fails before the row is locked
        String newPinHash = update.getPin() != null ? pinPolicy.hash(update.getPin()) : null;

        AccountEntity account;
        try {
            lockTimeout.apply();
            account = accountRepository.findByAccountNumberForUpdate(accountNumber)
                .orElseThrow(() -> LedgerException.accountNotFound(accountNumber));
        } catch (ConcurrencyFailureException e) {
            log.warn("Profile update for {} lost lock contention: {}", accountNumber, e.getMessage());
            throw LedgerException.conflict("Account is busy, retry the request", e);
        }

        if (update.getAddress() != null) {
            account.changeAddress(update.getAddress());
        }
        if (newPinHash != null) {
            account.changePinHash(newPinHash);
            log.info("PIN changed for account {}", accountNumber);
        }
        return accountRepository.saveAndFlush(account).toDomain();
    }

    /**
     * Customer login by mobile and PIN. An unknown mobile is reported the
     * same way as a wrong PIN.
     */
    @Transactional(readOnly = true)
    public Account authenticate(String mobile, String pin) {
        AccountEntity account = accountRepository.findByMobile(mobile)
            .orElseThrow(LedgerException::invalidPin);
        pinPolicy.verify(account, pin);
        return account.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Account> listAll() {
        return accountRepository.findAllByOrderByIdAsc().stream()
            .map(AccountEntity::toDomain)
            .collect(Collectors.toList());
    }

    /**
     * Single-pass aggregate over the accounts table, computed on every call.
     */
    @Transactional(readOnly = true)
    public AccountStats aggregateStats() {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS total_accounts, " +
            "COALESCE(SUM(balance), 0) AS total_balance, " +
            "COALESCE(SUM(wallet_balance), 0) AS total_wallet_balance " +
            "FROM accounts",
            (rs, rowNum) -> new AccountStats(
                rs.getLong("total_accounts"),
                scaled(rs.getBigDecimal("total_balance")),
                scaled(rs.getBigDecimal("total_wallet_balance"))
            )
        );
    }

    private String effectivePin(String pin) {
        return pin != null ? pin : properties.getAccounts().getDefaultPin();
    }

    private void ensureMobileAvailable(String mobile) {
        if (accountRepository.existsByMobile(mobile)) {
            throw new LedgerException(LedgerErrorCode.DUPLICATE_MOBILE,
                "Account with this mobile already exists");
        }
    }

    /**
     * Bounded retry: draws candidates until one is unused, giving up after
     * the configured number of attempts.
     */
    private String drawAccountNumber() {
        int attempts = properties.getAccounts().getNumberGenerationAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String candidate = numberGenerator.nextCandidate();
            if (!accountRepository.existsByAccountNumber(candidate)) {
                return candidate;
            }
            log.debug("Account number collision on attempt {}: {}", attempt, candidate);
        }
        throw new LedgerException(LedgerErrorCode.EXHAUSTED_KEYSPACE,
            "No free account number found after " + attempts + " attempts");
    }

    private Account insert(AccountProfile profile, String accountNumber, String pinHash) {
        AccountEntity saved;
        try {
            saved = accountRepository.saveAndFlush(AccountEntity.open(profile, accountNumber, pinHash));
        } catch (DataIntegrityViolationException e) {
            throw translateUniqueViolation(e, accountNumber);
        }
        metrics.incrementAccountsCreated();
        log.info("Opened account {}", accountNumber);
        return saved.toDomain();
    }

    /**
     * A concurrent insert can still win the race between the existence
     * checks and our insert; the unique constraint tells us which key lost.
     */
    private RuntimeException translateUniqueViolation(DataIntegrityViolationException e, String accountNumber) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage() != null ? cause.getMessage() : "";
        if (message.contains(MOBILE_CONSTRAINT)) {
            return new LedgerException(LedgerErrorCode.DUPLICATE_MOBILE,
                "Account with this mobile already exists", e);
        }
        if (message.contains(ACCOUNT_NUMBER_CONSTRAINT)) {
            return LedgerException.conflict("Account number " + accountNumber + " was taken concurrently", e);
        }
        return e;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(2);
    }
}
