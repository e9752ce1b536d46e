package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.account.AccountEntity;
import com.flagship.ebank_ledger.account.AccountRepository;
import com.flagship.ebank_ledger.account.PinPolicy;
import com.flagship.ebank_ledger.account.RowLockTimeout;
import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;
import com.flagship.ebank_ledger.observability.CorrelationContext;
import com.flagship.ebank_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * The ledger engine: every operation that moves money.
 *
 * Each public method is one database transaction that:
 * 1. Validates the request arguments (amount, same-account)
 * 2. Locks the touched account rows (SELECT ... FOR UPDATE, ascending account number)
 * 3. Checks PIN and available funds against the locked rows
 * 4. Applies the balance deltas
 * 5. Appends exactly one transaction row explaining them
 *
 * Every check happens before the first mutation, and the whole unit commits
 * or rolls back together. Lock waits are bounded by ebank.ledger.lock-timeout;
 * a timeout or deadlock surfaces as a retryable CONFLICT.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final int MAX_MERCHANT_LENGTH = 100;

    private final AccountRepository accountRepository;
    private final TransactionLogService transactionLog;
    private final PinPolicy pinPolicy;
    private final RowLockTimeout lockTimeout;
    private final LedgerMetrics metrics;

    @Transactional
    public LedgerTransaction deposit(String accountNumber, String pin, BigDecimal amount) {
        return deposit(accountNumber, pin, amount, null);
    }

    /**
     * Credits the bank balance. The PIN is optional; when supplied it must match.
     *
     * @throws LedgerException INVALID_AMOUNT, NOT_FOUND, INVALID_PIN, BALANCE_LIMIT_EXCEEDED, CONFLICT
     */
    @Transactional
    public LedgerTransaction deposit(String accountNumber, String pin, BigDecimal amount, String idempotencyKey) {
        return execute(TransactionType.DEPOSIT, accountNumber, () -> {
            BigDecimal value = Money.requireValidAmount(amount);
            AccountEntity account = lockAccounts(accountNumber).get(accountNumber);
            if (pin != null) {
                pinPolicy.verify(account, pin);
            }
            requireHeadroom(account.getBalance(), value, accountNumber);

            account.creditBalance(value);
            return transactionLog.append(TransactionType.DEPOSIT, value, null, account, null, idempotencyKey);
        });
    }

    @Transactional
    public LedgerTransaction withdrawToWallet(String accountNumber, String pin, BigDecimal amount) {
        return withdrawToWallet(accountNumber, pin, amount, null);
    }

    /**
     * Moves money from the bank balance to the wallet balance of the same account.
     *
     * @throws LedgerException INVALID_AMOUNT, NOT_FOUND, INVALID_PIN, INSUFFICIENT_FUNDS, CONFLICT
     */
    @Transactional
    public LedgerTransaction withdrawToWallet(String accountNumber, String pin, BigDecimal amount,
                                              String idempotencyKey) {
        return execute(TransactionType.WITHDRAWAL_TO_WALLET, accountNumber, () -> {
            BigDecimal value = Money.requireValidAmount(amount);
            AccountEntity account = lockAccounts(accountNumber).get(accountNumber);
            pinPolicy.verify(account, pin);
            requireFunds(account.getBalance(), value, accountNumber);
            requireHeadroom(account.getWalletBalance(), value, accountNumber);

            account.debitBalance(value);
            account.creditWallet(value);
            return transactionLog.append(TransactionType.WITHDRAWAL_TO_WALLET, value, account, null, null,
                idempotencyKey);
        });
    }

    @Transactional
    public LedgerTransaction transfer(String fromAccountNumber, String toAccountNumber, String pin,
                                      BigDecimal amount) {
        return transfer(fromAccountNumber, toAccountNumber, pin, amount, null);
    }

    /**
     * Moves money between the bank balances of two different accounts. The PIN
     * authorizes the source account only.
     *
     * @throws LedgerException SAME_ACCOUNT, INVALID_AMOUNT, NOT_FOUND, INVALID_PIN,
     *         INSUFFICIENT_FUNDS, CONFLICT
     */
    @Transactional
    public LedgerTransaction transfer(String fromAccountNumber, String toAccountNumber, String pin,
                                      BigDecimal amount, String idempotencyKey) {
        return execute(TransactionType.TRANSFER, fromAccountNumber, () -> {
            if (fromAccountNumber != null && fromAccountNumber.equals(toAccountNumber)) {
                throw new LedgerException(LedgerErrorCode.SAME_ACCOUNT, "Cannot transfer to same account");
            }
            BigDecimal value = Money.requireValidAmount(amount);

            Map<String, AccountEntity> locked = lockAccounts(fromAccountNumber, toAccountNumber);
            AccountEntity source = locked.get(fromAccountNumber);
            AccountEntity destination = locked.get(toAccountNumber);
            pinPolicy.verify(source, pin);
            requireFunds(source.getBalance(), value, fromAccountNumber);
            requireHeadroom(destination.getBalance(), value, toAccountNumber);

            source.debitBalance(value);
            destination.creditBalance(value);
            return transactionLog.append(TransactionType.TRANSFER, value, source, destination, null,
                idempotencyKey);
        });
    }

    @Transactional
    public LedgerTransaction walletPay(String accountNumber, BigDecimal amount, String merchant) {
        return walletPay(accountNumber, amount, merchant, null);
    }

    /**
     * Pays a merchant from the wallet balance. No PIN is asked for; the
     * exposure is capped by the wallet balance.
     *
     * @throws LedgerException INVALID_AMOUNT, INVALID_MERCHANT, NOT_FOUND, INSUFFICIENT_FUNDS, CONFLICT
     */
    @Transactional
    public LedgerTransaction walletPay(String accountNumber, BigDecimal amount, String merchant,
                                       String idempotencyKey) {
        return execute(TransactionType.WALLET_PAYMENT, accountNumber, () -> {
            BigDecimal value = Money.requireValidAmount(amount);
            String label = requireMerchant(merchant);
            AccountEntity account = lockAccounts(accountNumber).get(accountNumber);
            requireFunds(account.getWalletBalance(), value, accountNumber);

            account.debitWallet(value);
            return transactionLog.append(TransactionType.WALLET_PAYMENT, value, account, null, label,
                idempotencyKey);
        });
    }

    @Transactional
    public LedgerTransaction adminDeposit(String accountNumber, BigDecimal amount) {
        return adminDeposit(accountNumber, amount, null);
    }

    /**
     * Credits the bank balance on behalf of a trusted administrative caller.
     *
     * @throws LedgerException INVALID_AMOUNT, NOT_FOUND, BALANCE_LIMIT_EXCEEDED, CONFLICT
     */
    @Transactional
    public LedgerTransaction adminDeposit(String accountNumber, BigDecimal amount, String idempotencyKey) {
        return execute(TransactionType.ADMIN_DEPOSIT, accountNumber, () -> {
            BigDecimal value = Money.requireValidAmount(amount);
            AccountEntity account = lockAccounts(accountNumber).get(accountNumber);
            requireHeadroom(account.getBalance(), value, accountNumber);

            account.creditBalance(value);
            return transactionLog.append(TransactionType.ADMIN_DEPOSIT, value, null, account, null,
                idempotencyKey);
        });
    }

    /**
     * Runs one operation body with logging, metrics and lock-failure translation.
     */
    private LedgerTransaction execute(TransactionType type, String accountNumber,
                                      Supplier<LedgerTransaction> operation) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(accountNumber));

        try {
            LedgerTransaction transaction = operation.get();

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(type.getWireValue(), "success");
            metrics.recordLatency(type.getWireValue(), duration);
            log.info("Ledger {} recorded: txId={}, amount={}, duration={}ms",
                type.getWireValue(), transaction.getId(), transaction.getAmount(), duration);
            return transaction;

        } catch (LedgerException e) {
            metrics.recordOperation(type.getWireValue(), e.getCode().name());
            throw e;
        } catch (ConcurrencyFailureException e) {
            metrics.recordOperation(type.getWireValue(), LedgerErrorCode.CONFLICT.name());
            log.warn("Ledger {} lost lock contention: {}", type.getWireValue(), e.getMessage());
            throw LedgerException.conflict("Account is busy, retry the request", e);
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    /**
     * Locks the given accounts in ascending account-number order, so two
     * operations touching the same pair can never wait on each other in a cycle.
     *
     * @throws LedgerException NOT_FOUND if any number does not resolve
     */
    private Map<String, AccountEntity> lockAccounts(String... accountNumbers) {
        if (Arrays.stream(accountNumbers).anyMatch(Objects::isNull)) {
            throw new LedgerException(LedgerErrorCode.NOT_FOUND, "Account number is required");
        }
        lockTimeout.apply();

        Map<String, AccountEntity> locked = new HashMap<>();
        for (String accountNumber : new TreeSet<>(Arrays.asList(accountNumbers))) {
            AccountEntity account = accountRepository.findByAccountNumberForUpdate(accountNumber)
                .orElseThrow(() -> LedgerException.accountNotFound(accountNumber));
            locked.put(accountNumber, account);
        }
        return locked;
    }

    private static void requireFunds(BigDecimal available, BigDecimal amount, String accountNumber) {
        if (available.compareTo(amount) < 0) {
            throw LedgerException.insufficientFunds(accountNumber);
        }
    }

    private static void requireHeadroom(BigDecimal current, BigDecimal amount, String accountNumber) {
        if (current.add(amount).compareTo(AccountEntity.MAX_BALANCE) > 0) {
            throw new LedgerException(LedgerErrorCode.BALANCE_LIMIT_EXCEEDED,
                "Credit of " + amount.toPlainString() + " would exceed the maximum balance of account "
                    + accountNumber);
        }
    }

    private static String requireMerchant(String merchant) {
        if (merchant == null || merchant.isBlank()) {
            throw new LedgerException(LedgerErrorCode.INVALID_MERCHANT, "Merchant is required");
        }
        String label = merchant.strip();
        if (label.length() > MAX_MERCHANT_LENGTH) {
            throw new LedgerException(LedgerErrorCode.INVALID_MERCHANT,
                "Merchant must be at most " + MAX_MERCHANT_LENGTH + " characters");
        }
        return label;
    }
}
