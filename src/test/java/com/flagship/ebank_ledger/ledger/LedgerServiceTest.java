package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.account.AccountEntity;
import com.flagship.ebank_ledger.account.AccountProfile;
import com.flagship.ebank_ledger.account.AccountRepository;
import com.flagship.ebank_ledger.account.PinPolicy;
import com.flagship.ebank_ledger.account.RowLockTimeout;
import com.flagship.ebank_ledger.config.LedgerProperties;
import com.flagship.ebank_ledger.exception.LedgerErrorCode;
import com.flagship.ebank_ledger.exception.LedgerException;
import com.flagship.ebank_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * Ledger engine rules, checked against in-memory account entities.
 *
 * Locking and atomic commit against PostgreSQL are covered by
 * {@link LedgerIntegrationTest} and {@link LedgerConcurrencyTest}.
 */
class LedgerServiceTest {

    private static final String KAVI = "12345678";
    private static final String ARUN = "87654321";

    private AccountRepository accountRepository;
    private TransactionLogService transactionLog;
    private JdbcTemplate jdbcTemplate;
    private SimpleMeterRegistry meterRegistry;
    private LedgerService ledgerService;

    private AccountEntity kavi;
    private AccountEntity arun;

    @BeforeEach
    void setUp() {
        BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
        PinPolicy pinPolicy = new PinPolicy(encoder);

        accountRepository = mock(AccountRepository.class);
        transactionLog = mock(TransactionLogService.class);
        jdbcTemplate = mock(JdbcTemplate.class);
        meterRegistry = new SimpleMeterRegistry();

        ledgerService = new LedgerService(accountRepository, transactionLog, pinPolicy,
            new RowLockTimeout(jdbcTemplate, new LedgerProperties()), new LedgerMetrics(meterRegistry));

        // Given: kavi has 5000.00 in the bank and 500.00 in the wallet
        kavi = AccountEntity.open(profile("kavi", "1234567890"), KAVI, encoder.encode("1234"));
        kavi.creditBalance(new BigDecimal("5000.00"));
        kavi.creditWallet(new BigDecimal("500.00"));
        arun = AccountEntity.open(profile("arun", "9876543210"), ARUN, encoder.encode("5678"));
        arun.creditBalance(new BigDecimal("7500.00"));

        when(accountRepository.findByAccountNumberForUpdate(anyString())).thenReturn(Optional.empty());
        when(accountRepository.findByAccountNumberForUpdate(KAVI)).thenReturn(Optional.of(kavi));
        when(accountRepository.findByAccountNumberForUpdate(ARUN)).thenReturn(Optional.of(arun));

        when(transactionLog.append(any(), any(), any(), any(), any(), any())).thenAnswer(invocation -> {
            TransactionType type = invocation.getArgument(0);
            AccountEntity from = invocation.getArgument(2);
            AccountEntity to = invocation.getArgument(3);
            return new LedgerTransaction(1L, Instant.now(), type, invocation.getArgument(1),
                from != null ? from.getAccountNumber() : null,
                to != null ? to.getAccountNumber() : null,
                invocation.getArgument(4));
        });
    }

    @Test
    @DisplayName("Deposit, wallet top-up and transfer produce the expected balances")
    void depositWithdrawTransferScenario() {
        LedgerTransaction deposit = ledgerService.deposit(KAVI, "1234", new BigDecimal("100.00"));
        assertEquals(TransactionType.DEPOSIT, deposit.getType());
        assertEquals(new BigDecimal("100.00"), deposit.getAmount());
        assertEquals(KAVI, deposit.getToAccountNumber());
        assertNull(deposit.getFromAccountNumber());
        assertEquals(new BigDecimal("5100.00"), kavi.getBalance());

        ledgerService.withdrawToWallet(KAVI, "1234", new BigDecimal("200.00"));
        assertEquals(new BigDecimal("4900.00"), kavi.getBalance());
        assertEquals(new BigDecimal("700.00"), kavi.getWalletBalance());

        LedgerTransaction transfer = ledgerService.transfer(KAVI, ARUN, "1234", new BigDecimal("300.00"));
        assertEquals(TransactionType.TRANSFER, transfer.getType());
        assertEquals(KAVI, transfer.getFromAccountNumber());
        assertEquals(ARUN, transfer.getToAccountNumber());
        assertEquals(new BigDecimal("4600.00"), kavi.getBalance());
        assertEquals(new BigDecimal("7800.00"), arun.getBalance());

        verify(transactionLog, times(3)).append(any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Deposit without a PIN is accepted")
    void depositWithoutPin() {
        ledgerService.deposit(KAVI, null, new BigDecimal("50.00"));

        assertEquals(new BigDecimal("5050.00"), kavi.getBalance());
    }

    @Test
    @DisplayName("Deposit with a wrong PIN is rejected before any mutation")
    void depositWithWrongPin() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.deposit(KAVI, "0000", new BigDecimal("50.00")));

        assertEquals(LedgerErrorCode.INVALID_PIN, e.getCode());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        verifyNoInteractions(transactionLog);
    }

    @Test
    @DisplayName("Withdraw-to-wallet above the bank balance fails and leaves both balances unchanged")
    void withdrawToWalletInsufficientFunds() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.withdrawToWallet(KAVI, "1234", new BigDecimal("5000.01")));

        assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        assertFalse(e.isRetryable());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        assertEquals(new BigDecimal("500.00"), kavi.getWalletBalance());
        verifyNoInteractions(transactionLog);
    }

    @Test
    @DisplayName("Withdraw-to-wallet of the whole bank balance is allowed")
    void withdrawToWalletWholeBalance() {
        ledgerService.withdrawToWallet(KAVI, "1234", new BigDecimal("5000.00"));

        assertEquals(new BigDecimal("0.00"), kavi.getBalance());
        assertEquals(new BigDecimal("5500.00"), kavi.getWalletBalance());
    }

    @Test
    @DisplayName("Withdraw-to-wallet requires a PIN")
    void withdrawToWalletWithoutPin() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.withdrawToWallet(KAVI, null, new BigDecimal("10.00")));

        assertEquals(LedgerErrorCode.INVALID_PIN, e.getCode());
    }

    @Test
    @DisplayName("Transfer to the same account fails regardless of amount or PIN")
    void transferToSameAccount() {
        LedgerException withGoodPin = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, KAVI, "1234", new BigDecimal("10.00")));
        LedgerException withBadInput = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, KAVI, "9999", new BigDecimal("-5")));

        assertEquals(LedgerErrorCode.SAME_ACCOUNT, withGoodPin.getCode());
        assertEquals(LedgerErrorCode.SAME_ACCOUNT, withBadInput.getCode());
        verifyNoInteractions(accountRepository, transactionLog);
    }

    @Test
    @DisplayName("Transfer locks both accounts in ascending account-number order")
    void transferLocksInAscendingOrder() {
        // When: arun (87654321) pays kavi (12345678)
        ledgerService.transfer(ARUN, KAVI, "5678", new BigDecimal("25.00"));

        // Then: the lower account number is locked first
        InOrder inOrder = inOrder(jdbcTemplate, accountRepository);
        inOrder.verify(jdbcTemplate).execute("SET LOCAL lock_timeout = '3000ms'");
        inOrder.verify(accountRepository).findByAccountNumberForUpdate(KAVI);
        inOrder.verify(accountRepository).findByAccountNumberForUpdate(ARUN);
        assertEquals(new BigDecimal("7475.00"), arun.getBalance());
        assertEquals(new BigDecimal("5025.00"), kavi.getBalance());
    }

    @Test
    @DisplayName("Transfer PIN is checked against the source account only")
    void transferChecksSourcePin() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, ARUN, "5678", new BigDecimal("10.00")));

        assertEquals(LedgerErrorCode.INVALID_PIN, e.getCode());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        assertEquals(new BigDecimal("7500.00"), arun.getBalance());
    }

    @Test
    @DisplayName("Transfer to an unknown account fails with NOT_FOUND and moves nothing")
    void transferToUnknownAccount() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, "11111111", "1234", new BigDecimal("10.00")));

        assertEquals(LedgerErrorCode.NOT_FOUND, e.getCode());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        verifyNoInteractions(transactionLog);
    }

    @Test
    @DisplayName("Transfer above the source balance fails with INSUFFICIENT_FUNDS")
    void transferInsufficientFunds() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, ARUN, "1234", new BigDecimal("6000.00")));

        assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        assertEquals(new BigDecimal("7500.00"), arun.getBalance());
    }

    @Test
    @DisplayName("Wallet payment needs no PIN and records the merchant")
    void walletPayRecordsMerchant() {
        LedgerTransaction payment = ledgerService.walletPay(KAVI, new BigDecimal("120.50"), "  Coffee Shop ");

        assertEquals(TransactionType.WALLET_PAYMENT, payment.getType());
        assertEquals("Coffee Shop", payment.getMerchant());
        assertEquals(KAVI, payment.getFromAccountNumber());
        assertNull(payment.getToAccountNumber());
        assertEquals(new BigDecimal("379.50"), kavi.getWalletBalance());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
    }

    @Test
    @DisplayName("Wallet payment above the wallet balance fails")
    void walletPayInsufficientFunds() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.walletPay(KAVI, new BigDecimal("500.01"), "Grocer"));

        assertEquals(LedgerErrorCode.INSUFFICIENT_FUNDS, e.getCode());
        assertEquals(new BigDecimal("500.00"), kavi.getWalletBalance());
    }

    @Test
    @DisplayName("Wallet payment without a merchant is rejected")
    void walletPayWithoutMerchant() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.walletPay(KAVI, new BigDecimal("5.00"), " "));

        assertEquals(LedgerErrorCode.INVALID_MERCHANT, e.getCode());
        verifyNoInteractions(accountRepository);
    }

    @Test
    @DisplayName("Admin deposit credits the bank balance without a PIN")
    void adminDeposit() {
        LedgerTransaction transaction = ledgerService.adminDeposit(ARUN, new BigDecimal("1000"), "key-1");

        assertEquals(TransactionType.ADMIN_DEPOSIT, transaction.getType());
        assertEquals(new BigDecimal("1000.00"), transaction.getAmount());
        assertEquals(new BigDecimal("8500.00"), arun.getBalance());
        verify(transactionLog).append(eq(TransactionType.ADMIN_DEPOSIT), eq(new BigDecimal("1000.00")),
            isNull(), eq(arun), isNull(), eq("key-1"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "0.00", "-1.00", "10.001", "1000000000000.00", "10000000000000.00"})
    @DisplayName("Non-positive, sub-cent and out-of-range amounts are rejected")
    void invalidAmounts(String amount) {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.adminDeposit(KAVI, new BigDecimal(amount)));

        assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getCode());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
    }

    @Test
    @DisplayName("Credit that would push a balance past the column limit fails and moves nothing")
    void creditBeyondMaximumBalance() {
        // Given: arun is 100.00 below the largest storable balance
        arun.creditBalance(AccountEntity.MAX_BALANCE.subtract(new BigDecimal("7600.00")));

        LedgerException adminCredit = assertThrows(LedgerException.class,
            () -> ledgerService.adminDeposit(ARUN, new BigDecimal("100.01")));
        LedgerException transferIn = assertThrows(LedgerException.class,
            () -> ledgerService.transfer(KAVI, ARUN, "1234", new BigDecimal("200.00")));

        assertEquals(LedgerErrorCode.BALANCE_LIMIT_EXCEEDED, adminCredit.getCode());
        assertEquals(LedgerErrorCode.BALANCE_LIMIT_EXCEEDED, transferIn.getCode());
        assertFalse(transferIn.isRetryable());
        assertEquals(new BigDecimal("999999999899.99"), arun.getBalance());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        verifyNoInteractions(transactionLog);

        ledgerService.adminDeposit(ARUN, new BigDecimal("100.00"));
        assertEquals(AccountEntity.MAX_BALANCE, arun.getBalance());
    }

    @Test
    @DisplayName("Wallet top-up that would overflow the wallet balance is rejected")
    void walletCreditBeyondMaximumBalance() {
        kavi.creditWallet(AccountEntity.MAX_BALANCE.subtract(new BigDecimal("500.00")));

        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.withdrawToWallet(KAVI, "1234", new BigDecimal("0.01")));

        assertEquals(LedgerErrorCode.BALANCE_LIMIT_EXCEEDED, e.getCode());
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        assertEquals(AccountEntity.MAX_BALANCE, kavi.getWalletBalance());
    }

    @Test
    @DisplayName("Missing amount is rejected")
    void nullAmount() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.deposit(KAVI, "1234", null));

        assertEquals(LedgerErrorCode.INVALID_AMOUNT, e.getCode());
    }

    @Test
    @DisplayName("Unknown account fails with NOT_FOUND")
    void unknownAccount() {
        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.adminDeposit("00000000", new BigDecimal("1.00")));

        assertEquals(LedgerErrorCode.NOT_FOUND, e.getCode());
    }

    @Test
    @DisplayName("Lock timeout surfaces as a retryable CONFLICT")
    void lockTimeoutBecomesConflict() {
        when(accountRepository.findByAccountNumberForUpdate(KAVI))
            .thenThrow(new PessimisticLockingFailureException("canceling statement due to lock timeout"));

        LedgerException e = assertThrows(LedgerException.class,
            () -> ledgerService.deposit(KAVI, "1234", new BigDecimal("1.00")));

        assertEquals(LedgerErrorCode.CONFLICT, e.getCode());
        assertTrue(e.isRetryable());
        assertEquals(1.0, meterRegistry.counter("ledger.operations",
            "type", "deposit", "outcome", "CONFLICT").count());
    }

    @Test
    @DisplayName("Operations are counted by type and outcome")
    void metricsRecorded() {
        ledgerService.adminDeposit(KAVI, new BigDecimal("1.00"));
        assertThrows(LedgerException.class, () -> ledgerService.walletPay(KAVI, new BigDecimal("999.00"), "Shop"));

        assertEquals(1.0, meterRegistry.counter("ledger.operations",
            "type", "admin_deposit", "outcome", "success").count());
        assertEquals(1.0, meterRegistry.counter("ledger.operations",
            "type", "wallet_payment", "outcome", "INSUFFICIENT_FUNDS").count());
    }

    private static AccountProfile profile(String name, String mobile) {
        return new AccountProfile(name, mobile, "1 Test Street", LocalDate.of(1990, 1, 1), "123456789012");
    }
}
