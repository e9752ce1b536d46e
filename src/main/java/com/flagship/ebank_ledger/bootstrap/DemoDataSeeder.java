package com.flagship.ebank_ledger.bootstrap;

import com.flagship.ebank_ledger.account.AccountProfile;
import com.flagship.ebank_ledger.account.AccountRepository;
import com.flagship.ebank_ledger.account.AccountService;
import com.flagship.ebank_ledger.ledger.LedgerService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Seeds the demo customers when ebank.seed.enabled=true and no account exists yet.
 *
 * Opening balances go through the ledger (admin deposit, then a PIN-checked
 * wallet top-up), so the demo balances are explained by transactions like
 * any other balance.
 */
@Component
@ConditionalOnProperty(prefix = "ebank.seed", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoDataSeeder implements ApplicationRunner {

    static final List<DemoAccount> DEMO_ACCOUNTS = List.of(
        new DemoAccount("12345678", "1234",
            new AccountProfile("kavi", "1234567890", "123 Main Street, New York, NY 10001",
                LocalDate.of(1990, 1, 15), "123456789012"),
            new BigDecimal("5000.00"), new BigDecimal("500.00")),
        new DemoAccount("87654321", "5678",
            new AccountProfile("arun", "9876543210", "456 Oak Avenue, Los Angeles, CA 90210",
                LocalDate.of(1985, 3, 22), "987654321098"),
            new BigDecimal("7500.00"), new BigDecimal("750.00")),
        new DemoAccount("45678912", "9876",
            new AccountProfile("gokul", "5551234567", "789 Pine Road, Chicago, IL 60601",
                LocalDate.of(1992, 7, 8), "456789123456"),
            new BigDecimal("3200.00"), new BigDecimal("320.00"))
    );

    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final LedgerService ledgerService;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        seedIfEmpty();
    }

    /**
     * All or nothing: a failure leaves no partial demo data behind.
     *
     * @return the number of accounts created (0 when data already exists)
     */
    @Transactional
    public int seedIfEmpty() {
        if (accountRepository.count() > 0) {
            log.info("Accounts already present, skipping demo data");
            return 0;
        }

        for (DemoAccount demo : DEMO_ACCOUNTS) {
            accountService.createAccount(demo.getProfile(), demo.getPin(), demo.getAccountNumber());
            ledgerService.adminDeposit(demo.getAccountNumber(), demo.getBalance().add(demo.getWalletBalance()));
            ledgerService.withdrawToWallet(demo.getAccountNumber(), demo.getPin(), demo.getWalletBalance());
        }
        log.info("Seeded {} demo accounts", DEMO_ACCOUNTS.size());
        return DEMO_ACCOUNTS.size();
    }

    @Value
    static class DemoAccount {
        String accountNumber;
        String pin;
        AccountProfile profile;
        BigDecimal balance;
        BigDecimal walletBalance;
    }
}
