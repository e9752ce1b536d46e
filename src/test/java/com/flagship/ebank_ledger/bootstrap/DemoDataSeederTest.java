package com.flagship.ebank_ledger.bootstrap;

import com.flagship.ebank_ledger.AbstractIntegrationTest;
import com.flagship.ebank_ledger.account.Account;
import com.flagship.ebank_ledger.account.AccountService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@TestPropertySource(properties = "ebank.seed.enabled=true")
class DemoDataSeederTest extends AbstractIntegrationTest {

    @Autowired
    private DemoDataSeeder seeder;

    @Autowired
    private AccountService accountService;

    @Test
    @DisplayName("Demo customers are seeded once with balances explained by the log")
    void seedsOnlyIntoEmptyDatabase() {
        resetDatabase();

        assertEquals(3, seeder.seedIfEmpty());
        assertEquals(0, seeder.seedIfEmpty());

        Account kavi = accountService.getByAccountNumber("12345678");
        assertEquals(new BigDecimal("5000.00"), kavi.getBalance());
        assertEquals(new BigDecimal("500.00"), kavi.getWalletBalance());
        assertEquals("87654321", accountService.authenticate("9876543210", "5678").getAccountNumber());
        assertEquals(new BigDecimal("3200.00"), accountService.getByAccountNumber("45678912").getBalance());

        assertEquals(3, accountService.listAll().size());
        assertEquals(6, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Integer.class));
    }
}
