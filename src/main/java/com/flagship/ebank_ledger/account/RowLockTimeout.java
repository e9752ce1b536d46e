package com.flagship.ebank_ledger.account;

import com.flagship.ebank_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Bounds how long the current transaction waits for account row locks.
 *
 * Must run inside the transaction that takes the locks: PostgreSQL resets
 * SET LOCAL at commit or rollback.
 */
@Component
@RequiredArgsConstructor
public class RowLockTimeout {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    public void apply() {
        long timeoutMs = properties.getLedger().getLockTimeout().toMillis();
        jdbcTemplate.execute("SET LOCAL lock_timeout = '" + timeoutMs + "ms'");
    }
}
