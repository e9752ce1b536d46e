package com.flagship.ebank_ledger.ledger;

import com.flagship.ebank_ledger.account.AccountEntity;
import com.flagship.ebank_ledger.account.AccountRepository;
import com.flagship.ebank_ledger.config.LedgerProperties;
import com.flagship.ebank_ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only transaction log.
 *
 * Appends join the caller's transaction (the ledger engine's unit of work);
 * there is no way to write a transaction row on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLogService {

    static final String IDEMPOTENCY_KEY_CONSTRAINT = "uk_transactions_idempotency_key";

    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;

    /**
     * Records a movement in the caller's transaction. The row is flushed at
     * once so a duplicate idempotency key fails here, before commit.
     *
     * @throws LedgerException CONFLICT if the idempotency key is already used
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransaction append(TransactionType type, BigDecimal amount,
                                    AccountEntity fromAccount, AccountEntity toAccount,
                                    String merchant, String idempotencyKey) {
        TransactionEntity entity = TransactionEntity.record(
            type, amount, fromAccount, toAccount, merchant, idempotencyKey);
        try {
            TransactionEntity saved = transactionRepository.saveAndFlush(entity);
            log.debug("Recorded {} transaction {} for {}", type.getWireValue(), saved.getId(), amount);
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            String message = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
            if (idempotencyKey != null && message != null && message.contains(IDEMPOTENCY_KEY_CONSTRAINT)) {
                throw LedgerException.conflict(
                    "Request with idempotency key " + idempotencyKey + " was already submitted", e);
            }
            throw e;
        }
    }

    /**
     * Transaction history, newest first.
     *
     * @throws LedgerException NOT_FOUND if the account filter does not resolve
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> query(TransactionQuery query) {
        StringBuilder sql = new StringBuilder(
            "SELECT t.id, t.created_at, t.type, t.amount, t.merchant, " +
            "fa.account_number AS from_account_number, ta.account_number AS to_account_number " +
            "FROM transactions t " +
            "LEFT JOIN accounts fa ON fa.id = t.from_account_id " +
            "LEFT JOIN accounts ta ON ta.id = t.to_account_id " +
            "WHERE 1 = 1");
        List<Object> args = new ArrayList<>();

        if (query.getAccountNumber() != null) {
            Long accountId = accountRepository.findByAccountNumber(query.getAccountNumber())
                .map(AccountEntity::getId)
                .orElseThrow(() -> LedgerException.accountNotFound(query.getAccountNumber()));
            sql.append(" AND (t.from_account_id = ? OR t.to_account_id = ?)");
            args.add(accountId);
            args.add(accountId);
        }

        ZoneId zone = properties.getLedger().getZone();
        if (query.getStartDate() != null) {
            sql.append(" AND t.created_at >= ?");
            args.add(query.getStartDate().atStartOfDay(zone).toOffsetDateTime());
        }
        if (query.getEndDate() != null) {
            // Inclusive end day: everything before the next day's midnight
            sql.append(" AND t.created_at < ?");
            args.add(query.getEndDate().plusDays(1).atStartOfDay(zone).toOffsetDateTime());
        }

        sql.append(" ORDER BY t.created_at DESC, t.id DESC");

        return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
    }

    private RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getLong("id"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant(),
            TransactionType.fromWireValue(rs.getString("type")),
            rs.getBigDecimal("amount"),
            rs.getString("from_account_number"),
            rs.getString("to_account_number"),
            rs.getString("merchant")
        );
    }
}
