package com.flagship.ebank_ledger.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Inserts into the transaction log. History reads go through
 * {@link TransactionLogService#query(TransactionQuery)}.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long> {

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);
}
