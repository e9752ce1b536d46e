package com.flagship.ebank_ledger.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, Long> {

    Optional<AccountEntity> findByAccountNumber(String accountNumber);

    Optional<AccountEntity> findByMobile(String mobile);

    boolean existsByAccountNumber(String accountNumber);

    boolean existsByMobile(String mobile);

    List<AccountEntity> findAllByOrderByIdAsc();

    /**
     * Loads an account holding a row lock (SELECT ... FOR UPDATE) until the
     * surrounding transaction ends. Callers locking several accounts must do
     * so in ascending account-number order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.accountNumber = :accountNumber")
    Optional<AccountEntity> findByAccountNumberForUpdate(@Param("accountNumber") String accountNumber);
}
