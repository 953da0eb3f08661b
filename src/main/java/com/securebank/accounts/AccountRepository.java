package com.securebank.accounts;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Repository for account persistence.
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByAccountNumber(String accountNumber);

    boolean existsByAccountNumber(String accountNumber);

    List<Account> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    boolean existsByOwnerIdAndAccountTypeAndStatus(String ownerId, AccountType accountType, AccountStatus status);

    /**
     * Owner lookup that does not load the entity into the persistence context, so a later
     * locking read returns fresh state.
     */
    @Query("SELECT a.ownerId FROM Account a WHERE a.accountId = :accountId")
    Optional<String> findOwnerIdByAccountId(@Param("accountId") String accountId);

    @Query("SELECT a.accountId FROM Account a WHERE a.accountNumber = :accountNumber")
    Optional<String> findIdByAccountNumber(@Param("accountNumber") String accountNumber);

    /**
     * Lock the account row for the duration of the current transaction.
     * Callers locking more than one account must do so in ascending id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.accountId = :accountId")
    Optional<Account> findByIdForUpdate(@Param("accountId") String accountId);

    @Query("SELECT a FROM Account a WHERE a.accountNumber LIKE concat('%', :term, '%') "
        + "OR a.ownerId IN (SELECT u.userId FROM User u WHERE lower(u.username) LIKE lower(concat('%', :term, '%')))")
    Page<Account> search(@Param("term") String term, Pageable pageable);

    @Query("SELECT COALESCE(SUM(a.balance.amount), 0) FROM Account a")
    BigDecimal sumBalances();
}
