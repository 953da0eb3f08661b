package com.securebank.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Repository for ledger entries.
 */
@Repository
public interface LedgerRepository extends JpaRepository<LedgerEntry, String> {

    List<LedgerEntry> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<LedgerEntry> findByTransactionId(String transactionId);

    @Query("SELECT COALESCE(SUM(e.amount.amount), 0) FROM LedgerEntry e "
        + "WHERE e.accountId = :accountId AND e.entryType = :entryType")
    BigDecimal sumForAccount(@Param("accountId") String accountId,
                             @Param("entryType") LedgerEntry.EntryType entryType);
}
