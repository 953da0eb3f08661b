package com.securebank.transfers;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for transaction records.
 */
@Repository
public interface TransactionRepository extends JpaRepository<Transaction, String> {

    List<Transaction> findBySourceAccountIdOrDestinationAccountIdOrderByCreatedAtDesc(
        String sourceAccountId, String destinationAccountId);

    @Query("SELECT t FROM Transaction t WHERE t.sourceAccountId IN :accountIds "
        + "OR t.destinationAccountId IN :accountIds ORDER BY t.createdAt DESC")
    Page<Transaction> findForAccounts(@Param("accountIds") Collection<String> accountIds, Pageable pageable);

    boolean existsByReversalOf(String transactionId);

    long countByStatus(TransactionStatus status);
}
