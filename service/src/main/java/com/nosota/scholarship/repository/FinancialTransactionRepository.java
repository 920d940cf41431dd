package com.nosota.scholarship.repository;

import com.nosota.scholarship.model.FinancialTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FinancialTransactionRepository extends JpaRepository<FinancialTransaction, UUID> {

    /**
     * Transactions of a disbursement, each payment followed by its component transactions.
     */
    @Query("""
            SELECT t FROM FinancialTransaction t
            WHERE t.disbursementId = :disbursementId
            ORDER BY t.transactionDate ASC,
                     COALESCE(t.parentTransactionId, t.transactionId) ASC,
                     CASE WHEN t.parentTransactionId IS NULL THEN 0 ELSE 1 END ASC,
                     t.component ASC
            """)
    List<FinancialTransaction> findByDisbursementIdInRecordingOrder(@Param("disbursementId") String disbursementId);

    boolean existsByTransactionId(String transactionId);
}
