package com.nosota.scholarship.repository;

import com.nosota.scholarship.api.model.DisbursementStatus;
import com.nosota.scholarship.model.Disbursement;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DisbursementRepository extends JpaRepository<Disbursement, UUID> {

    Optional<Disbursement> findByDisbursementId(String disbursementId);

    /**
     * Owning application of a disbursement, read without loading the entity into the
     * persistence context.
     */
    @Query("SELECT d.applicationId FROM Disbursement d WHERE d.disbursementId = :disbursementId")
    Optional<String> findApplicationIdByDisbursementId(@Param("disbursementId") String disbursementId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM Disbursement d WHERE d.disbursementId = :disbursementId")
    Optional<Disbursement> findByDisbursementIdForUpdate(@Param("disbursementId") String disbursementId);

    /**
     * Used with {@code CANCELLED} to find the single active disbursement of an application.
     */
    Optional<Disbursement> findFirstByApplicationIdAndStatusNot(String applicationId, DisbursementStatus status);

    List<Disbursement> findByApplicationIdOrderByCreatedAtAsc(String applicationId);
}
