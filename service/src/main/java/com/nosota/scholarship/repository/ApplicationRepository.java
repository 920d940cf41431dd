package com.nosota.scholarship.repository;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.model.Application;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    Optional<Application> findByApplicationId(String applicationId);

    /**
     * Loads an application and locks its row until the surrounding transaction ends.
     * Every mutating operation goes through this method so concurrent decisions on the
     * same application are serialized.
     *
     * @param applicationId External application ID
     * @return Locked application, if it exists
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Application a WHERE a.applicationId = :applicationId")
    Optional<Application> findByApplicationIdForUpdate(@Param("applicationId") String applicationId);

    boolean existsByApplicationId(String applicationId);

    /**
     * Finds applications still waiting in the given statuses that were submitted before
     * the threshold, oldest first.
     *
     * @param statuses  Statuses that count as waiting for review
     * @param threshold Submission time before which an application is overdue
     * @param pageable  Pagination information
     * @return Page of overdue applications
     */
    @Query("""
            SELECT a
            FROM Application a
            WHERE a.status IN :statuses
              AND a.submittedAt IS NOT NULL
              AND a.submittedAt < :threshold
            ORDER BY a.submittedAt ASC
            """)
    Page<Application> findOverdue(@Param("statuses") Collection<ApplicationStatus> statuses,
                                  @Param("threshold") LocalDateTime threshold,
                                  Pageable pageable);
}
