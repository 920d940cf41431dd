package com.nosota.scholarship.repository;

import com.nosota.scholarship.model.DecisionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read and append access to decision log entries. Entries are never updated or deleted
 * by the application code.
 */
@Repository
public interface DecisionLogRepository extends JpaRepository<DecisionLogEntry, UUID> {

    List<DecisionLogEntry> findByApplicationIdOrderBySequenceNumberAsc(String applicationId);

    @Query("""
            SELECT COALESCE(MAX(e.sequenceNumber), 0)
            FROM DecisionLogEntry e
            WHERE e.applicationId = :applicationId
            """)
    int findMaxSequenceNumber(@Param("applicationId") String applicationId);
}
