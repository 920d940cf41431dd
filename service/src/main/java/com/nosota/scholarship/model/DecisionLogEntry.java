package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.Stage;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.GenericGenerator;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One entry of an application's decision log.
 *
 * <p>Entries are append-only: the entity has no setters, every column is non-updatable
 * and Hibernate treats the type as {@link Immutable}. The per-application
 * {@code sequenceNumber} is unique together with the application ID, so two concurrent
 * appends for the same application cannot both commit.
 */
@Entity
@Immutable
@Table(name = "decision_log_entry",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_decision_log_application_sequence",
                columnNames = {"application_id", "sequence_number"}))
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DecisionLogEntry {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "application_id", nullable = false, updatable = false, length = 20)
    private String applicationId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "stage", nullable = false, updatable = false, length = 20)
    private Stage stage;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 40)
    private DecisionAction action;

    /**
     * Null when the action did not change the application status.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", updatable = false, length = 30)
    private ApplicationStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", updatable = false, length = 30)
    private ApplicationStatus toStatus;

    @Column(name = "actor_id", nullable = false, updatable = false, length = 50)
    private String actorId;

    @Column(name = "remarks", updatable = false, length = 2000)
    private String remarks;

    @Column(name = "amount_snapshot", updatable = false, precision = 12, scale = 2)
    private BigDecimal amountSnapshot;

    /**
     * Batch ID, disbursement ID or transaction reference the action produced.
     */
    @Column(name = "reference", updatable = false, length = 50)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", updatable = false, length = 10)
    private Priority priority;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean changedStatus() {
        return toStatus != null;
    }
}
