package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.ScholarshipType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Application entity - one scholarship request moving through the
 * institute → department → finance pipeline.
 *
 * <p>The status is changed only by {@code ApplicationTransitionService}, which validates
 * the edge against {@code ApplicationStateMachine} and appends a decision log entry in
 * the same transaction. Per-stage decisions are structured embeddables, never derived
 * from free text.
 *
 * <p>Applications are never deleted; they end in REJECTED or COMPLETED.
 */
@Entity
@Table(name = "application", indexes = {
        @Index(name = "idx_application_status_submitted", columnList = "status, submitted_at"),
        @Index(name = "idx_application_institute", columnList = "institute_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Application {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Externally visible ID, format APP{year}{8 hex}. Immutable once issued.
     */
    @Column(name = "application_id", nullable = false, unique = true, updatable = false, length = 20)
    private String applicationId;

    @Column(name = "student_id", nullable = false, length = 50)
    private String studentId;

    @Column(name = "institute_id", nullable = false)
    private Long instituteId;

    @Column(name = "department_id", nullable = false)
    private Long departmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "scholarship_type", nullable = false, length = 30)
    private ScholarshipType scholarshipType;

    @Column(name = "scholarship_name", nullable = false, length = 200)
    private String scholarshipName;

    @Column(name = "scheme_reference", length = 50)
    private String schemeReference;

    @Column(name = "requested_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal requestedAmount;

    /**
     * Set only on institute approval, possibly revised by the department.
     */
    @Column(name = "approved_amount", precision = 12, scale = 2)
    private BigDecimal approvedAmount;

    @Column(name = "academic_year", length = 10)
    private String academicYear;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private Priority priority;

    @Column(name = "eligibility_score")
    private Integer eligibilityScore;

    @Column(name = "document_completeness_score")
    private Integer documentCompletenessScore;

    @Column(name = "student_cgpa", precision = 4, scale = 2)
    private BigDecimal studentCgpa;

    @Enumerated(EnumType.STRING)
    @Column(name = "course_level", length = 20)
    private CourseLevel courseLevel;

    @Column(name = "bank_account_number", length = 20)
    private String bankAccountNumber;

    @Column(name = "bank_ifsc", length = 11)
    private String bankIfsc;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private ApplicationStatus status;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "outcome", column = @Column(name = "institute_outcome", nullable = false, length = 20)),
            @AttributeOverride(name = "actorId", column = @Column(name = "institute_actor_id", length = 50)),
            @AttributeOverride(name = "remarks", column = @Column(name = "institute_remarks", length = 2000)),
            @AttributeOverride(name = "decidedAt", column = @Column(name = "institute_decided_at"))
    })
    private StageDecision instituteDecision = StageDecision.pending();

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "outcome", column = @Column(name = "department_outcome", nullable = false, length = 20)),
            @AttributeOverride(name = "actorId", column = @Column(name = "department_actor_id", length = 50)),
            @AttributeOverride(name = "remarks", column = @Column(name = "department_remarks", length = 2000)),
            @AttributeOverride(name = "decidedAt", column = @Column(name = "department_decided_at"))
    })
    private StageDecision departmentDecision = StageDecision.pending();

    @Embedded
    private FinanceForward financeForward = FinanceForward.notForwarded();

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    @Column(name = "review_started_at")
    private LocalDateTime reviewStartedAt;

    @Column(name = "review_completed_at")
    private LocalDateTime reviewCompletedAt;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "rejected_at")
    private LocalDateTime rejectedAt;

    @Column(name = "disbursed_at")
    private LocalDateTime disbursedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /**
     * Hibernate leaves an embedded field null when all its columns are null.
     */
    public StageDecision getInstituteDecision() {
        if (instituteDecision == null) {
            instituteDecision = StageDecision.pending();
        }
        return instituteDecision;
    }

    public StageDecision getDepartmentDecision() {
        if (departmentDecision == null) {
            departmentDecision = StageDecision.pending();
        }
        return departmentDecision;
    }

    public FinanceForward getFinanceForward() {
        if (financeForward == null) {
            financeForward = FinanceForward.notForwarded();
        }
        return financeForward;
    }
}
