package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.ScholarshipType;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Response DTO for an application and its per-stage decision state.
 *
 * @param applicationId             Opaque application ID (APP...)
 * @param studentId                 Student reference
 * @param instituteId               Institute reference
 * @param departmentId              Department reference
 * @param scholarshipType           Scholarship category
 * @param scholarshipName           Scholarship name
 * @param schemeReference           External scheme reference
 * @param requestedAmount           Requested amount
 * @param approvedAmount            Approved amount (null until approval)
 * @param academicYear              Academic year
 * @param priority                  Review priority
 * @param eligibilityScore          Eligibility score 0-100
 * @param documentCompletenessScore Document completeness score 0-100
 * @param studentCgpa               CGPA snapshot
 * @param courseLevel               Course level snapshot
 * @param status                    Lifecycle status
 * @param instituteDecision         Stage 1 decision
 * @param departmentDecision        Stage 2 decision
 * @param financeForward            Stage 3 forwarding record
 * @param overdue                   True when the review SLA is exceeded
 * @param submittedAt               Submission timestamp
 * @param reviewStartedAt           First time the application entered review
 * @param reviewCompletedAt         Institute decision timestamp
 * @param approvedAt                Approval timestamp
 * @param rejectedAt                Rejection timestamp
 * @param disbursedAt               Disbursement timestamp
 * @param completedAt               Completion timestamp
 * @param createdAt                 Creation timestamp
 * @param updatedAt                 Last update timestamp
 * @param version                   Optimistic lock version
 */
public record ApplicationResponse(
        String applicationId,
        String studentId,
        Long instituteId,
        Long departmentId,
        ScholarshipType scholarshipType,
        String scholarshipName,
        String schemeReference,
        BigDecimal requestedAmount,
        BigDecimal approvedAmount,
        String academicYear,
        Priority priority,
        Integer eligibilityScore,
        Integer documentCompletenessScore,
        BigDecimal studentCgpa,
        CourseLevel courseLevel,
        ApplicationStatus status,
        StageDecisionResponse instituteDecision,
        StageDecisionResponse departmentDecision,
        FinanceForwardResponse financeForward,
        boolean overdue,
        LocalDateTime submittedAt,
        LocalDateTime reviewStartedAt,
        LocalDateTime reviewCompletedAt,
        LocalDateTime approvedAt,
        LocalDateTime rejectedAt,
        LocalDateTime disbursedAt,
        LocalDateTime completedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt,
        Long version
) {
}
