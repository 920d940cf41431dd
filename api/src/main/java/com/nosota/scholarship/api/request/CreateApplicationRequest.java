package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.ScholarshipType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for creating a draft application.
 *
 * <p>Student, institute and department are references into master data owned by
 * other services. CGPA, course level and bank details are snapshotted from the
 * student profile at intake so calculation and disbursement do not depend on it later.
 *
 * @param studentId                 Reference of the applying student
 * @param instituteId               Institute the student belongs to
 * @param departmentId              Department the student belongs to
 * @param scholarshipType           Scholarship category
 * @param scholarshipName           Display name of the scholarship
 * @param schemeReference           Optional reference to an external scheme
 * @param requestedAmount           Requested amount (positive, 2 decimals)
 * @param academicYear              Academic year, e.g. "2024-25"
 * @param priority                  Review priority (MEDIUM when omitted)
 * @param eligibilityScore          Precomputed eligibility score, 0-100
 * @param documentCompletenessScore Precomputed document completeness score, 0-100
 * @param studentCgpa               CGPA on a 10 point scale
 * @param courseLevel               Course level of the student
 * @param bankAccountNumber         Student bank account (optional at intake)
 * @param bankIfsc                  Bank routing code (optional at intake)
 */
public record CreateApplicationRequest(
        @NotBlank(message = "Student ID is required")
        @Size(max = 50)
        String studentId,

        @NotNull(message = "Institute ID is required")
        Long instituteId,

        @NotNull(message = "Department ID is required")
        Long departmentId,

        @NotNull(message = "Scholarship type is required")
        ScholarshipType scholarshipType,

        @NotBlank(message = "Scholarship name is required")
        @Size(max = 200)
        String scholarshipName,

        @Size(max = 50)
        String schemeReference,

        @NotNull(message = "Requested amount is required")
        @Positive(message = "Requested amount must be positive")
        @Digits(integer = 10, fraction = 2)
        BigDecimal requestedAmount,

        @Size(max = 10)
        String academicYear,

        Priority priority,

        @Min(0) @Max(100)
        Integer eligibilityScore,

        @Min(0) @Max(100)
        Integer documentCompletenessScore,

        @DecimalMin("0.0") @DecimalMax("10.0")
        BigDecimal studentCgpa,

        CourseLevel courseLevel,

        @Size(max = 20)
        String bankAccountNumber,

        @Size(max = 11)
        String bankIfsc
) {
}
