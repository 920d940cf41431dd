package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.repository.ApplicationRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Creates draft applications and submits them into the review pipeline.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ApplicationIntakeService {

    private final ApplicationRepository applicationRepository;
    private final ApplicationTransitionService transitionService;
    private final IdentifierGenerator identifierGenerator;
    private final Clock clock;

    /**
     * Creates an application in DRAFT status.
     *
     * @param request Application details
     * @return Persisted draft
     */
    @Transactional
    public Application createApplication(@Valid @NotNull CreateApplicationRequest request) {
        String applicationId = identifierGenerator.nextApplicationId();
        while (applicationRepository.existsByApplicationId(applicationId)) {
            applicationId = identifierGenerator.nextApplicationId();
        }

        LocalDateTime now = Timestamps.now(clock);
        Application application = new Application();
        application.setApplicationId(applicationId);
        application.setStudentId(request.studentId());
        application.setInstituteId(request.instituteId());
        application.setDepartmentId(request.departmentId());
        application.setScholarshipType(request.scholarshipType());
        application.setScholarshipName(request.scholarshipName());
        application.setSchemeReference(request.schemeReference());
        application.setRequestedAmount(request.requestedAmount().setScale(2, RoundingMode.HALF_UP));
        application.setAcademicYear(request.academicYear());
        application.setPriority(request.priority() != null ? request.priority() : Priority.MEDIUM);
        application.setEligibilityScore(request.eligibilityScore());
        application.setDocumentCompletenessScore(request.documentCompletenessScore());
        application.setStudentCgpa(request.studentCgpa());
        application.setCourseLevel(request.courseLevel());
        application.setBankAccountNumber(request.bankAccountNumber());
        application.setBankIfsc(request.bankIfsc());
        application.setStatus(ApplicationStatus.DRAFT);
        application.setCreatedAt(now);
        application.setUpdatedAt(now);

        application = applicationRepository.save(application);
        log.info("Application {} created for student {} (institute={}, requestedAmount={})",
                applicationId, request.studentId(), request.instituteId(), application.getRequestedAmount());
        return application;
    }

    /**
     * Submits a draft. Only the student who owns the application may submit it.
     *
     * @param applicationId Application ID
     * @param studentId     Submitting student
     * @return Application in SUBMITTED status
     */
    @Transactional
    public Application submitApplication(@NotBlank String applicationId, @NotBlank String studentId) {
        Application application = applicationRepository.findByApplicationIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));

        if (!application.getStudentId().equals(studentId)) {
            throw new AccessDeniedException(String.format(
                    "Application %s does not belong to student %s", applicationId, studentId));
        }

        transitionService.transition(application, ApplicationStatus.SUBMITTED, Stage.APPLICANT,
                DecisionAction.SUBMIT, studentId, null);
        return application;
    }
}
