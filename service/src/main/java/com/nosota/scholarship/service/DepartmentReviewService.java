package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DecisionOutcome;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.error.InvalidAmountException;
import com.nosota.scholarship.error.InvalidRequestException;
import com.nosota.scholarship.error.NotEligibleException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import com.nosota.scholarship.model.FinanceForward;
import com.nosota.scholarship.model.StageDecision;
import com.nosota.scholarship.repository.ApplicationRepository;
import com.nosota.scholarship.security.AccessPolicy;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.security.Capability;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Stage 2 gatekeeper: department review of institute-approved applications and
 * forwarding to finance.
 *
 * <p>Preconditions are checked in this order:
 * <ol>
 *   <li>the department decision is still open, otherwise {@link AlreadyProcessedException}</li>
 *   <li>the application is APPROVED or PARTIALLY_APPROVED with a positive institute decision,
 *       otherwise {@link NotEligibleException}</li>
 * </ol>
 *
 * <p>Approval leaves the application status unchanged; rejection moves it to REJECTED.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DepartmentReviewService {

    private final ApplicationRepository applicationRepository;
    private final ApplicationTransitionService transitionService;
    private final DecisionLogService decisionLogService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Value("${scholarship.approval.enforce-amount-cap:true}")
    private boolean enforceAmountCap;

    @Transactional
    public Application review(@NotBlank String applicationId, @Valid @NotNull DepartmentReviewRequest request,
                              @NotNull Actor actor) {
        return switch (request.action()) {
            case DEPT_APPROVE -> departmentApprove(applicationId, request.remarks(), request.finalAmount(), actor);
            case DEPT_REJECT -> departmentReject(applicationId, request.remarks(), actor);
        };
    }

    /**
     * Records a positive department decision, which makes the application eligible for forwarding.
     *
     * @param finalAmount Revised approved amount; the institute's amount is kept when null
     */
    @Transactional
    public Application departmentApprove(@NotBlank String applicationId, String remarks, BigDecimal finalAmount,
                                         @NotNull Actor actor) {
        Application application = loadForDecision(applicationId, actor);

        if (finalAmount != null) {
            BigDecimal amount = finalAmount.setScale(2, RoundingMode.HALF_UP);
            if (amount.signum() <= 0) {
                throw new InvalidAmountException("Final amount must be positive: " + amount);
            }
            if (enforceAmountCap && amount.compareTo(application.getRequestedAmount()) > 0) {
                throw new InvalidAmountException(String.format(
                        "Final amount %s exceeds requested amount %s for application %s",
                        amount, application.getRequestedAmount(), applicationId));
            }
            application.setApprovedAmount(amount);
        }

        LocalDateTime now = Timestamps.now(clock);
        DecisionLogEntry entry = decisionLogService.append(application,
                DecisionLogService.entry(Stage.DEPARTMENT, DecisionAction.DEPT_APPROVE)
                        .actorId(actor.id())
                        .remarks(remarks)
                        .amountSnapshot(application.getApprovedAmount())
                        .createdAt(now));

        application.setDepartmentDecision(
                new StageDecision(DecisionOutcome.APPROVED, actor.id(), remarks, entry.getCreatedAt()));
        application.setUpdatedAt(now);

        log.info("Application {} approved by department admin {} with amount {}",
                applicationId, actor.id(), application.getApprovedAmount());
        return application;
    }

    /**
     * Records a negative department decision and moves the application to REJECTED.
     */
    @Transactional
    public Application departmentReject(@NotBlank String applicationId, String remarks, @NotNull Actor actor) {
        if (remarks == null || remarks.isBlank()) {
            throw new InvalidRequestException("Remarks are required to reject an application");
        }
        Application application = loadForDecision(applicationId, actor);

        DecisionLogEntry entry = transitionService.transition(application, ApplicationStatus.REJECTED,
                Stage.DEPARTMENT, DecisionAction.DEPT_REJECT, actor.id(), remarks);
        application.setDepartmentDecision(
                new StageDecision(DecisionOutcome.REJECTED, actor.id(), remarks, entry.getCreatedAt()));

        log.info("Application {} rejected by department admin {}", applicationId, actor.id());
        return application;
    }

    /**
     * Forwards one department-approved application to finance.
     *
     * @param batchId Forward batch the application belongs to
     * @throws AlreadyProcessedException if the application was already forwarded
     * @throws NotEligibleException      if the department has not approved the application
     */
    @Transactional
    public Application forwardToFinance(@NotBlank String applicationId, String remarks, Priority priority,
                                        @NotBlank String batchId, @NotNull Actor actor) {
        Application application = applicationRepository.findByApplicationIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        accessPolicy.check(actor, Capability.FORWARD_TO_FINANCE, application);

        FinanceForward current = application.getFinanceForward();
        if (current.isForwarded()) {
            throw new AlreadyProcessedException(String.format(
                    "Application %s was already forwarded to finance in batch %s",
                    applicationId, current.getBatchId()));
        }
        if (!application.getDepartmentDecision().isApproved()) {
            throw new NotEligibleException(String.format(
                    "Application %s has no department approval (department decision: %s)",
                    applicationId, application.getDepartmentDecision().getOutcome()));
        }

        Priority effectivePriority = priority != null ? priority : Priority.MEDIUM;
        LocalDateTime now = Timestamps.now(clock);
        DecisionLogEntry entry = decisionLogService.append(application,
                DecisionLogService.entry(Stage.DEPARTMENT, DecisionAction.FORWARD_TO_FINANCE)
                        .actorId(actor.id())
                        .remarks(remarks)
                        .amountSnapshot(application.getApprovedAmount())
                        .reference(batchId)
                        .priority(effectivePriority)
                        .createdAt(now));

        application.setFinanceForward(new FinanceForward(true, actor.id(), remarks, effectivePriority,
                batchId, entry.getCreatedAt()));
        application.setUpdatedAt(now);

        log.info("Application {} forwarded to finance by {} (batch={}, priority={})",
                applicationId, actor.id(), batchId, effectivePriority);
        return application;
    }

    private Application loadForDecision(String applicationId, Actor actor) {
        Application application = applicationRepository.findByApplicationIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        accessPolicy.check(actor, Capability.DEPARTMENT_REVIEW, application);

        StageDecision decision = application.getDepartmentDecision();
        if (decision.isDecided()) {
            throw new AlreadyProcessedException(String.format(
                    "Application %s was already %s by the department at %s",
                    applicationId, decision.getOutcome(), decision.getDecidedAt()));
        }

        boolean approvedStatus = application.getStatus() == ApplicationStatus.APPROVED
                || application.getStatus() == ApplicationStatus.PARTIALLY_APPROVED;
        if (!approvedStatus || !application.getInstituteDecision().isApproved()) {
            throw new NotEligibleException(String.format(
                    "Application %s is not eligible for department review (status: %s, institute decision: %s)",
                    applicationId, application.getStatus(), application.getInstituteDecision().getOutcome()));
        }
        return application;
    }
}
