package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DecisionOutcome;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.error.InvalidAmountException;
import com.nosota.scholarship.error.InvalidRequestException;
import com.nosota.scholarship.error.InvalidTransitionException;
import com.nosota.scholarship.event.ApplicationApprovedEvent;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
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
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumSet;
import java.util.Set;

/**
 * Stage 1 gatekeeper: institute review of submitted applications.
 *
 * <p>Each operation runs in one transaction that locks the application row, checks the
 * reviewer's capability and scope, drives the state machine and records the institute
 * decision. When the target status is not a direct successor the application walks the
 * shortest legal path, e.g. approving a SUBMITTED application logs
 * {@code SUBMITTED → UNDER_REVIEW} and {@code UNDER_REVIEW → APPROVED}.
 *
 * <p>An approval below the requested amount ends in PARTIALLY_APPROVED (through
 * ELIGIBILITY_CHECK), otherwise in APPROVED.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class InstituteReviewService {

    /**
     * Statuses in which the institute may act on an application.
     */
    static final Set<ApplicationStatus> REVIEWABLE = EnumSet.of(
            ApplicationStatus.SUBMITTED,
            ApplicationStatus.UNDER_REVIEW,
            ApplicationStatus.DOCUMENT_VERIFICATION,
            ApplicationStatus.ELIGIBILITY_CHECK
    );

    /**
     * Targets reachable through the generic transition operation.
     */
    static final Set<ApplicationStatus> WORKFLOW_TARGETS = EnumSet.of(
            ApplicationStatus.UNDER_REVIEW,
            ApplicationStatus.DOCUMENT_VERIFICATION,
            ApplicationStatus.ELIGIBILITY_CHECK,
            ApplicationStatus.ON_HOLD,
            ApplicationStatus.REJECTED
    );

    private final ApplicationRepository applicationRepository;
    private final ApplicationTransitionService transitionService;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher eventPublisher;

    @Value("${scholarship.approval.enforce-amount-cap:true}")
    private boolean enforceAmountCap;

    /**
     * Applies a review action.
     *
     * @param applicationId Application ID
     * @param request       Action, remarks and optional approved amount
     * @param actor         Institute admin
     * @return Updated application
     */
    @Transactional
    public Application review(@NotBlank String applicationId, @Valid @NotNull ReviewRequest request,
                              @NotNull Actor actor) {
        return switch (request.action()) {
            case APPROVE -> approve(applicationId, request.remarks(), request.approvedAmount(), actor);
            case REJECT -> reject(applicationId, request.remarks(), actor);
            case REQUEST_DOCUMENTS -> requestDocuments(applicationId, request.remarks(), actor);
            case HOLD -> hold(applicationId, request.remarks(), actor);
        };
    }

    /**
     * Approves an application.
     *
     * @param approvedAmount Approved amount; the requested amount when null
     * @throws InvalidAmountException if the amount is not positive or exceeds the requested amount
     */
    @Transactional
    public Application approve(@NotBlank String applicationId, String remarks, BigDecimal approvedAmount,
                               @NotNull Actor actor) {
        Application application = loadForReview(applicationId, actor);

        BigDecimal requested = application.getRequestedAmount();
        BigDecimal amount = (approvedAmount != null ? approvedAmount : requested).setScale(2, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            throw new InvalidAmountException("Approved amount must be positive: " + amount);
        }
        if (enforceAmountCap && amount.compareTo(requested) > 0) {
            throw new InvalidAmountException(String.format(
                    "Approved amount %s exceeds requested amount %s for application %s",
                    amount, requested, applicationId));
        }

        boolean partial = amount.compareTo(requested) < 0;
        ApplicationStatus target = partial ? ApplicationStatus.PARTIALLY_APPROVED : ApplicationStatus.APPROVED;
        DecisionAction action = partial ? DecisionAction.PARTIALLY_APPROVE : DecisionAction.APPROVE;

        application.setApprovedAmount(amount);
        DecisionLogEntry entry = transitionService.transitionVia(application, target, Stage.INSTITUTE,
                action, actor.id(), remarks);
        application.setInstituteDecision(decision(DecisionOutcome.APPROVED, actor, remarks, entry));

        eventPublisher.publishEvent(new ApplicationApprovedEvent(application.getApplicationId(),
                application.getStudentId(), target, amount, entry.getCreatedAt()));

        log.info("Application {} {} by institute admin {} with amount {} (requested {})",
                applicationId, target, actor.id(), amount, requested);
        return application;
    }

    @Transactional
    public Application reject(@NotBlank String applicationId, String remarks, @NotNull Actor actor) {
        requireRemarks(remarks, "reject");
        Application application = loadForReview(applicationId, actor);

        DecisionLogEntry entry = transitionService.transitionVia(application, ApplicationStatus.REJECTED,
                Stage.INSTITUTE, DecisionAction.REJECT, actor.id(), remarks);
        application.setInstituteDecision(decision(DecisionOutcome.REJECTED, actor, remarks, entry));

        log.info("Application {} rejected by institute admin {}", applicationId, actor.id());
        return application;
    }

    @Transactional
    public Application requestDocuments(@NotBlank String applicationId, String remarks, @NotNull Actor actor) {
        requireRemarks(remarks, "request documents");
        Application application = loadForReview(applicationId, actor);

        transitionService.transitionVia(application, ApplicationStatus.DOCUMENT_VERIFICATION,
                Stage.INSTITUTE, DecisionAction.REQUEST_DOCUMENTS, actor.id(), remarks);
        return application;
    }

    @Transactional
    public Application hold(@NotBlank String applicationId, String remarks, @NotNull Actor actor) {
        requireRemarks(remarks, "hold");
        Application application = loadForReview(applicationId, actor);

        transitionService.transitionVia(application, ApplicationStatus.ON_HOLD,
                Stage.INSTITUTE, DecisionAction.HOLD, actor.id(), remarks);
        return application;
    }

    /**
     * Moves an application along a single workflow edge. Resuming an ON_HOLD application
     * goes through here ({@code ON_HOLD → UNDER_REVIEW}).
     *
     * @param target One of UNDER_REVIEW, DOCUMENT_VERIFICATION, ELIGIBILITY_CHECK, ON_HOLD, REJECTED
     * @throws InvalidRequestException    if the target is not a workflow target
     * @throws InvalidTransitionException if the edge does not exist
     */
    @Transactional
    public Application transition(@NotBlank String applicationId, @NotNull ApplicationStatus target,
                                  String remarks, @NotNull Actor actor) {
        if (!WORKFLOW_TARGETS.contains(target)) {
            throw new InvalidRequestException(String.format(
                    "Status %s cannot be set directly; allowed targets: %s", target, WORKFLOW_TARGETS));
        }
        if (target == ApplicationStatus.REJECTED) {
            requireRemarks(remarks, "reject");
        }

        Application application = load(applicationId, actor);
        requireUndecided(application);

        DecisionLogEntry entry = transitionService.transition(application, target, Stage.INSTITUTE,
                ApplicationTransitionService.workflowAction(target), actor.id(), remarks);
        if (target == ApplicationStatus.REJECTED) {
            application.setInstituteDecision(decision(DecisionOutcome.REJECTED, actor, remarks, entry));
        }
        return application;
    }

    private Application loadForReview(String applicationId, Actor actor) {
        Application application = load(applicationId, actor);
        requireUndecided(application);

        if (!REVIEWABLE.contains(application.getStatus())) {
            throw new InvalidTransitionException(String.format(
                    "Application %s is %s; institute review requires one of %s",
                    applicationId, application.getStatus(), REVIEWABLE), application.getStatus());
        }
        return application;
    }

    private Application load(String applicationId, Actor actor) {
        Application application = applicationRepository.findByApplicationIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        accessPolicy.check(actor, Capability.INSTITUTE_REVIEW, application);
        return application;
    }

    private static void requireUndecided(Application application) {
        StageDecision decision = application.getInstituteDecision();
        if (decision.isDecided()) {
            throw new AlreadyProcessedException(String.format(
                    "Application %s was already %s by the institute at %s",
                    application.getApplicationId(), decision.getOutcome(), decision.getDecidedAt()));
        }
    }

    private static void requireRemarks(String remarks, String action) {
        if (remarks == null || remarks.isBlank()) {
            throw new InvalidRequestException("Remarks are required to " + action + " an application");
        }
    }

    private static StageDecision decision(DecisionOutcome outcome, Actor actor, String remarks,
                                          DecisionLogEntry entry) {
        return new StageDecision(outcome, actor.id(), remarks, entry.getCreatedAt());
    }
}
