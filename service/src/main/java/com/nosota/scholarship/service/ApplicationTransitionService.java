package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.error.InvalidTransitionException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Applies status transitions to applications.
 *
 * <p>A transition updates the status, stamps the matching timestamp and appends a decision
 * log entry inside the caller's transaction. If anything fails the caller's transaction rolls
 * back and none of the three changes survives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationTransitionService {

    private final ApplicationStateMachine stateMachine;
    private final DecisionLogService decisionLogService;
    private final Clock clock;

    /**
     * Moves the application along one edge.
     *
     * @param application Application loaded with a row lock
     * @param target      Target status
     * @param stage       Stage performing the transition
     * @param action      Action recorded in the log
     * @param actorId     Acting user
     * @param remarks     Remarks recorded in the log
     * @return Log entry written for the transition
     * @throws InvalidTransitionException if {@code target} is not a successor of the current status
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public DecisionLogEntry transition(Application application, ApplicationStatus target, Stage stage,
                                       DecisionAction action, String actorId, String remarks) {
        return transition(application, target, stage, action, actorId, remarks, null);
    }

    /**
     * Same as {@link #transition(Application, ApplicationStatus, Stage, DecisionAction, String, String)},
     * recording a disbursement ID or transaction reference in the log entry.
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public DecisionLogEntry transition(Application application, ApplicationStatus target, Stage stage,
                                       DecisionAction action, String actorId, String remarks, String reference) {
        ApplicationStatus current = application.getStatus();
        if (!stateMachine.isTransitionAllowed(current, target)) {
            throw new InvalidTransitionException(application.getApplicationId(), current, target,
                    stateMachine.getAllowedTransitions(current));
        }

        LocalDateTime now = Timestamps.now(clock);
        application.setStatus(target);
        stampTimestamp(application, target, now);
        application.setUpdatedAt(now);

        DecisionLogEntry entry = decisionLogService.append(application, DecisionLogService.entry(stage, action)
                .fromStatus(current)
                .toStatus(target)
                .actorId(actorId)
                .remarks(remarks)
                .amountSnapshot(application.getApprovedAmount())
                .reference(reference)
                .createdAt(now));

        log.info("Application {} transitioned {} → {} by {} ({})",
                application.getApplicationId(), current, target, actorId, action);
        return entry;
    }

    /**
     * Moves the application to {@code target} along the shortest legal path, one logged
     * transition per hop. Intermediate hops are logged with their workflow action and the
     * final hop with {@code finalAction}.
     *
     * @return Log entry of the final hop
     * @throws InvalidTransitionException if {@code target} cannot be reached from the current status
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public DecisionLogEntry transitionVia(Application application, ApplicationStatus target, Stage stage,
                                          DecisionAction finalAction, String actorId, String remarks) {
        List<ApplicationStatus> path = stateMachine.shortestPath(application.getStatus(), target);
        if (path.isEmpty()) {
            throw new InvalidTransitionException(application.getApplicationId(), application.getStatus(), target,
                    stateMachine.getAllowedTransitions(application.getStatus()));
        }

        DecisionLogEntry last = null;
        for (ApplicationStatus hop : path) {
            DecisionAction action = hop == target ? finalAction : workflowAction(hop);
            last = transition(application, hop, stage, action, actorId, remarks);
        }
        return last;
    }

    /**
     * Action logged when an application enters {@code status} as a plain workflow step.
     */
    public static DecisionAction workflowAction(ApplicationStatus status) {
        return switch (status) {
            case SUBMITTED -> DecisionAction.SUBMIT;
            case UNDER_REVIEW -> DecisionAction.START_REVIEW;
            case DOCUMENT_VERIFICATION -> DecisionAction.REQUEST_DOCUMENTS;
            case ELIGIBILITY_CHECK -> DecisionAction.START_ELIGIBILITY_CHECK;
            case ON_HOLD -> DecisionAction.HOLD;
            case APPROVED -> DecisionAction.APPROVE;
            case PARTIALLY_APPROVED -> DecisionAction.PARTIALLY_APPROVE;
            case REJECTED -> DecisionAction.REJECT;
            case DISBURSED -> DecisionAction.TRANSFER_SUCCEEDED;
            case COMPLETED -> DecisionAction.COMPLETE;
            case DRAFT, CANCELLED -> throw new IllegalArgumentException("No transition enters " + status);
        };
    }

    private static void stampTimestamp(Application application, ApplicationStatus target, LocalDateTime now) {
        switch (target) {
            case SUBMITTED -> application.setSubmittedAt(now);
            case UNDER_REVIEW -> {
                if (application.getReviewStartedAt() == null) {
                    application.setReviewStartedAt(now);
                }
            }
            case APPROVED, PARTIALLY_APPROVED -> {
                application.setApprovedAt(now);
                application.setReviewCompletedAt(now);
            }
            case REJECTED -> {
                application.setRejectedAt(now);
                if (application.getReviewCompletedAt() == null) {
                    application.setReviewCompletedAt(now);
                }
            }
            case DISBURSED -> application.setDisbursedAt(now);
            case COMPLETED -> application.setCompletedAt(now);
            default -> {
                // document verification, eligibility check and hold have no dedicated timestamp
            }
        }
    }
}
