package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import org.springframework.stereotype.Component;

import java.util.*;

import static com.nosota.scholarship.api.model.ApplicationStatus.*;

/**
 * State machine for validating ApplicationStatus transitions.
 *
 * <p>Edges:
 * <pre>
 * DRAFT                 → SUBMITTED
 * SUBMITTED             → UNDER_REVIEW, REJECTED
 * UNDER_REVIEW          → DOCUMENT_VERIFICATION, ELIGIBILITY_CHECK, APPROVED, REJECTED, ON_HOLD
 * DOCUMENT_VERIFICATION → ELIGIBILITY_CHECK, UNDER_REVIEW, REJECTED
 * ELIGIBILITY_CHECK     → APPROVED, PARTIALLY_APPROVED, REJECTED, UNDER_REVIEW
 * ON_HOLD               → UNDER_REVIEW, REJECTED
 * APPROVED              → DISBURSED, REJECTED
 * PARTIALLY_APPROVED    → DISBURSED, REJECTED
 * DISBURSED             → COMPLETED
 * </pre>
 *
 * <p>REJECTED, CANCELLED and COMPLETED are final. CANCELLED has no incoming edge.
 */
@Component
public class ApplicationStateMachine {

    /**
     * Map of allowed transitions: fromStatus → Set of valid toStatus values.
     */
    private static final Map<ApplicationStatus, Set<ApplicationStatus>> ALLOWED_TRANSITIONS;

    static {
        Map<ApplicationStatus, Set<ApplicationStatus>> transitions = new EnumMap<>(ApplicationStatus.class);
        transitions.put(DRAFT, EnumSet.of(SUBMITTED));
        transitions.put(SUBMITTED, EnumSet.of(UNDER_REVIEW, REJECTED));
        transitions.put(UNDER_REVIEW, EnumSet.of(DOCUMENT_VERIFICATION, ELIGIBILITY_CHECK, APPROVED, REJECTED, ON_HOLD));
        transitions.put(DOCUMENT_VERIFICATION, EnumSet.of(ELIGIBILITY_CHECK, UNDER_REVIEW, REJECTED));
        transitions.put(ELIGIBILITY_CHECK, EnumSet.of(APPROVED, PARTIALLY_APPROVED, REJECTED, UNDER_REVIEW));
        transitions.put(ON_HOLD, EnumSet.of(UNDER_REVIEW, REJECTED));
        // REJECTED from the approved states is taken only by a department rejection
        transitions.put(APPROVED, EnumSet.of(DISBURSED, REJECTED));
        transitions.put(PARTIALLY_APPROVED, EnumSet.of(DISBURSED, REJECTED));
        transitions.put(DISBURSED, EnumSet.of(COMPLETED));
        ALLOWED_TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    /**
     * Validates if a status transition is allowed. Staying in the same status is not a transition.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return true if transition is allowed, false otherwise
     */
    public boolean isTransitionAllowed(ApplicationStatus fromStatus, ApplicationStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }

        Set<ApplicationStatus> allowedTargets = ALLOWED_TRANSITIONS.get(fromStatus);
        return allowedTargets != null && allowedTargets.contains(toStatus);
    }

    /**
     * Checks if a status is a final state (no further transitions allowed).
     *
     * @param status Status to check
     * @return true if status is final
     */
    public boolean isFinalState(ApplicationStatus status) {
        return status == REJECTED
                || status == CANCELLED
                || status == COMPLETED;
    }

    /**
     * Gets all allowed target statuses from a given status.
     *
     * @param fromStatus Current status
     * @return Set of allowed target statuses (empty if none allowed)
     */
    public Set<ApplicationStatus> getAllowedTransitions(ApplicationStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }

    /**
     * Finds the shortest chain of legal transitions leading from one status to another.
     * Ties are broken by enum declaration order, so the path is stable.
     *
     * @param fromStatus Current status
     * @param toStatus   Target status
     * @return Statuses to pass through, ending with {@code toStatus} and excluding
     *         {@code fromStatus}; empty if the target is unreachable or equal to the current status
     */
    public List<ApplicationStatus> shortestPath(ApplicationStatus fromStatus, ApplicationStatus toStatus) {
        if (fromStatus == null || toStatus == null || fromStatus == toStatus) {
            return List.of();
        }

        Map<ApplicationStatus, ApplicationStatus> previous = new EnumMap<>(ApplicationStatus.class);
        Deque<ApplicationStatus> queue = new ArrayDeque<>();
        queue.add(fromStatus);
        previous.put(fromStatus, fromStatus);

        while (!queue.isEmpty()) {
            ApplicationStatus current = queue.poll();
            for (ApplicationStatus next : getAllowedTransitions(current)) {
                if (previous.containsKey(next)) {
                    continue;
                }
                previous.put(next, current);
                if (next == toStatus) {
                    return unwind(previous, fromStatus, toStatus);
                }
                queue.add(next);
            }
        }
        return List.of();
    }

    private List<ApplicationStatus> unwind(Map<ApplicationStatus, ApplicationStatus> previous,
                                           ApplicationStatus fromStatus, ApplicationStatus toStatus) {
        LinkedList<ApplicationStatus> path = new LinkedList<>();
        for (ApplicationStatus step = toStatus; step != fromStatus; step = previous.get(step)) {
            path.addFirst(step);
        }
        return path;
    }
}
