package com.nosota.scholarship.api;

import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.BulkReviewRequest;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.api.request.TransitionRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.BatchResult;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Institute and department gatekeeper operations.
 *
 * <p>Every operation identifies the acting staff member through the
 * {@link ActorHeaders} headers. Bulk operations process each application in its own
 * atomic unit and report per-item outcomes; they never fail as a whole because of one item.
 *
 * <p>Implemented by:
 * <ul>
 *   <li>ReviewController - in service module</li>
 *   <li>{@link ReviewClient} - WebClient-based client</li>
 * </ul>
 */
@RequestMapping("/api/v1/review")
public interface ReviewApi {

    // ==================== Institute (Stage 1) ====================

    /**
     * Applies an institute review action: approve, reject, request documents or hold.
     *
     * @param applicationId Application ID
     * @param request       Action, remarks and optional approved amount
     * @return Application after the review
     */
    @PostMapping("/institute/applications/{applicationId}")
    ResponseEntity<ApplicationResponse> reviewApplication(
            @PathVariable("applicationId") String applicationId,
            @RequestBody @Valid ReviewRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Moves an application along a workflow edge (under review, document verification,
     * eligibility check, on hold, rejected).
     *
     * @param applicationId Application ID
     * @param request       Target status and remarks
     * @return Application after the transition
     */
    @PostMapping("/institute/applications/{applicationId}/transition")
    ResponseEntity<ApplicationResponse> transitionApplication(
            @PathVariable("applicationId") String applicationId,
            @RequestBody @Valid TransitionRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Approves or rejects several applications, each independently.
     *
     * @param request Application IDs, action and remarks
     * @return Per-item outcomes
     */
    @PostMapping("/institute/bulk")
    ResponseEntity<BatchResult> bulkReview(
            @RequestBody @Valid BulkReviewRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    // ==================== Department (Stage 2) ====================

    /**
     * Records the department decision on an institute-approved application.
     *
     * @param applicationId Application ID
     * @param request       DEPT_APPROVE or DEPT_REJECT, remarks, optional final amount
     * @return Application after the decision
     */
    @PostMapping("/department/applications/{applicationId}")
    ResponseEntity<ApplicationResponse> departmentReview(
            @PathVariable("applicationId") String applicationId,
            @RequestBody @Valid DepartmentReviewRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Forwards department-approved applications to finance as one batch.
     *
     * @param request Application IDs, remarks and priority
     * @return Per-item outcomes and the forward batch ID
     */
    @PostMapping("/department/forward")
    ResponseEntity<BatchResult> forwardToFinance(
            @RequestBody @Valid ForwardToFinanceRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);
}
