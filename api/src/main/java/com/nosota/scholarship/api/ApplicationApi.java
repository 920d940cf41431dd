package com.nosota.scholarship.api;

import com.nosota.scholarship.api.dto.PagedResponse;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.DecisionLogEntryResponse;
import com.nosota.scholarship.api.response.StageDecisionsResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Application intake and read operations.
 *
 * <p>Implemented by ApplicationController (service module) and
 * {@link ApplicationClient} (WebClient-based client for consumers).
 */
@RequestMapping("/api/v1/applications")
public interface ApplicationApi {

    /**
     * Creates a draft application.
     *
     * @param request Application details
     * @return Created application in DRAFT status
     */
    @PostMapping
    ResponseEntity<ApplicationResponse> createApplication(
            @RequestBody @Valid CreateApplicationRequest request);

    /**
     * Submits a draft application for institute review.
     *
     * @param applicationId Application ID
     * @param actorId       Submitting student reference
     * @return Application in SUBMITTED status
     */
    @PostMapping("/{applicationId}/submit")
    ResponseEntity<ApplicationResponse> submitApplication(
            @PathVariable("applicationId") String applicationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId);

    @GetMapping("/{applicationId}")
    ResponseEntity<ApplicationResponse> getApplication(
            @PathVariable("applicationId") String applicationId);

    /**
     * Gets the full decision log of an application in append order.
     *
     * @param applicationId Application ID
     * @return Decision log entries ordered by sequence number
     */
    @GetMapping("/{applicationId}/decision-log")
    ResponseEntity<List<DecisionLogEntryResponse>> getDecisionLog(
            @PathVariable("applicationId") String applicationId);

    /**
     * Rebuilds the per-stage decision state from the decision log and compares it with
     * the stored decision fields.
     *
     * @param applicationId Application ID
     * @return Replayed stage decisions
     */
    @GetMapping("/{applicationId}/decisions")
    ResponseEntity<StageDecisionsResponse> replayDecisions(
            @PathVariable("applicationId") String applicationId);

    /**
     * Lists applications waiting for review longer than the SLA allows, oldest first.
     *
     * @param page Page number (0-indexed)
     * @param size Page size
     * @return Paginated overdue applications
     */
    @GetMapping("/overdue")
    ResponseEntity<PagedResponse<ApplicationResponse>> getOverdueApplications(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size);
}
