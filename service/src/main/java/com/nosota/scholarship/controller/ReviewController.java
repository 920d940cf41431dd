package com.nosota.scholarship.controller;

import com.nosota.scholarship.api.ReviewApi;
import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.BulkReviewRequest;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.api.request.TransitionRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.mapper.ApplicationMapper;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.service.ApplicationQueryService;
import com.nosota.scholarship.service.DepartmentReviewService;
import com.nosota.scholarship.service.InstituteReviewService;
import com.nosota.scholarship.service.ReviewBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the institute and department review stages.
 *
 * <p>Implements {@link ReviewApi}. Bulk endpoints answer 200 with per-item outcomes even when
 * some items fail.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReviewController implements ReviewApi {

    private final InstituteReviewService instituteReviewService;
    private final DepartmentReviewService departmentReviewService;
    private final ReviewBatchService reviewBatchService;
    private final ApplicationQueryService queryService;

    // ==================== Institute ====================

    @Override
    public ResponseEntity<ApplicationResponse> reviewApplication(String applicationId, ReviewRequest request,
                                                                 String actorId, StaffRole actorRole, Long actorScope) {
        Application application = instituteReviewService.review(applicationId, request,
                Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(application));
    }

    @Override
    public ResponseEntity<ApplicationResponse> transitionApplication(String applicationId, TransitionRequest request,
                                                                     String actorId, StaffRole actorRole,
                                                                     Long actorScope) {
        Application application = instituteReviewService.transition(applicationId, request.targetStatus(),
                request.remarks(), Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(application));
    }

    @Override
    public ResponseEntity<BatchResult> bulkReview(BulkReviewRequest request, String actorId, StaffRole actorRole,
                                                  Long actorScope) {
        return ResponseEntity.ok(reviewBatchService.bulkReview(request, Actor.of(actorId, actorRole, actorScope)));
    }

    // ==================== Department ====================

    @Override
    public ResponseEntity<ApplicationResponse> departmentReview(String applicationId, DepartmentReviewRequest request,
                                                                String actorId, StaffRole actorRole, Long actorScope) {
        Application application = departmentReviewService.review(applicationId, request,
                Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(application));
    }

    @Override
    public ResponseEntity<BatchResult> forwardToFinance(ForwardToFinanceRequest request, String actorId,
                                                        StaffRole actorRole, Long actorScope) {
        return ResponseEntity.ok(reviewBatchService.forwardToFinance(request,
                Actor.of(actorId, actorRole, actorScope)));
    }

    private ApplicationResponse toResponse(Application application) {
        return ApplicationMapper.INSTANCE.toResponse(application, queryService.isOverdue(application));
    }
}
