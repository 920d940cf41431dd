package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ReviewAction;
import com.nosota.scholarship.api.request.BulkReviewRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.error.InvalidRequestException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.security.AccessPolicy;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.security.Capability;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;

/**
 * Bulk institute review and bulk forwarding to finance.
 *
 * <p>Runs without a transaction of its own. Every item is handed to the single-item
 * operation of the gatekeeper, which commits or rolls back on its own; a failing item is
 * recorded in the result and the batch moves on.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class ReviewBatchService {

    private final InstituteReviewService instituteReviewService;
    private final DepartmentReviewService departmentReviewService;
    private final AccessPolicy accessPolicy;
    private final IdentifierGenerator identifierGenerator;
    private final Clock clock;

    /**
     * Approves or rejects several applications.
     *
     * @throws InvalidRequestException if the action is not APPROVE or REJECT, or a rejection has no remarks
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public BatchResult bulkReview(@Valid @NotNull BulkReviewRequest request, @NotNull Actor actor) {
        if (request.action() != ReviewAction.APPROVE && request.action() != ReviewAction.REJECT) {
            throw new InvalidRequestException("Bulk review supports APPROVE and REJECT only, got " + request.action());
        }
        if (request.action() == ReviewAction.REJECT && (request.remarks() == null || request.remarks().isBlank())) {
            throw new InvalidRequestException("Remarks are required to reject applications");
        }
        accessPolicy.check(actor, Capability.INSTITUTE_REVIEW);

        log.info("Bulk {} of {} applications by {}", request.action(), request.applicationIds().size(), actor.id());
        BatchCollector batch = new BatchCollector(null, false);

        for (String applicationId : request.applicationIds()) {
            try {
                Application application = request.action() == ReviewAction.APPROVE
                        ? instituteReviewService.approve(applicationId, request.remarks(), null, actor)
                        : instituteReviewService.reject(applicationId, request.remarks(), actor);
                batch.success(applicationId, "Application " + application.getStatus(), null,
                        application.getApprovedAmount());
            } catch (RuntimeException e) {
                batch.failure(applicationId, e);
            }
        }

        BatchResult result = batch.finish(Timestamps.now(clock));
        log.info("Bulk {} finished: processed={}, failed={}",
                request.action(), result.processedCount(), result.failedCount());
        return result;
    }

    /**
     * Forwards department-approved applications to finance under one FWD batch ID.
     * Forwarding an application twice fails that item with ALREADY_PROCESSED.
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public BatchResult forwardToFinance(@Valid @NotNull ForwardToFinanceRequest request, @NotNull Actor actor) {
        accessPolicy.check(actor, Capability.FORWARD_TO_FINANCE);

        String batchId = identifierGenerator.nextForwardBatchId();
        log.info("Forwarding {} applications to finance by {} (batch={})",
                request.applicationIds().size(), actor.id(), batchId);
        BatchCollector batch = new BatchCollector(batchId, false);

        for (String applicationId : request.applicationIds()) {
            try {
                Application application = departmentReviewService.forwardToFinance(applicationId,
                        request.remarks(), request.priority(), batchId, actor);
                batch.success(applicationId, "Forwarded to finance", batchId, application.getApprovedAmount());
            } catch (RuntimeException e) {
                batch.failure(applicationId, e);
            }
        }

        BatchResult result = batch.finish(Timestamps.now(clock));
        log.info("Forward batch {} finished: processed={}, failed={}",
                batchId, result.processedCount(), result.failedCount());
        return result;
    }
}
