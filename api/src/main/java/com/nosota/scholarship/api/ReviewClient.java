package com.nosota.scholarship.api;

import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.BulkReviewRequest;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.api.request.TransitionRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.BatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.function.Consumer;

/**
 * WebClient-based implementation of {@link ReviewApi}. Registered manually by consumers,
 * see {@link ApplicationClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class ReviewClient implements ReviewApi {

    private final WebClient webClient;

    // ==================== Institute (Stage 1) ====================

    @Override
    public ResponseEntity<ApplicationResponse> reviewApplication(String applicationId, ReviewRequest request,
                                                                 String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling reviewApplication: applicationId={}, action={}, actorId={}",
                applicationId, request.action(), actorId);

        return webClient.post()
                .uri("/api/v1/review/institute/applications/{applicationId}", applicationId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApplicationResponse> transitionApplication(String applicationId, TransitionRequest request,
                                                                     String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling transitionApplication: applicationId={}, targetStatus={}, actorId={}",
                applicationId, request.targetStatus(), actorId);

        return webClient.post()
                .uri("/api/v1/review/institute/applications/{applicationId}/transition", applicationId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BatchResult> bulkReview(BulkReviewRequest request,
                                                  String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling bulkReview: count={}, action={}, actorId={}",
                request.applicationIds().size(), request.action(), actorId);

        return webClient.post()
                .uri("/api/v1/review/institute/bulk")
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(BatchResult.class)
                .block();
    }

    // ==================== Department (Stage 2) ====================

    @Override
    public ResponseEntity<ApplicationResponse> departmentReview(String applicationId, DepartmentReviewRequest request,
                                                                String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling departmentReview: applicationId={}, action={}, actorId={}",
                applicationId, request.action(), actorId);

        return webClient.post()
                .uri("/api/v1/review/department/applications/{applicationId}", applicationId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BatchResult> forwardToFinance(ForwardToFinanceRequest request,
                                                        String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling forwardToFinance: count={}, priority={}, actorId={}",
                request.applicationIds().size(), request.priority(), actorId);

        return webClient.post()
                .uri("/api/v1/review/department/forward")
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(BatchResult.class)
                .block();
    }

    static Consumer<HttpHeaders> actorHeaders(String actorId, StaffRole actorRole, Long actorScope) {
        return headers -> {
            headers.set(ActorHeaders.ACTOR_ID, actorId);
            headers.set(ActorHeaders.ACTOR_ROLE, actorRole.name());
            if (actorScope != null) {
                headers.set(ActorHeaders.ACTOR_SCOPE, actorScope.toString());
            }
        };
    }
}
