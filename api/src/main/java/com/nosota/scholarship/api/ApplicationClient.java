package com.nosota.scholarship.api;

import com.nosota.scholarship.api.dto.PagedResponse;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.DecisionLogEntryResponse;
import com.nosota.scholarship.api.response.StageDecisionsResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of {@link ApplicationApi}.
 *
 * <p>Not a Spring component. Consumers register it themselves:
 * <pre>
 * {@code
 * @Bean
 * public ApplicationClient applicationClient(WebClient.Builder builder,
 *                                            @Value("${services.scholarship.url}") String baseUrl) {
 *     return new ApplicationClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class ApplicationClient implements ApplicationApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<ApplicationResponse> createApplication(CreateApplicationRequest request) {
        log.debug("Calling createApplication: studentId={}, instituteId={}, requestedAmount={}",
                request.studentId(), request.instituteId(), request.requestedAmount());

        return webClient.post()
                .uri("/api/v1/applications")
                .bodyValue(request)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApplicationResponse> submitApplication(String applicationId, String actorId) {
        log.debug("Calling submitApplication: applicationId={}", applicationId);

        return webClient.post()
                .uri("/api/v1/applications/{applicationId}/submit", applicationId)
                .header(ActorHeaders.ACTOR_ID, actorId)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApplicationResponse> getApplication(String applicationId) {
        log.debug("Calling getApplication: applicationId={}", applicationId);

        return webClient.get()
                .uri("/api/v1/applications/{applicationId}", applicationId)
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<DecisionLogEntryResponse>> getDecisionLog(String applicationId) {
        log.debug("Calling getDecisionLog: applicationId={}", applicationId);

        return webClient.get()
                .uri("/api/v1/applications/{applicationId}/decision-log", applicationId)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<DecisionLogEntryResponse>>() {})
                .block();
    }

    @Override
    public ResponseEntity<StageDecisionsResponse> replayDecisions(String applicationId) {
        log.debug("Calling replayDecisions: applicationId={}", applicationId);

        return webClient.get()
                .uri("/api/v1/applications/{applicationId}/decisions", applicationId)
                .retrieve()
                .toEntity(StageDecisionsResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ApplicationResponse>> getOverdueApplications(int page, int size) {
        log.debug("Calling getOverdueApplications: page={}, size={}", page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/applications/overdue")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<ApplicationResponse>>() {})
                .block();
    }
}
