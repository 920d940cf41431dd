package com.nosota.scholarship.controller;

import com.nosota.scholarship.api.ApplicationApi;
import com.nosota.scholarship.api.dto.PagedResponse;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.DecisionLogEntryResponse;
import com.nosota.scholarship.api.response.StageDecisionsResponse;
import com.nosota.scholarship.mapper.ApplicationMapper;
import com.nosota.scholarship.mapper.DecisionLogMapper;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.service.ApplicationIntakeService;
import com.nosota.scholarship.service.ApplicationQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for application intake and reads.
 *
 * <p>Implements {@link ApplicationApi}.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ApplicationController implements ApplicationApi {

    private final ApplicationIntakeService intakeService;
    private final ApplicationQueryService queryService;

    @Override
    public ResponseEntity<ApplicationResponse> createApplication(CreateApplicationRequest request) {
        Application application = intakeService.createApplication(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(application));
    }

    @Override
    public ResponseEntity<ApplicationResponse> submitApplication(String applicationId, String actorId) {
        Application application = intakeService.submitApplication(applicationId, actorId);
        return ResponseEntity.ok(toResponse(application));
    }

    @Override
    public ResponseEntity<ApplicationResponse> getApplication(String applicationId) {
        return ResponseEntity.ok(toResponse(queryService.getApplication(applicationId)));
    }

    @Override
    public ResponseEntity<List<DecisionLogEntryResponse>> getDecisionLog(String applicationId) {
        return ResponseEntity.ok(DecisionLogMapper.INSTANCE.toResponseList(queryService.getDecisionLog(applicationId)));
    }

    @Override
    public ResponseEntity<StageDecisionsResponse> replayDecisions(String applicationId) {
        return ResponseEntity.ok(ApplicationMapper.INSTANCE.toResponse(queryService.replayDecisions(applicationId)));
    }

    @Override
    public ResponseEntity<PagedResponse<ApplicationResponse>> getOverdueApplications(int page, int size) {
        Page<Application> overdue = queryService.getOverdueApplications(page, size);

        List<ApplicationResponse> content = overdue.getContent().stream()
                .map(application -> ApplicationMapper.INSTANCE.toResponse(application, true))
                .toList();

        PagedResponse<ApplicationResponse> response = new PagedResponse<>(
                content,
                overdue.getNumber(),
                overdue.getSize(),
                overdue.getTotalElements()
        );
        return ResponseEntity.ok(response);
    }

    private ApplicationResponse toResponse(Application application) {
        return ApplicationMapper.INSTANCE.toResponse(application, queryService.isOverdue(application));
    }
}
