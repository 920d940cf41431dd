package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.ActorHeaders;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.DepartmentAction;
import com.nosota.scholarship.api.model.ReviewAction;
import com.nosota.scholarship.api.model.ScholarshipType;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP tests for the application and review endpoints.
 *
 * <ul>
 *   <li>API-001: Create and submit an application</li>
 *   <li>API-002: Review through the REST API</li>
 *   <li>API-003: Error responses carry status, code and correlation ID</li>
 *   <li>API-004: Decision history and overdue listing</li>
 *   <li>API-005: API docs are closed outside the dev profile</li>
 * </ul>
 */
@DisplayName("9. Application Controller Tests")
public class ApplicationControllerTest extends TestBase {

    @Test
    @DisplayName("API-001: Create returns 201 with a DRAFT application, submit moves it to SUBMITTED")
    void testCreateAndSubmit() throws Exception {
        // Arrange
        CreateApplicationRequest request = new CreateApplicationRequest(
                "STU-API-1", INSTITUTE_ID, DEPARTMENT_ID, ScholarshipType.NEED, "Need Scholarship", null,
                new BigDecimal("35000.00"), "2024-25", null, 70, 100, new BigDecimal("7.20"),
                CourseLevel.POSTGRADUATE, ACCOUNT, IFSC);

        // Act
        MvcResult created = mockMvc.perform(post("/api/v1/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.applicationId").exists())
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.priority").value("MEDIUM"))
                .andExpect(jsonPath("$.instituteDecision.outcome").value("PENDING"))
                .andExpect(jsonPath("$.financeForward.forwarded").value(false))
                .andReturn();
        ApplicationResponse response = objectMapper.readValue(created.getResponse().getContentAsString(),
                ApplicationResponse.class);

        // Assert
        assertThat(response.applicationId()).startsWith("APP");
        mockMvc.perform(post("/api/v1/applications/{id}/submit", response.applicationId())
                        .header(ActorHeaders.ACTOR_ID, "STU-API-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUBMITTED"))
                .andExpect(jsonPath("$.submittedAt").exists());

        mockMvc.perform(post("/api/v1/applications/{id}/submit", response.applicationId())
                        .header(ActorHeaders.ACTOR_ID, "STU-API-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("API-002: Institute and department review over HTTP")
    void testReviewEndpoints() throws Exception {
        // Arrange
        String applicationId = submitted("20000.00");

        // Act & Assert
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new ReviewRequest(ReviewAction.APPROVE, "Good record", new BigDecimal("15000"))))
                        .header(ActorHeaders.ACTOR_ID, "inst-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "INSTITUTE_ADMIN")
                        .header(ActorHeaders.ACTOR_SCOPE, INSTITUTE_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PARTIALLY_APPROVED"))
                .andExpect(jsonPath("$.approvedAmount").value(15000.00))
                .andExpect(jsonPath("$.instituteDecision.outcome").value("APPROVED"));

        mockMvc.perform(post("/api/v1/review/department/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                new DepartmentReviewRequest(DepartmentAction.DEPT_APPROVE, "Verified", null)))
                        .header(ActorHeaders.ACTOR_ID, "dept-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "DEPARTMENT_ADMIN")
                        .header(ActorHeaders.ACTOR_SCOPE, DEPARTMENT_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PARTIALLY_APPROVED"))
                .andExpect(jsonPath("$.departmentDecision.outcome").value("APPROVED"));
    }

    @Test
    @DisplayName("API-003: 404, 403, 409 and 400 responses use the error body")
    void testErrorResponses() throws Exception {
        String applicationId = instituteApproved("20000.00");
        String approveBody = objectMapper.writeValueAsString(new ReviewRequest(ReviewAction.APPROVE, null, null));

        // 404
        mockMvc.perform(get("/api/v1/applications/{id}", "APP2024MISSING0")
                        .header(ActorHeaders.CORRELATION_ID, "corr-404"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(ActorHeaders.CORRELATION_ID, "corr-404"))
                .andExpect(jsonPath("$.code").value("APPLICATION_NOT_FOUND"))
                .andExpect(jsonPath("$.correlationId").value("corr-404"))
                .andExpect(jsonPath("$.path").value("/api/v1/applications/APP2024MISSING0"));

        // 403: reviewer of another institute
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approveBody)
                        .header(ActorHeaders.ACTOR_ID, "other-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "INSTITUTE_ADMIN")
                        .header(ActorHeaders.ACTOR_SCOPE, OTHER_INSTITUTE_ID))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCESS_DENIED"));

        // 409: decided already
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approveBody)
                        .header(ActorHeaders.ACTOR_ID, "inst-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "INSTITUTE_ADMIN")
                        .header(ActorHeaders.ACTOR_SCOPE, INSTITUTE_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_PROCESSED"));

        // 400: missing role header
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approveBody)
                        .header(ActorHeaders.ACTOR_ID, "inst-admin"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        // 400: unknown role
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(approveBody)
                        .header(ActorHeaders.ACTOR_ID, "inst-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "DEAN"))
                .andExpect(status().isBadRequest());

        // 400: bean validation
        mockMvc.perform(post("/api/v1/review/institute/applications/{id}", applicationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"remarks\":\"no action\"}")
                        .header(ActorHeaders.ACTOR_ID, "inst-admin")
                        .header(ActorHeaders.ACTOR_ROLE, "INSTITUTE_ADMIN")
                        .header(ActorHeaders.ACTOR_SCOPE, INSTITUTE_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("API-004: Decision log, replay and overdue endpoints")
    void testQueryEndpoints() throws Exception {
        String forwarded = forwarded("20000.00");
        String waiting = submitted("20000.00");
        clock.advance(Duration.ofDays(31));

        mockMvc.perform(get("/api/v1/applications/{id}/decision-log", forwarded))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(5))
                .andExpect(jsonPath("$[0].sequenceNumber").value(1))
                .andExpect(jsonPath("$[4].action").value("FORWARD_TO_FINANCE"));

        mockMvc.perform(get("/api/v1/applications/{id}/decisions", forwarded))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.consistent").value(true))
                .andExpect(jsonPath("$.entryCount").value(5))
                .andExpect(jsonPath("$.financeForward.forwarded").value(true));

        mockMvc.perform(get("/api/v1/applications/overdue").param("page", "0").param("size", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].applicationId").value(waiting))
                .andExpect(jsonPath("$.data[0].overdue").value(true));

        mockMvc.perform(get("/api/v1/applications/{id}", forwarded))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overdue").value(false));
    }

    @Test
    @DisplayName("API-005: OpenAPI document is not served in the test profile")
    void testApiDocsClosed() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isForbidden());
    }
}
