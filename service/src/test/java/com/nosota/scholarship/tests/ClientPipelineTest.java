package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.ApplicationClient;
import com.nosota.scholarship.api.FinanceClient;
import com.nosota.scholarship.api.ReviewClient;
import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.DepartmentAction;
import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.ReviewAction;
import com.nosota.scholarship.api.model.ScholarshipType;
import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.CreateApplicationRequest;
import com.nosota.scholarship.api.request.DepartmentReviewRequest;
import com.nosota.scholarship.api.request.DisbursementRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.request.ReviewRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.api.response.DecisionLogEntryResponse;
import com.nosota.scholarship.api.response.DisbursementResponse;
import com.nosota.scholarship.api.response.StageDecisionsResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Drives the whole pipeline over HTTP with the published WebClient clients.
 */
@DisplayName("11. Client Pipeline Tests")
public class ClientPipelineTest extends TestBase {

    @LocalServerPort
    private int port;

    private ApplicationClient applicationClient;
    private ReviewClient reviewClient;
    private FinanceClient financeClient;

    @BeforeEach
    void setUpClients() {
        WebClient webClient = WebClient.builder().baseUrl("http://localhost:" + port).build();
        applicationClient = new ApplicationClient(webClient);
        reviewClient = new ReviewClient(webClient);
        financeClient = new FinanceClient(webClient);
    }

    @Test
    @DisplayName("E2E-001: Draft to COMPLETED through the clients")
    void testFullPipeline() {
        // Intake
        ApplicationResponse draft = applicationClient.createApplication(new CreateApplicationRequest(
                "STU-E2E-1", INSTITUTE_ID, DEPARTMENT_ID, ScholarshipType.MERIT, "Merit Scholarship", null,
                new BigDecimal("48000.00"), "2024-25", Priority.HIGH, 85, 95, new BigDecimal("9.10"),
                CourseLevel.UNDERGRADUATE, ACCOUNT, IFSC)).getBody();
        assertThat(draft).isNotNull();
        String applicationId = draft.applicationId();
        applicationClient.submitApplication(applicationId, "STU-E2E-1");

        // Institute and department
        ApplicationResponse approved = reviewClient.reviewApplication(applicationId,
                new ReviewRequest(ReviewAction.APPROVE, "Top of class", null),
                "inst-admin", StaffRole.INSTITUTE_ADMIN, INSTITUTE_ID).getBody();
        assertThat(approved.status()).isEqualTo(ApplicationStatus.APPROVED);

        reviewClient.departmentReview(applicationId,
                new DepartmentReviewRequest(DepartmentAction.DEPT_APPROVE, "Verified", null),
                "dept-admin", StaffRole.DEPARTMENT_ADMIN, DEPARTMENT_ID);
        BatchResult forward = reviewClient.forwardToFinance(
                new ForwardToFinanceRequest(List.of(applicationId), "Ready", Priority.HIGH),
                "dept-admin", StaffRole.DEPARTMENT_ADMIN, DEPARTMENT_ID).getBody();
        assertThat(forward.processedCount()).isEqualTo(1);

        // Finance
        BatchResult transfer = financeClient.createAndTransferDisbursements(
                new DisbursementRequest(List.of(applicationId), DisbursementMethod.BANK_TRANSFER, null),
                "fin-admin", StaffRole.FINANCE_ADMIN, null).getBody();
        assertThat(transfer.processedCount()).isEqualTo(1);
        assertThat(transfer.totalAmount()).isEqualByComparingTo("48000.00");

        DisbursementResponse disbursement = financeClient.getDisbursementForApplication(applicationId).getBody();
        assertThat(disbursement.status()).isEqualTo(DisbursementStatus.DISBURSED);
        assertThat(disbursement.bankAccountNumber()).isEqualTo("****9012");

        ApplicationResponse completed = financeClient.completeApplication(applicationId,
                "fin-admin", StaffRole.FINANCE_ADMIN, null).getBody();
        assertThat(completed.status()).isEqualTo(ApplicationStatus.COMPLETED);

        // History
        List<DecisionLogEntryResponse> history = applicationClient.getDecisionLog(applicationId).getBody();
        assertThat(history).hasSize(8);
        StageDecisionsResponse decisions = applicationClient.replayDecisions(applicationId).getBody();
        assertThat(decisions.consistent()).isTrue();
        assertThat(decisions.entryCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("E2E-002: Error statuses surface as WebClientResponseException")
    void testClientErrors() {
        assertThatThrownBy(() -> applicationClient.getApplication("APP2024MISSING0"))
                .isInstanceOfSatisfying(WebClientResponseException.class,
                        e -> assertThat(e.getStatusCode().value()).isEqualTo(404));

        String applicationId = submitted("10000.00");
        assertThatThrownBy(() -> reviewClient.reviewApplication(applicationId,
                new ReviewRequest(ReviewAction.APPROVE, null, null),
                "fin-admin", StaffRole.FINANCE_ADMIN, null))
                .isInstanceOfSatisfying(WebClientResponseException.class,
                        e -> assertThat(e.getStatusCode().value()).isEqualTo(403));
    }
}
