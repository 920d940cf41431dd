package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.ItemOutcome;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.response.BatchItemResult;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for forwarding department-approved applications to finance.
 *
 * <ul>
 *   <li>FWD-001: Mixed batch processes eligible items and reports the others</li>
 *   <li>FWD-002: Forwarding twice fails with ALREADY_PROCESSED</li>
 * </ul>
 */
@DisplayName("4. Forward To Finance Tests")
public class ForwardToFinanceTest extends TestBase {

    @Test
    @DisplayName("FWD-001: Five applications, two without department approval: processed=3, failed=2")
    void testMixedBatch() {
        // Arrange
        String first = departmentApproved("10000.00");
        String pendingDepartment = instituteApproved("20000.00");
        String second = departmentApproved("30000.00");
        String draftOnly = submitted("40000.00");
        String third = departmentApproved("50000.00");

        ForwardToFinanceRequest request = new ForwardToFinanceRequest(
                List.of(first, pendingDepartment, second, draftOnly, third), "Quarterly batch", Priority.HIGH);

        // Act
        BatchResult result = reviewBatchService.forwardToFinance(request, departmentAdmin());

        // Assert
        assertThat(result.batchId()).startsWith("FWD");
        assertThat(result.total()).isEqualTo(5);
        assertThat(result.processedCount()).isEqualTo(3);
        assertThat(result.failedCount()).isEqualTo(2);
        assertThat(result.results()).extracting(BatchItemResult::outcome).containsExactly(
                ItemOutcome.SUCCESS, ItemOutcome.FAILED, ItemOutcome.SUCCESS, ItemOutcome.FAILED, ItemOutcome.SUCCESS);
        assertThat(result.results().get(1).errorCode()).isEqualTo("NOT_ELIGIBLE");
        assertThat(result.results().get(3).errorCode()).isEqualTo("NOT_ELIGIBLE");

        Application forwarded = reload(first);
        assertThat(forwarded.getFinanceForward().isForwarded()).isTrue();
        assertThat(forwarded.getFinanceForward().getBatchId()).isEqualTo(result.batchId());
        assertThat(forwarded.getFinanceForward().getPriority()).isEqualTo(Priority.HIGH);
        assertThat(forwarded.getStatus()).isEqualTo(ApplicationStatus.APPROVED);

        assertThat(reload(pendingDepartment).getFinanceForward().isForwarded()).isFalse();
        assertThat(reload(draftOnly).getStatus()).isEqualTo(ApplicationStatus.SUBMITTED);

        List<DecisionLogEntry> history = decisionLogService.getHistory(third);
        DecisionLogEntry last = history.get(history.size() - 1);
        assertThat(last.getAction()).isEqualTo(DecisionAction.FORWARD_TO_FINANCE);
        assertThat(last.getReference()).isEqualTo(result.batchId());
    }

    @Test
    @DisplayName("FWD-002: Second forward of the same application fails with ALREADY_PROCESSED")
    void testForwardTwice() {
        // Arrange
        String applicationId = forwarded("10000.00");
        String originalBatch = reload(applicationId).getFinanceForward().getBatchId();

        // Act
        BatchResult result = reviewBatchService.forwardToFinance(
                new ForwardToFinanceRequest(List.of(applicationId), "Again", null), departmentAdmin());

        // Assert
        assertThat(result.processedCount()).isZero();
        assertThat(result.failedCount()).isEqualTo(1);
        assertThat(result.results().get(0).errorCode()).isEqualTo("ALREADY_PROCESSED");
        assertThat(reload(applicationId).getFinanceForward().getBatchId()).isEqualTo(originalBatch);
    }

    @Test
    @DisplayName("FWD-003: Priority defaults to MEDIUM")
    void testDefaultPriority() {
        String applicationId = departmentApproved("10000.00");

        reviewBatchService.forwardToFinance(
                new ForwardToFinanceRequest(List.of(applicationId), null, null), departmentAdmin());

        assertThat(reload(applicationId).getFinanceForward().getPriority()).isEqualTo(Priority.MEDIUM);
    }
}
