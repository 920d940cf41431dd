package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DecisionOutcome;
import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.api.request.DisbursementRequest;
import com.nosota.scholarship.api.request.ForwardToFinanceRequest;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.dto.ReplayedDecisions;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.model.DecisionLogEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the decision log.
 *
 * <ul>
 *   <li>LOG-001: Every action of the pipeline is logged with contiguous sequence numbers</li>
 *   <li>LOG-002: Replaying the log reproduces the stored stage decisions</li>
 *   <li>LOG-003: A sequence number cannot be taken twice</li>
 *   <li>LOG-004: Failed operations leave no log entry</li>
 *   <li>LOG-005: Unknown application</li>
 *   <li>LOG-006: Later actions never rewrite earlier entries</li>
 * </ul>
 */
@DisplayName("6. Decision Log Tests")
public class DecisionLogTest extends TestBase {

    @Test
    @DisplayName("LOG-001: Pipeline history is complete and ordered")
    void testHistory() {
        // Arrange
        String applicationId = forwarded("40000.00");

        // Act
        List<DecisionLogEntry> history = queryService.getDecisionLog(applicationId);

        // Assert
        assertThat(history).extracting(DecisionLogEntry::getAction).containsExactly(
                DecisionAction.SUBMIT,
                DecisionAction.START_REVIEW,
                DecisionAction.APPROVE,
                DecisionAction.DEPT_APPROVE,
                DecisionAction.FORWARD_TO_FINANCE);
        assertThat(history).extracting(DecisionLogEntry::getSequenceNumber)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, history.size()).boxed().toList());
        assertThat(history).extracting(DecisionLogEntry::getStage).containsExactly(
                Stage.APPLICANT, Stage.INSTITUTE, Stage.INSTITUTE, Stage.DEPARTMENT, Stage.DEPARTMENT);
        assertThat(history.get(0).getFromStatus()).isEqualTo(ApplicationStatus.DRAFT);
        assertThat(history.get(0).getActorId()).isEqualTo(reload(applicationId).getStudentId());
        assertThat(history.get(2).getAmountSnapshot()).isEqualByComparingTo("40000.00");

        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).getCreatedAt()).isAfterOrEqualTo(history.get(i - 1).getCreatedAt());
        }
    }

    @Test
    @DisplayName("LOG-002: Replay of the log matches the stored decisions")
    void testReplay() {
        // Arrange
        String forwarded = forwarded("40000.00");
        String rejected = instituteApproved("40000.00");
        departmentReviewService.departmentReject(rejected, "Scheme quota exhausted", departmentAdmin());

        // Act
        ReplayedDecisions forwardedReplay = queryService.replayDecisions(forwarded);
        ReplayedDecisions rejectedReplay = queryService.replayDecisions(rejected);

        // Assert
        assertThat(forwardedReplay.consistent()).isTrue();
        assertThat(forwardedReplay.decisions().entryCount()).isEqualTo(5);
        assertThat(forwardedReplay.decisions().financeForward().isForwarded()).isTrue();
        assertThat(forwardedReplay.decisions().financeForward().getBatchId())
                .isEqualTo(reload(forwarded).getFinanceForward().getBatchId());

        assertThat(rejectedReplay.consistent()).isTrue();
        assertThat(rejectedReplay.decisions().instituteDecision().getOutcome()).isEqualTo(DecisionOutcome.APPROVED);
        assertThat(rejectedReplay.decisions().departmentDecision().getOutcome()).isEqualTo(DecisionOutcome.REJECTED);
        assertThat(rejectedReplay.decisions().departmentDecision().getRemarks()).isEqualTo("Scheme quota exhausted");
    }

    @Test
    @DisplayName("LOG-003: Duplicate sequence number is rejected by the database")
    void testUniqueSequence() {
        String applicationId = submitted("10000.00");

        DecisionLogEntry duplicate = DecisionLogEntry.builder()
                .applicationId(applicationId)
                .sequenceNumber(1)
                .stage(Stage.INSTITUTE)
                .action(DecisionAction.START_REVIEW)
                .actorId("intruder")
                .createdAt(LocalDateTime.now(clock))
                .build();

        assertThatThrownBy(() -> decisionLogRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
        assertThat(queryService.getDecisionLog(applicationId)).hasSize(1);
    }

    @Test
    @DisplayName("LOG-004: Rejected operations append nothing")
    void testNoEntryOnFailure() {
        String applicationId = instituteApproved("10000.00");
        int before = queryService.getDecisionLog(applicationId).size();

        assertThatThrownBy(() -> instituteReviewService.reject(applicationId, "Late objection", instituteAdmin()))
                .isInstanceOf(AlreadyProcessedException.class);
        BatchResult forward = reviewBatchService.forwardToFinance(
                new ForwardToFinanceRequest(List.of(applicationId), null, null), departmentAdmin());
        assertThat(forward.results().get(0).errorCode()).isEqualTo("NOT_ELIGIBLE");

        assertThat(queryService.getDecisionLog(applicationId)).hasSize(before);
    }

    @Test
    @DisplayName("LOG-005: History of an unknown application is APPLICATION_NOT_FOUND")
    void testUnknownApplication() {
        assertThatThrownBy(() -> queryService.getDecisionLog("APP2024DEADBEEF"))
                .isInstanceOf(ApplicationNotFoundException.class);
        assertThatThrownBy(() -> queryService.replayDecisions("APP2024DEADBEEF"))
                .isInstanceOf(ApplicationNotFoundException.class);
    }

    @Test
    @DisplayName("LOG-006: Existing entries are unchanged after the finance stage appends its own")
    void testAppendOnly() {
        // Arrange
        String applicationId = forwarded("25000.00");
        List<DecisionLogEntry> before = queryService.getDecisionLog(applicationId);

        // Act
        transferService.createAndTransfer(
                new DisbursementRequest(List.of(applicationId), DisbursementMethod.BANK_TRANSFER, null),
                financeAdmin());
        disbursementService.completeApplication(applicationId, financeAdmin());

        // Assert
        List<DecisionLogEntry> after = queryService.getDecisionLog(applicationId);
        assertThat(after).hasSizeGreaterThan(before.size());
        assertThat(after.subList(0, before.size()))
                .usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(before);
        assertThat(after.subList(before.size(), after.size()))
                .extracting(DecisionLogEntry::getStage)
                .containsOnly(Stage.FINANCE);
    }
}
