package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;
import com.nosota.scholarship.dto.TransferClaim;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import com.nosota.scholarship.model.Disbursement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for concurrent operations on the same record. The application row lock
 * serializes them: one call wins, every other call sees the committed result and is refused.
 *
 * <ul>
 *   <li>CONC-001: Concurrent department approvals</li>
 *   <li>CONC-002: Concurrent forwards to finance</li>
 *   <li>CONC-003: Concurrent transfer claims of one disbursement</li>
 * </ul>
 */
@DisplayName("12. Concurrency Tests")
public class ConcurrencyTest extends TestBase {

    private static final int CALLERS = 4;

    @Test
    @DisplayName("CONC-001: Concurrent department approvals have exactly one winner")
    void testConcurrentDepartmentApprove() {
        // Arrange
        String applicationId = instituteApproved("30000.00");

        // Act
        Race<Application> race = race(() ->
                departmentReviewService.departmentApprove(applicationId, "Verified", null, departmentAdmin()));

        // Assert
        assertThat(race.winners()).hasSize(1);
        assertThat(race.losers()).hasSize(CALLERS - 1)
                .allMatch(AlreadyProcessedException.class::isInstance);
        assertThat(decisionLogService.getHistory(applicationId))
                .filteredOn(entry -> entry.getAction() == DecisionAction.DEPT_APPROVE)
                .hasSize(1);
    }

    @Test
    @DisplayName("CONC-002: Concurrent forwards record one forward and one log entry")
    void testConcurrentForward() {
        // Arrange
        String applicationId = departmentApproved("30000.00");

        // Act
        Race<Application> race = race(() ->
                departmentReviewService.forwardToFinance(applicationId, "For disbursement", null, "FWD-RACE",
                        departmentAdmin()));

        // Assert
        assertThat(race.winners()).hasSize(1);
        assertThat(race.losers()).allMatch(AlreadyProcessedException.class::isInstance);

        List<DecisionLogEntry> history = decisionLogService.getHistory(applicationId);
        assertThat(history).filteredOn(entry -> entry.getAction() == DecisionAction.FORWARD_TO_FINANCE).hasSize(1);
        assertThat(history).extracting(DecisionLogEntry::getSequenceNumber)
                .doesNotHaveDuplicates()
                .isSorted();
    }

    @Test
    @DisplayName("CONC-003: Concurrent transfer claims of one disbursement refuse the losers with ALREADY_PROCESSED")
    void testConcurrentClaim() {
        // Arrange
        String applicationId = forwarded("30000.00");
        Disbursement disbursement = disbursementService.createDisbursement(applicationId,
                DisbursementMethod.BANK_TRANSFER, null, financeAdmin());
        String disbursementId = disbursement.getDisbursementId();

        // Act
        Race<TransferClaim> race = race(() ->
                disbursementService.claimForTransfer(disbursementId, "DBT-RACE", false, financeAdmin()));

        // Assert
        assertThat(race.winners()).hasSize(1);
        assertThat(race.losers()).hasSize(CALLERS - 1)
                .allMatch(AlreadyProcessedException.class::isInstance);

        Disbursement claimed = disbursementService.getDisbursement(disbursementId);
        assertThat(claimed.getStatus()).isEqualTo(DisbursementStatus.PROCESSING);
        assertThat(claimed.getAttemptCount()).isEqualTo(1);
    }

    private <T> Race<T> race(Supplier<T> call) {
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<T>> futures = new ArrayList<>();
        for (int i = 0; i < CALLERS; i++) {
            futures.add(asyncService.callWhenReleased(start, call));
        }
        start.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(e -> null)
                .join(); // This will block until all futures are complete

        List<T> winners = new ArrayList<>();
        List<Throwable> losers = new ArrayList<>();
        for (CompletableFuture<T> future : futures) {
            try {
                winners.add(future.get());
            } catch (ExecutionException e) {
                losers.add(unwrap(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
        return new Race<>(winners, losers);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private record Race<T>(List<T> winners, List<Throwable> losers) {
    }
}
