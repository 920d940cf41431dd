package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DecisionOutcome;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.dto.StageDecisions;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import com.nosota.scholarship.model.FinanceForward;
import com.nosota.scholarship.model.StageDecision;
import com.nosota.scholarship.repository.DecisionLogRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Append-only decision log of applications.
 *
 * <p>Appends join the caller's transaction, which holds the application row lock, so the
 * sequence numbers of one application are assigned one at a time. The unique constraint on
 * (application, sequence) rejects any append that slips past the lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DecisionLogService {

    private final DecisionLogRepository decisionLogRepository;

    /**
     * Appends an entry to the application's log.
     *
     * @param application Locked application the entry belongs to
     * @param entry       Entry content; application ID and sequence number are assigned here
     * @return Persisted entry
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public DecisionLogEntry append(Application application, DecisionLogEntry.DecisionLogEntryBuilder entry) {
        int sequenceNumber = decisionLogRepository.findMaxSequenceNumber(application.getApplicationId()) + 1;

        DecisionLogEntry saved = decisionLogRepository.save(entry
                .applicationId(application.getApplicationId())
                .sequenceNumber(sequenceNumber)
                .build());

        log.debug("Decision log entry #{} appended: applicationId={}, stage={}, action={}, {} → {}",
                sequenceNumber, application.getApplicationId(), saved.getStage(), saved.getAction(),
                saved.getFromStatus(), saved.getToStatus());
        return saved;
    }

    public List<DecisionLogEntry> getHistory(String applicationId) {
        return decisionLogRepository.findByApplicationIdOrderBySequenceNumberAsc(applicationId);
    }

    /**
     * Rebuilds the per-stage decisions of an application from its log.
     *
     * @param applicationId Application ID
     * @return Replayed stage decisions
     */
    public StageDecisions replay(String applicationId) {
        List<DecisionLogEntry> entries = getHistory(applicationId);

        StageDecision institute = StageDecision.pending();
        StageDecision department = StageDecision.pending();
        FinanceForward forward = FinanceForward.notForwarded();

        for (DecisionLogEntry entry : entries) {
            switch (entry.getAction()) {
                case APPROVE, PARTIALLY_APPROVE -> {
                    if (entry.getStage() == Stage.INSTITUTE) {
                        institute = decision(DecisionOutcome.APPROVED, entry);
                    }
                }
                case REJECT -> {
                    if (entry.getStage() == Stage.INSTITUTE) {
                        institute = decision(DecisionOutcome.REJECTED, entry);
                    }
                }
                case DEPT_APPROVE -> department = decision(DecisionOutcome.APPROVED, entry);
                case DEPT_REJECT -> department = decision(DecisionOutcome.REJECTED, entry);
                case FORWARD_TO_FINANCE -> forward = new FinanceForward(true, entry.getActorId(),
                        entry.getRemarks(), entry.getPriority(), entry.getReference(), entry.getCreatedAt());
                default -> {
                    // workflow and payment actions carry no stage decision
                }
            }
        }

        return new StageDecisions(institute, department, forward, entries.size());
    }

    private static StageDecision decision(DecisionOutcome outcome, DecisionLogEntry entry) {
        return new StageDecision(outcome, entry.getActorId(), entry.getRemarks(), entry.getCreatedAt());
    }

    /**
     * Shorthand used by the gatekeepers.
     */
    static DecisionLogEntry.DecisionLogEntryBuilder entry(Stage stage, DecisionAction action) {
        return DecisionLogEntry.builder().stage(stage).action(action);
    }
}
