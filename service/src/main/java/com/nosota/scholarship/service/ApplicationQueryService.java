package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.dto.ReplayedDecisions;
import com.nosota.scholarship.dto.StageDecisions;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.DecisionLogEntry;
import com.nosota.scholarship.repository.ApplicationRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Read side: applications, decision history and the overdue queue.
 *
 * <p>An application is overdue while it waits for the institute (SUBMITTED or UNDER_REVIEW) and
 * was submitted more than {@code scholarship.sla.overdue-days} days ago. Overdue is derived on
 * every read and never stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationQueryService {

    static final Set<ApplicationStatus> AWAITING_REVIEW =
            EnumSet.of(ApplicationStatus.SUBMITTED, ApplicationStatus.UNDER_REVIEW);

    private final ApplicationRepository applicationRepository;
    private final DecisionLogService decisionLogService;
    private final Clock clock;

    @Value("${scholarship.sla.overdue-days:30}")
    private int overdueDays;

    @Transactional
    public Application getApplication(String applicationId) {
        return applicationRepository.findByApplicationId(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    /**
     * @return log entries in sequence order
     */
    @Transactional
    public List<DecisionLogEntry> getDecisionLog(String applicationId) {
        requireExists(applicationId);
        return decisionLogService.getHistory(applicationId);
    }

    /**
     * Replays the decision log and compares the result with the stored stage decisions.
     */
    @Transactional
    public ReplayedDecisions replayDecisions(String applicationId) {
        Application application = getApplication(applicationId);
        StageDecisions replayed = decisionLogService.replay(applicationId);

        boolean consistent = replayed.instituteDecision().equals(application.getInstituteDecision())
                && replayed.departmentDecision().equals(application.getDepartmentDecision())
                && replayed.financeForward().equals(application.getFinanceForward());
        if (!consistent) {
            log.warn("Stored stage decisions of application {} differ from its decision log", applicationId);
        }
        return new ReplayedDecisions(applicationId, replayed, consistent);
    }

    /**
     * Overdue applications, oldest submission first.
     */
    @Transactional
    public Page<Application> getOverdueApplications(int page, int size) {
        return applicationRepository.findOverdue(AWAITING_REVIEW, overdueThreshold(), PageRequest.of(page, size));
    }

    public boolean isOverdue(Application application) {
        return AWAITING_REVIEW.contains(application.getStatus())
                && application.getSubmittedAt() != null
                && application.getSubmittedAt().isBefore(overdueThreshold());
    }

    private LocalDateTime overdueThreshold() {
        return LocalDateTime.now(clock).minusDays(overdueDays);
    }

    private void requireExists(String applicationId) {
        if (!applicationRepository.existsByApplicationId(applicationId)) {
            throw new ApplicationNotFoundException(applicationId);
        }
    }
}
