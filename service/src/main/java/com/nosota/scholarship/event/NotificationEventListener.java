package com.nosota.scholarship.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands committed lifecycle events over to the notification service.
 *
 * <p>Runs after commit on the async executor; a failure here never affects the
 * operation that published the event.
 */
@Component
@Slf4j
public class NotificationEventListener {

    @Async
    @TransactionalEventListener
    public void onApplicationApproved(ApplicationApprovedEvent event) {
        log.info("Notify student {}: application {} {} with amount {}",
                event.studentId(), event.applicationId(), event.status(), event.approvedAmount());
    }

    @Async
    @TransactionalEventListener
    public void onDisbursementCompleted(DisbursementCompletedEvent event) {
        log.info("Notify application {}: disbursement {} of {} completed via {} (reference={})",
                event.applicationId(), event.disbursementId(), event.amount(),
                event.method(), event.transactionReference());
    }
}
