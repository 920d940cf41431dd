package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.Priority;
import com.nosota.scholarship.api.model.Stage;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One immutable decision log entry.
 *
 * @param sequenceNumber 1-based position in the application's log
 * @param applicationId  Application ID
 * @param stage          Stage that acted
 * @param action         Action taken
 * @param fromStatus     Status before the action (null if the status did not change)
 * @param toStatus       Status after the action (null if the status did not change)
 * @param actorId        Acting staff member or student
 * @param remarks        Remarks
 * @param amountSnapshot Approved (or disbursed) amount at the time of the action
 * @param reference      Batch ID, disbursement ID or transaction reference produced by the action
 * @param priority       Finance priority (forward entries only)
 * @param createdAt      Timestamp
 */
public record DecisionLogEntryResponse(
        int sequenceNumber,
        String applicationId,
        Stage stage,
        DecisionAction action,
        ApplicationStatus fromStatus,
        ApplicationStatus toStatus,
        String actorId,
        String remarks,
        BigDecimal amountSnapshot,
        String reference,
        Priority priority,
        LocalDateTime createdAt
) {
}
