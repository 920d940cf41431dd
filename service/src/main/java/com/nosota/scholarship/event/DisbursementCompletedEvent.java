package com.nosota.scholarship.event;

import com.nosota.scholarship.api.model.DisbursementMethod;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Published when a disbursement reaches DISBURSED.
 */
public record DisbursementCompletedEvent(
        String disbursementId,
        String applicationId,
        BigDecimal amount,
        DisbursementMethod method,
        String transactionReference,
        LocalDateTime disbursedAt
) {
}
