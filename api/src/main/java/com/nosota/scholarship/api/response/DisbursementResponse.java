package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Response DTO for a disbursement.
 *
 * @param disbursementId       Disbursement ID (DISB...)
 * @param applicationId        Owning application
 * @param amount               Amount snapshotted from the approved amount
 * @param method               Disbursement method
 * @param status               Current status
 * @param bankAccountNumber    Masked bank account (last 4 digits)
 * @param bankIfsc             Bank routing code
 * @param transactionReference Gateway or manual payment reference (set on success)
 * @param failureReason        Last transfer failure reason
 * @param batchId              Last transfer batch
 * @param remarks              Finance remarks
 * @param attemptCount         Number of transfer attempts
 * @param components           Tuition, maintenance and books shares with their payment state
 * @param disbursedAt          Disbursement timestamp
 * @param createdAt            Creation timestamp
 * @param updatedAt            Last update timestamp
 */
public record DisbursementResponse(
        String disbursementId,
        String applicationId,
        BigDecimal amount,
        DisbursementMethod method,
        DisbursementStatus status,
        String bankAccountNumber,
        String bankIfsc,
        String transactionReference,
        String failureReason,
        String batchId,
        String remarks,
        int attemptCount,
        List<DisbursementComponentResponse> components,
        LocalDateTime disbursedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
