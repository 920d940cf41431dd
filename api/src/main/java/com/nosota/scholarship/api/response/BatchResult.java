package com.nosota.scholarship.api.response;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Summary of a batch operation. Items are processed independently; a failure on one
 * item never aborts the others.
 *
 * @param batchId        Batch identifier (forward or transfer batch), null when not applicable
 * @param total          Number of items requested
 * @param processedCount Number of items that succeeded
 * @param failedCount    Number of items that failed
 * @param totalAmount    Sum of successfully transferred or disbursed amounts (null when not applicable)
 * @param results        Per-item outcomes in request order
 * @param processedAt    Completion timestamp
 */
public record BatchResult(
        String batchId,
        int total,
        int processedCount,
        int failedCount,
        BigDecimal totalAmount,
        List<BatchItemResult> results,
        LocalDateTime processedAt
) {
}
