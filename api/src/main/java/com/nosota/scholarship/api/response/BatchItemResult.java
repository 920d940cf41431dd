package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.ItemOutcome;

import java.math.BigDecimal;

/**
 * Outcome of one item inside a batch operation.
 *
 * @param id          Application or disbursement ID the item refers to
 * @param outcome     SUCCESS or FAILED
 * @param errorCode   Machine readable error code (null on success)
 * @param message     Human readable message
 * @param referenceId Created or affected record (disbursement ID, transaction reference), if any
 * @param amount      Amount involved, if any
 */
public record BatchItemResult(
        String id,
        ItemOutcome outcome,
        String errorCode,
        String message,
        String referenceId,
        BigDecimal amount
) {
    public boolean succeeded() {
        return outcome == ItemOutcome.SUCCESS;
    }
}
