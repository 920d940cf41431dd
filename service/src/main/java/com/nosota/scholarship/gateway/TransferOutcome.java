package com.nosota.scholarship.gateway;

/**
 * Result of a transfer: success with the bank reference, or failure with a reason.
 */
public record TransferOutcome(boolean success, String reference, String reason) {

    public static TransferOutcome success(String reference) {
        return new TransferOutcome(true, reference, null);
    }

    public static TransferOutcome failure(String reason) {
        return new TransferOutcome(false, null, reason);
    }
}
