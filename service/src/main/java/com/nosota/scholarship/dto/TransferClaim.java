package com.nosota.scholarship.dto;

import com.nosota.scholarship.gateway.TransferInstruction;

import java.math.BigDecimal;

/**
 * A disbursement moved to PROCESSING and the instruction to hand to the gateway.
 */
public record TransferClaim(
        String disbursementId,
        String applicationId,
        BigDecimal amount,
        TransferInstruction instruction
) {
}
