package com.nosota.scholarship.gateway;

import java.math.BigDecimal;

/**
 * One bank transfer to execute.
 *
 * @param accountNumber  Beneficiary account number
 * @param routingCode    Beneficiary bank routing (IFSC) code
 * @param amount         Amount to transfer
 * @param idempotencyKey Key the gateway uses to recognise a repeated submission; the same for every attempt of a disbursement
 */
public record TransferInstruction(
        String accountNumber,
        String routingCode,
        BigDecimal amount,
        String idempotencyKey
) {
}
