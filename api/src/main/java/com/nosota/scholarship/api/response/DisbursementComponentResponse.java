package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.PaymentComponent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment state of one component of a disbursement.
 *
 * @param component        Component
 * @param amount           Share of the disbursement amount
 * @param paid             Whether the component has been paid
 * @param paidAt           Payment timestamp (null while unpaid)
 * @param paymentReference Reference of the payment that settled it
 */
public record DisbursementComponentResponse(
        PaymentComponent component,
        BigDecimal amount,
        boolean paid,
        LocalDateTime paidAt,
        String paymentReference
) {
}
