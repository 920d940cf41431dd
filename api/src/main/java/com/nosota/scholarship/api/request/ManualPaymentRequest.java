package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.PaymentComponent;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Set;

/**
 * Confirms a cheque, cash or fee adjustment payment made outside the transfer gateway.
 *
 * @param reference  Cheque number, receipt number or fee ledger reference
 * @param remarks    Finance remarks
 * @param components Components settled by this payment; empty or null pays every unpaid component
 */
public record ManualPaymentRequest(
        @NotBlank(message = "Payment reference is required")
        @Size(max = 50)
        String reference,

        @Size(max = 2000)
        String remarks,

        Set<PaymentComponent> components
) {
}
