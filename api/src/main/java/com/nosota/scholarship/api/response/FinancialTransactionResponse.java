package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.PaymentComponent;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Response DTO for a financial transaction recorded when a disbursement is paid.
 *
 * @param transactionId       Transaction ID (TXN...)
 * @param parentTransactionId Payment transaction a component transaction belongs to (null for the payment itself)
 * @param disbursementId      Paid disbursement
 * @param applicationId       Owning application
 * @param instituteId         Institute of the student
 * @param component           Paid component (null for the payment transaction)
 * @param amount              Amount debited
 * @param description         Description
 * @param paymentReference    Bank, cheque or receipt reference
 * @param processedBy         Finance staff ID
 * @param transactionDate     Timestamp
 */
public record FinancialTransactionResponse(
        String transactionId,
        String parentTransactionId,
        String disbursementId,
        String applicationId,
        Long instituteId,
        PaymentComponent component,
        BigDecimal amount,
        String description,
        String paymentReference,
        String processedBy,
        LocalDateTime transactionDate
) {
}
