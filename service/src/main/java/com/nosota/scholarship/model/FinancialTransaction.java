package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.PaymentComponent;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.GenericGenerator;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Debit recorded when a disbursement, or part of it, is paid.
 *
 * <p>Every payment writes one payment transaction (no component) for the amount it settled
 * and one component transaction per settled component, linked through
 * {@code parentTransactionId}. The payment transactions of a disbursement add up to its amount.
 * Rows are never updated.
 */
@Entity
@Immutable
@Table(name = "financial_transaction", indexes = {
        @Index(name = "idx_financial_transaction_disbursement", columnList = "disbursement_id"),
        @Index(name = "idx_financial_transaction_institute", columnList = "institute_id")
})
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FinancialTransaction {

    public static final String CATEGORY = "SCHOLARSHIP_DISBURSEMENT";

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * External ID, format TXN{yyyyMMdd}{8 hex}.
     */
    @Column(name = "transaction_id", nullable = false, unique = true, updatable = false, length = 20)
    private String transactionId;

    @Column(name = "parent_transaction_id", updatable = false, length = 20)
    private String parentTransactionId;

    @Column(name = "disbursement_id", nullable = false, updatable = false, length = 20)
    private String disbursementId;

    @Column(name = "application_id", nullable = false, updatable = false, length = 20)
    private String applicationId;

    @Column(name = "institute_id", updatable = false)
    private Long instituteId;

    @Enumerated(EnumType.STRING)
    @Column(name = "component", updatable = false, length = 20)
    private PaymentComponent component;

    @Column(name = "category", nullable = false, updatable = false, length = 40)
    private String category;

    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "description", updatable = false, length = 200)
    private String description;

    @Column(name = "payment_reference", updatable = false, length = 50)
    private String paymentReference;

    @Column(name = "processed_by", nullable = false, updatable = false, length = 50)
    private String processedBy;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDateTime transactionDate;

    public boolean isComponentTransaction() {
        return component != null;
    }
}
