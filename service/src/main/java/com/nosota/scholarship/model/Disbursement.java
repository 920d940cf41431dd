package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;
import org.hibernate.annotations.GenericGenerator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Disbursement entity - the payment record of an approved application.
 *
 * <p>Lifecycle:
 * <pre>
 * PENDING → PROCESSING → DISBURSED
 *                      → FAILED → PROCESSING (manual retry)
 * PENDING / FAILED → CANCELLED
 * </pre>
 *
 * <p>At most one non-cancelled disbursement exists per application, enforced by the partial
 * unique index {@code uk_disbursement_active_application} (see {@code schema.sql}). DISBURSED and
 * CANCELLED are final.
 *
 * <p>The amount is split into tuition, maintenance and books components that are paid
 * separately; a transfer pays all of them at once.
 */
@Entity
@Table(name = "disbursement", indexes = {
        @Index(name = "idx_disbursement_application", columnList = "application_id"),
        @Index(name = "idx_disbursement_batch", columnList = "batch_id")
})
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class Disbursement {

    @Id
    @GeneratedValue(generator = "UUID")
    @GenericGenerator(
            name = "UUID",
            strategy = "org.hibernate.id.UUIDGenerator"
    )
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * External ID, format DISB{yyyyMMdd}{8 hex}.
     */
    @Column(name = "disbursement_id", nullable = false, unique = true, updatable = false, length = 20)
    private String disbursementId;

    @Column(name = "application_id", nullable = false, updatable = false, length = 20)
    private String applicationId;

    /**
     * Snapshot of the application's approved amount at creation.
     */
    @Column(name = "amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 20)
    private DisbursementMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private DisbursementStatus status;

    @Column(name = "bank_account_number", length = 20)
    private String bankAccountNumber;

    @Column(name = "bank_ifsc", length = 11)
    private String bankIfsc;

    /**
     * Gateway or manual payment reference. Set only on success.
     */
    @Column(name = "transaction_reference", length = 50)
    private String transactionReference;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "batch_id", length = 30)
    private String batchId;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @ElementCollection(fetch = FetchType.EAGER)
    @Fetch(FetchMode.SELECT)
    @CollectionTable(name = "disbursement_component", joinColumns = @JoinColumn(name = "disbursement_ref"))
    @OrderColumn(name = "position")
    private List<ComponentPayment> components = new ArrayList<>();

    @Column(name = "created_by", length = 50)
    private String createdBy;

    @Column(name = "disbursed_at")
    private LocalDateTime disbursedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isFullyPaid() {
        return !components.isEmpty() && components.stream().allMatch(ComponentPayment::isPaid);
    }

    public boolean isPartiallyPaid() {
        return components.stream().anyMatch(ComponentPayment::isPaid);
    }

    public boolean hasBankDetails() {
        return bankAccountNumber != null && !bankAccountNumber.isBlank()
                && bankIfsc != null && !bankIfsc.isBlank();
    }
}
