package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.Priority;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Record of an application being forwarded to finance by the department.
 * Set once; a second forward is rejected.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class FinanceForward {

    @Column(name = "finance_forwarded", nullable = false)
    private boolean forwarded;

    @Column(name = "finance_forwarded_by", length = 50)
    private String actorId;

    @Column(name = "finance_forward_remarks", length = 2000)
    private String remarks;

    @Enumerated(EnumType.STRING)
    @Column(name = "finance_priority", length = 10)
    private Priority priority;

    @Column(name = "finance_batch_id", length = 30)
    private String batchId;

    @Column(name = "finance_forwarded_at")
    private LocalDateTime forwardedAt;

    public static FinanceForward notForwarded() {
        return new FinanceForward(false, null, null, null, null, null);
    }
}
