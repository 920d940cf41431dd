package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.DecisionOutcome;
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
 * Decision of one review stage (institute or department) on an application.
 *
 * <p>Embedded twice in {@link Application}; column names come from the
 * {@code @AttributeOverrides} there.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@EqualsAndHashCode
public class StageDecision {

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    private DecisionOutcome outcome = DecisionOutcome.PENDING;

    @Column(name = "actor_id", length = 50)
    private String actorId;

    @Column(name = "remarks", length = 2000)
    private String remarks;

    @Column(name = "decided_at")
    private LocalDateTime decidedAt;

    public static StageDecision pending() {
        return new StageDecision(DecisionOutcome.PENDING, null, null, null);
    }

    public boolean isDecided() {
        return outcome != null && outcome.isDecided();
    }

    public boolean isApproved() {
        return outcome == DecisionOutcome.APPROVED;
    }
}
