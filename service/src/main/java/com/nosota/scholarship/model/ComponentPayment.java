package com.nosota.scholarship.model;

import com.nosota.scholarship.api.model.PaymentComponent;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment state of one component of a {@link Disbursement}.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ComponentPayment {

    @Enumerated(EnumType.STRING)
    @Column(name = "component", nullable = false, length = 20)
    private PaymentComponent component;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "paid", nullable = false)
    private boolean paid;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    @Column(name = "payment_reference", length = 50)
    private String paymentReference;

    public static ComponentPayment unpaid(PaymentComponent component, BigDecimal amount) {
        return new ComponentPayment(component, amount, false, null, null);
    }
}
