package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.PaymentComponent;
import com.nosota.scholarship.api.response.AmountBreakdown;
import com.nosota.scholarship.calculation.AmountCalculationEngine;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.ComponentPayment;
import com.nosota.scholarship.model.Disbursement;
import com.nosota.scholarship.model.FinancialTransaction;
import com.nosota.scholarship.repository.FinancialTransactionRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Component split and financial transactions of disbursements.
 *
 * <p>Runs inside the caller's transaction, after the caller has locked the application and
 * the disbursement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedgerService {

    private final FinancialTransactionRepository transactionRepository;
    private final IdentifierGenerator identifierGenerator;

    /**
     * Splits an amount into unpaid tuition, maintenance and books components.
     */
    public static List<ComponentPayment> split(BigDecimal amount) {
        AmountBreakdown breakdown = AmountCalculationEngine.breakdown(amount);
        List<ComponentPayment> components = new ArrayList<>();
        components.add(ComponentPayment.unpaid(PaymentComponent.TUITION, breakdown.tuition()));
        components.add(ComponentPayment.unpaid(PaymentComponent.MAINTENANCE, breakdown.maintenance()));
        components.add(ComponentPayment.unpaid(PaymentComponent.BOOKS, breakdown.books()));
        return components;
    }

    /**
     * Marks components paid and writes the payment transaction plus one transaction per
     * component.
     *
     * @param requested components to pay; null or empty pays every unpaid component
     * @return the payment transaction
     * @throws AlreadyProcessedException if a requested component is already paid, or nothing is left to pay
     */
    @Transactional(Transactional.TxType.MANDATORY)
    public FinancialTransaction pay(Disbursement disbursement, Application application,
                                    Set<PaymentComponent> requested, String reference, String actorId,
                                    LocalDateTime now) {
        List<ComponentPayment> toPay = select(disbursement, requested);

        BigDecimal total = toPay.stream().map(ComponentPayment::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        FinancialTransaction payment = transactionRepository.save(FinancialTransaction.builder()
                .transactionId(nextTransactionId())
                .disbursementId(disbursement.getDisbursementId())
                .applicationId(disbursement.getApplicationId())
                .instituteId(application.getInstituteId())
                .category(FinancialTransaction.CATEGORY)
                .amount(total)
                .description("Scholarship payment - " + disbursement.getDisbursementId())
                .paymentReference(reference)
                .processedBy(actorId)
                .transactionDate(now)
                .build());

        for (ComponentPayment component : toPay) {
            component.setPaid(true);
            component.setPaidAt(now);
            component.setPaymentReference(reference);

            transactionRepository.save(FinancialTransaction.builder()
                    .transactionId(nextTransactionId())
                    .parentTransactionId(payment.getTransactionId())
                    .disbursementId(disbursement.getDisbursementId())
                    .applicationId(disbursement.getApplicationId())
                    .instituteId(application.getInstituteId())
                    .component(component.getComponent())
                    .category(FinancialTransaction.CATEGORY)
                    .amount(component.getAmount())
                    .description("Scholarship " + component.getComponent().name().toLowerCase(Locale.ROOT)
                            + " payment - " + disbursement.getDisbursementId())
                    .paymentReference(reference)
                    .processedBy(actorId)
                    .transactionDate(now)
                    .build());
        }

        log.info("Payment {} of disbursement {} recorded: amount={}, components={}",
                payment.getTransactionId(), disbursement.getDisbursementId(), total,
                toPay.stream().map(ComponentPayment::getComponent).toList());
        return payment;
    }

    private static List<ComponentPayment> select(Disbursement disbursement, Set<PaymentComponent> requested) {
        Set<PaymentComponent> wanted = requested == null || requested.isEmpty()
                ? EnumSet.allOf(PaymentComponent.class)
                : EnumSet.copyOf(requested);
        boolean explicit = requested != null && !requested.isEmpty();

        List<ComponentPayment> toPay = new ArrayList<>();
        for (ComponentPayment component : disbursement.getComponents()) {
            if (!wanted.contains(component.getComponent())) {
                continue;
            }
            if (component.isPaid()) {
                if (explicit) {
                    throw new AlreadyProcessedException(String.format("Component %s of disbursement %s is already paid",
                            component.getComponent(), disbursement.getDisbursementId()));
                }
                continue;
            }
            toPay.add(component);
        }
        if (toPay.isEmpty()) {
            throw new AlreadyProcessedException(String.format("Disbursement %s has no unpaid components",
                    disbursement.getDisbursementId()));
        }
        return toPay;
    }

    private String nextTransactionId() {
        String id = identifierGenerator.nextTransactionId();
        while (transactionRepository.existsByTransactionId(id)) {
            id = identifierGenerator.nextTransactionId();
        }
        return id;
    }
}
