package com.nosota.scholarship.tests;

import com.nosota.scholarship.TestBase;
import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;
import com.nosota.scholarship.api.model.PaymentComponent;
import com.nosota.scholarship.api.request.DisbursementRequest;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.error.NotEligibleException;
import com.nosota.scholarship.model.ComponentPayment;
import com.nosota.scholarship.model.DecisionLogEntry;
import com.nosota.scholarship.model.Disbursement;
import com.nosota.scholarship.model.FinancialTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for payment components and financial transactions.
 *
 * <ul>
 *   <li>PAY-001: Component split of a new disbursement</li>
 *   <li>PAY-002: Partial manual payment</li>
 *   <li>PAY-003: Paying a component twice</li>
 *   <li>PAY-004: Cancelling a partially paid disbursement</li>
 *   <li>PAY-005: Remaining components settle the disbursement</li>
 *   <li>PAY-006: Bank transfer pays every component at once</li>
 * </ul>
 */
@DisplayName("13. Payment Ledger Tests")
public class PaymentLedgerTest extends TestBase {

    @Test
    @DisplayName("PAY-001: New disbursement is split 70/25/5 into unpaid components")
    void testSplit() {
        // Arrange
        String applicationId = forwarded("8000.00");

        // Act
        Disbursement disbursement = disbursementService.createDisbursement(applicationId,
                DisbursementMethod.CHEQUE, null, financeAdmin());

        // Assert
        List<ComponentPayment> components = disbursementService.getDisbursement(disbursement.getDisbursementId())
                .getComponents();
        assertThat(components).extracting(ComponentPayment::getComponent).containsExactly(
                PaymentComponent.TUITION, PaymentComponent.MAINTENANCE, PaymentComponent.BOOKS);
        assertThat(components).extracting(ComponentPayment::getAmount).usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("5600.00"), new BigDecimal("2000.00"), new BigDecimal("400.00"));
        assertThat(components).noneMatch(ComponentPayment::isPaid);
        assertThat(disbursementService.getTransactions(disbursement.getDisbursementId())).isEmpty();
    }

    @Test
    @DisplayName("PAY-002: Paying tuition only keeps the disbursement PENDING")
    void testPartialPayment() {
        // Arrange
        String applicationId = forwarded("8000.00");
        String disbursementId = chequeDisbursement(applicationId);

        // Act
        Disbursement disbursement = disbursementService.recordManualPayment(disbursementId, "CHQ1001", "First term",
                Set.of(PaymentComponent.TUITION), financeAdmin());

        // Assert
        assertThat(disbursement.getStatus()).isEqualTo(DisbursementStatus.PENDING);
        assertThat(disbursement.isPartiallyPaid()).isTrue();
        assertThat(reload(applicationId).getStatus()).isEqualTo(ApplicationStatus.APPROVED);

        List<FinancialTransaction> transactions = disbursementService.getTransactions(disbursementId);
        assertThat(transactions).hasSize(2);
        FinancialTransaction payment = transactions.get(0);
        assertThat(payment.isComponentTransaction()).isFalse();
        assertThat(payment.getTransactionId()).startsWith("TXN");
        assertThat(payment.getAmount()).isEqualByComparingTo("5600.00");
        assertThat(payment.getPaymentReference()).isEqualTo("CHQ1001");
        assertThat(payment.getInstituteId()).isEqualTo(INSTITUTE_ID);
        assertThat(transactions.get(1).getComponent()).isEqualTo(PaymentComponent.TUITION);
        assertThat(transactions.get(1).getParentTransactionId()).isEqualTo(payment.getTransactionId());

        DecisionLogEntry last = lastEntry(applicationId);
        assertThat(last.getAction()).isEqualTo(DecisionAction.COMPONENT_PAYMENT_RECORDED);
        assertThat(last.getReference()).isEqualTo(payment.getTransactionId());
        assertThat(last.getRemarks()).isEqualTo("Paid TUITION: First term");
        assertThat(last.changedStatus()).isFalse();
    }

    @Test
    @DisplayName("PAY-003: Paying an already paid component is ALREADY_PROCESSED")
    void testComponentPaidTwice() {
        // Arrange
        String applicationId = forwarded("8000.00");
        String disbursementId = chequeDisbursement(applicationId);
        disbursementService.recordManualPayment(disbursementId, "CHQ1001", null,
                Set.of(PaymentComponent.TUITION), financeAdmin());

        // Act & Assert
        assertThatThrownBy(() -> disbursementService.recordManualPayment(disbursementId, "CHQ1002", null,
                EnumSet.of(PaymentComponent.TUITION, PaymentComponent.BOOKS), financeAdmin()))
                .isInstanceOf(AlreadyProcessedException.class);

        assertThat(disbursementService.getTransactions(disbursementId)).hasSize(2);
        assertThat(disbursementService.getDisbursement(disbursementId).getComponents())
                .filteredOn(ComponentPayment::isPaid)
                .extracting(ComponentPayment::getComponent)
                .containsExactly(PaymentComponent.TUITION);
    }

    @Test
    @DisplayName("PAY-004: Partially paid disbursement cannot be cancelled")
    void testCancelPartiallyPaid() {
        // Arrange
        String applicationId = forwarded("8000.00");
        String disbursementId = chequeDisbursement(applicationId);
        disbursementService.recordManualPayment(disbursementId, "CHQ1001", null,
                Set.of(PaymentComponent.MAINTENANCE), financeAdmin());

        // Act & Assert
        assertThatThrownBy(() -> disbursementService.cancel(disbursementId, "Wrong method", financeAdmin()))
                .isInstanceOf(NotEligibleException.class);

        assertThat(disbursementService.getDisbursement(disbursementId).getStatus())
                .isEqualTo(DisbursementStatus.PENDING);
    }

    @Test
    @DisplayName("PAY-005: Paying the remaining components settles the disbursement")
    void testRemainingComponentsSettle() {
        // Arrange
        String applicationId = forwarded("8000.00");
        String disbursementId = chequeDisbursement(applicationId);
        disbursementService.recordManualPayment(disbursementId, "CHQ1001", null,
                Set.of(PaymentComponent.TUITION), financeAdmin());
        clock.advance(Duration.ofDays(30));

        // Act
        Disbursement disbursement = disbursementService.recordManualPayment(disbursementId, "CHQ1002",
                "Second term", null, financeAdmin());

        // Assert
        assertThat(disbursement.getStatus()).isEqualTo(DisbursementStatus.DISBURSED);
        assertThat(disbursement.isFullyPaid()).isTrue();
        assertThat(reload(applicationId).getStatus()).isEqualTo(ApplicationStatus.DISBURSED);
        assertThat(lastEntry(applicationId).getAction()).isEqualTo(DecisionAction.MANUAL_PAYMENT_RECORDED);

        List<FinancialTransaction> transactions = disbursementService.getTransactions(disbursementId);
        assertThat(transactions).hasSize(5);
        List<FinancialTransaction> payments = transactions.stream()
                .filter(transaction -> !transaction.isComponentTransaction())
                .toList();
        assertThat(payments).extracting(FinancialTransaction::getPaymentReference)
                .containsExactly("CHQ1001", "CHQ1002");
        assertThat(payments.stream().map(FinancialTransaction::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add))
                .isEqualByComparingTo("8000.00");
        assertThat(transactions.get(2).getTransactionId()).isEqualTo(payments.get(1).getTransactionId());
        assertThat(transactions.subList(3, 5)).extracting(FinancialTransaction::getComponent)
                .containsExactlyInAnyOrder(PaymentComponent.MAINTENANCE, PaymentComponent.BOOKS);
    }

    @Test
    @DisplayName("PAY-006: Successful bank transfer writes one payment and three component transactions")
    void testBankTransferLedger() {
        // Arrange
        String applicationId = forwarded("10000.00");

        // Act
        transferService.createAndTransfer(
                new DisbursementRequest(List.of(applicationId), DisbursementMethod.BANK_TRANSFER, null),
                financeAdmin());

        // Assert
        Disbursement disbursement = disbursementService.getActiveDisbursement(applicationId);
        assertThat(disbursement.getStatus()).isEqualTo(DisbursementStatus.DISBURSED);
        assertThat(disbursement.getComponents()).allMatch(ComponentPayment::isPaid)
                .extracting(ComponentPayment::getPaymentReference)
                .containsOnly(disbursement.getTransactionReference());

        List<FinancialTransaction> transactions = disbursementService.getTransactions(disbursement.getDisbursementId());
        assertThat(transactions).hasSize(4);
        FinancialTransaction payment = transactions.get(0);
        assertThat(payment.getParentTransactionId()).isNull();
        assertThat(payment.getAmount()).isEqualByComparingTo("10000.00");
        assertThat(payment.getCategory()).isEqualTo(FinancialTransaction.CATEGORY);
        assertThat(transactions.subList(1, 4))
                .allMatch(transaction -> payment.getTransactionId().equals(transaction.getParentTransactionId()))
                .extracting(FinancialTransaction::getComponent)
                .containsExactlyInAnyOrder(PaymentComponent.TUITION, PaymentComponent.MAINTENANCE,
                        PaymentComponent.BOOKS);
    }

    private String chequeDisbursement(String applicationId) {
        return disbursementService.createDisbursement(applicationId, DisbursementMethod.CHEQUE, null,
                financeAdmin()).getDisbursementId();
    }

    private DecisionLogEntry lastEntry(String applicationId) {
        List<DecisionLogEntry> history = decisionLogService.getHistory(applicationId);
        return history.get(history.size() - 1);
    }
}
