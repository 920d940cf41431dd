package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ApplicationStatus;
import com.nosota.scholarship.api.model.DecisionAction;
import com.nosota.scholarship.api.model.DisbursementMethod;
import com.nosota.scholarship.api.model.DisbursementStatus;
import com.nosota.scholarship.api.model.PaymentComponent;
import com.nosota.scholarship.api.model.Stage;
import com.nosota.scholarship.api.request.BankDetailsRequest;
import com.nosota.scholarship.dto.TransferClaim;
import com.nosota.scholarship.error.AlreadyDisbursedException;
import com.nosota.scholarship.error.AlreadyProcessedException;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.error.DisbursementNotFoundException;
import com.nosota.scholarship.error.IncompleteBankDetailsException;
import com.nosota.scholarship.error.NotEligibleException;
import com.nosota.scholarship.event.DisbursementCompletedEvent;
import com.nosota.scholarship.gateway.TransferInstruction;
import com.nosota.scholarship.mapper.DisbursementMapper;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.ComponentPayment;
import com.nosota.scholarship.model.Disbursement;
import com.nosota.scholarship.model.FinancialTransaction;
import com.nosota.scholarship.repository.ApplicationRepository;
import com.nosota.scholarship.repository.DisbursementRepository;
import com.nosota.scholarship.repository.FinancialTransactionRepository;
import com.nosota.scholarship.security.AccessPolicy;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.security.Capability;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Disbursement lifecycle. Every public method is one atomic unit: the owning application row
 * is locked first, then the disbursement row, so all changes to one application are serialized.
 *
 * <p>The gateway call itself is not made here. {@link TransferService} claims a disbursement
 * (PENDING/FAILED → PROCESSING), calls the gateway outside any transaction and then records
 * the outcome with {@link #recordTransferSuccess} or {@link #recordTransferFailure}.
 *
 * <p>Every transfer attempt of a disbursement is submitted with the disbursement ID as
 * idempotency key, so a retry after an unknown outcome cannot pay twice.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class DisbursementService {

    private final DisbursementRepository disbursementRepository;
    private final FinancialTransactionRepository transactionRepository;
    private final PaymentLedgerService paymentLedgerService;
    private final ApplicationRepository applicationRepository;
    private final ApplicationTransitionService transitionService;
    private final DecisionLogService decisionLogService;
    private final AccessPolicy accessPolicy;
    private final IdentifierGenerator identifierGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Creates a PENDING disbursement for a forwarded application. The amount is a snapshot of
     * the approved amount and bank details are copied from the application.
     *
     * @throws AlreadyDisbursedException if a non-cancelled disbursement exists
     * @throws NotEligibleException      unless the application is forwarded and APPROVED or PARTIALLY_APPROVED
     */
    @Transactional
    public Disbursement createDisbursement(@NotBlank String applicationId, @NotNull DisbursementMethod method,
                                           String remarks, @NotNull Actor actor) {
        Application application = lockApplication(applicationId);
        accessPolicy.check(actor, Capability.DISBURSE, application);

        Optional<Disbursement> active = disbursementRepository
                .findFirstByApplicationIdAndStatusNot(applicationId, DisbursementStatus.CANCELLED);
        if (active.isPresent()) {
            throw new AlreadyDisbursedException(String.format(
                    "Application %s already has disbursement %s in status %s",
                    applicationId, active.get().getDisbursementId(), active.get().getStatus()));
        }
        if (!application.getFinanceForward().isForwarded() || !isApproved(application.getStatus())
                || application.getApprovedAmount() == null) {
            throw new NotEligibleException(String.format(
                    "Application %s is not eligible for disbursement (status: %s, forwarded: %s)",
                    applicationId, application.getStatus(), application.getFinanceForward().isForwarded()));
        }

        LocalDateTime now = Timestamps.now(clock);
        Disbursement disbursement = new Disbursement();
        disbursement.setDisbursementId(nextDisbursementId());
        disbursement.setApplicationId(applicationId);
        disbursement.setAmount(application.getApprovedAmount());
        disbursement.setMethod(method);
        disbursement.setStatus(DisbursementStatus.PENDING);
        disbursement.setBankAccountNumber(application.getBankAccountNumber());
        disbursement.setBankIfsc(application.getBankIfsc());
        disbursement.setRemarks(remarks);
        disbursement.setAttemptCount(0);
        disbursement.setComponents(PaymentLedgerService.split(disbursement.getAmount()));
        disbursement.setCreatedBy(actor.id());
        disbursement.setCreatedAt(now);
        disbursement.setUpdatedAt(now);
        disbursement = disbursementRepository.save(disbursement);

        appendLog(application, DecisionAction.DISBURSEMENT_CREATED, actor.id(), remarks,
                disbursement.getDisbursementId(), now);

        log.info("Disbursement {} created for application {}: amount={}, method={}",
                disbursement.getDisbursementId(), applicationId, disbursement.getAmount(), method);
        return disbursement;
    }

    /**
     * Moves a disbursement to PROCESSING before its transfer is submitted.
     *
     * @param retry false for a first transfer (PENDING only), true for a manual retry (FAILED only)
     * @throws IncompleteBankDetailsException if the account number or IFSC is missing; nothing changes
     */
    @Transactional
    public TransferClaim claimForTransfer(@NotBlank String disbursementId, String batchId, boolean retry,
                                          @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);

        if (!disbursement.getMethod().usesTransferGateway()) {
            throw new NotEligibleException(String.format(
                    "Disbursement %s uses %s and is settled by recording a manual payment",
                    disbursementId, disbursement.getMethod()));
        }
        DisbursementStatus expected = retry ? DisbursementStatus.FAILED : DisbursementStatus.PENDING;
        if (disbursement.getStatus() != expected) {
            throw wrongStatus(disbursement, expected);
        }
        if (!disbursement.hasBankDetails()) {
            throw new IncompleteBankDetailsException(String.format(
                    "Disbursement %s has no %s", disbursementId,
                    isBlank(disbursement.getBankAccountNumber()) ? "bank account number" : "IFSC code"));
        }

        disbursement.setStatus(DisbursementStatus.PROCESSING);
        disbursement.setAttemptCount(disbursement.getAttemptCount() + 1);
        disbursement.setBatchId(batchId);
        disbursement.setFailureReason(null);
        disbursement.setUpdatedAt(Timestamps.now(clock));

        log.info("Disbursement {} claimed for transfer (batch={}, attempt={})",
                disbursementId, batchId, disbursement.getAttemptCount());

        TransferInstruction instruction = new TransferInstruction(disbursement.getBankAccountNumber(),
                disbursement.getBankIfsc(), disbursement.getAmount(), disbursementId);
        return new TransferClaim(disbursementId, disbursement.getApplicationId(), disbursement.getAmount(),
                instruction);
    }

    /**
     * Records a confirmed transfer: every component is paid, the disbursement becomes DISBURSED
     * and the application moves to DISBURSED.
     */
    @Transactional
    public Disbursement recordTransferSuccess(@NotBlank String disbursementId, @NotBlank String reference,
                                              @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);
        if (disbursement.getStatus() != DisbursementStatus.PROCESSING) {
            throw wrongStatus(disbursement, DisbursementStatus.PROCESSING);
        }
        Application application = lockApplication(disbursement.getApplicationId());
        LocalDateTime now = Timestamps.now(clock);
        paymentLedgerService.pay(disbursement, application, null, reference, actor.id(), now);
        return settle(disbursement, application, reference, DecisionAction.TRANSFER_SUCCEEDED, null, actor, now);
    }

    /**
     * Records a failed transfer. The application is left unchanged; only a manual retry
     * submits the transfer again.
     */
    @Transactional
    public Disbursement recordTransferFailure(@NotBlank String disbursementId, String reason, @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);
        if (disbursement.getStatus() != DisbursementStatus.PROCESSING) {
            throw wrongStatus(disbursement, DisbursementStatus.PROCESSING);
        }

        LocalDateTime now = Timestamps.now(clock);
        disbursement.setStatus(DisbursementStatus.FAILED);
        disbursement.setFailureReason(reason);
        disbursement.setUpdatedAt(now);

        Application application = lockApplication(disbursement.getApplicationId());
        appendLog(application, DecisionAction.TRANSFER_FAILED, actor.id(), reason, disbursementId, now);

        log.error("Transfer of disbursement {} failed (attempt {}): {}",
                disbursementId, disbursement.getAttemptCount(), reason);
        return disbursement;
    }

    /**
     * Replaces the bank details of a PENDING or FAILED disbursement.
     */
    @Transactional
    public Disbursement updateBankDetails(@NotBlank String disbursementId, @Valid @NotNull BankDetailsRequest request,
                                          @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);
        requireOpen(disbursement, "update bank details of");

        LocalDateTime now = Timestamps.now(clock);
        disbursement.setBankAccountNumber(request.accountNumber());
        disbursement.setBankIfsc(request.ifsc());
        disbursement.setUpdatedAt(now);

        Application application = lockApplication(disbursement.getApplicationId());
        appendLog(application, DecisionAction.BANK_DETAILS_UPDATED, actor.id(),
                "Bank account " + DisbursementMapper.INSTANCE.maskAccount(request.accountNumber()) + ", IFSC " + request.ifsc(), disbursementId, now);

        log.info("Bank details of disbursement {} updated by {}", disbursementId, actor.id());
        return disbursement;
    }

    /**
     * Cancels a PENDING or FAILED disbursement so a new one can be created for the application.
     */
    @Transactional
    public Disbursement cancel(@NotBlank String disbursementId, @NotBlank String remarks, @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);
        requireOpen(disbursement, "cancel");
        if (disbursement.isPartiallyPaid()) {
            throw new NotEligibleException(String.format(
                    "Disbursement %s has paid components and cannot be cancelled", disbursementId));
        }

        LocalDateTime now = Timestamps.now(clock);
        disbursement.setStatus(DisbursementStatus.CANCELLED);
        disbursement.setRemarks(remarks);
        disbursement.setUpdatedAt(now);

        Application application = lockApplication(disbursement.getApplicationId());
        appendLog(application, DecisionAction.DISBURSEMENT_CANCELLED, actor.id(), remarks, disbursementId, now);

        log.info("Disbursement {} cancelled by {}", disbursementId, actor.id());
        return disbursement;
    }

    /**
     * Confirms a cheque, cash or fee adjustment payment of every unpaid component.
     */
    @Transactional
    public Disbursement recordManualPayment(@NotBlank String disbursementId, @NotBlank String reference,
                                            String remarks, @NotNull Actor actor) {
        return recordManualPayment(disbursementId, reference, remarks, null, actor);
    }

    /**
     * Confirms a cheque, cash or fee adjustment payment of a PENDING disbursement. Each call
     * writes its financial transactions; the disbursement and the application become DISBURSED
     * once the last component is paid.
     *
     * @param components components settled by this payment; null or empty pays every unpaid one
     */
    @Transactional
    public Disbursement recordManualPayment(@NotBlank String disbursementId, @NotBlank String reference,
                                            String remarks, Set<PaymentComponent> components,
                                            @NotNull Actor actor) {
        Disbursement disbursement = lockDisbursement(disbursementId, actor);
        if (disbursement.getMethod().usesTransferGateway()) {
            throw new NotEligibleException(String.format(
                    "Disbursement %s is a bank transfer and is settled through the transfer gateway", disbursementId));
        }
        if (disbursement.getStatus() != DisbursementStatus.PENDING) {
            throw wrongStatus(disbursement, DisbursementStatus.PENDING);
        }
        if (remarks != null) {
            disbursement.setRemarks(remarks);
        }

        Application application = lockApplication(disbursement.getApplicationId());
        LocalDateTime now = Timestamps.now(clock);
        FinancialTransaction payment = paymentLedgerService.pay(disbursement, application, components, reference,
                actor.id(), now);

        if (disbursement.isFullyPaid()) {
            return settle(disbursement, application, reference, DecisionAction.MANUAL_PAYMENT_RECORDED, remarks,
                    actor, now);
        }

        disbursement.setUpdatedAt(now);
        String paid = disbursement.getComponents().stream()
                .filter(ComponentPayment::isPaid)
                .map(component -> component.getComponent().name())
                .collect(Collectors.joining(", "));
        appendLog(application, DecisionAction.COMPONENT_PAYMENT_RECORDED, actor.id(),
                "Paid " + paid + (remarks != null ? ": " + remarks : ""), payment.getTransactionId(), now);

        log.info("Disbursement {} partially paid by {}: {} of {} (paid components: {})",
                disbursementId, actor.id(), payment.getAmount(), disbursement.getAmount(), paid);
        return disbursement;
    }

    /**
     * Closes a DISBURSED application.
     */
    @Transactional
    public Application completeApplication(@NotBlank String applicationId, @NotNull Actor actor) {
        Application application = lockApplication(applicationId);
        accessPolicy.check(actor, Capability.DISBURSE, application);

        transitionService.transition(application, ApplicationStatus.COMPLETED, Stage.FINANCE,
                DecisionAction.COMPLETE, actor.id(), null);

        log.info("Application {} completed by {}", applicationId, actor.id());
        return application;
    }

    @Transactional
    public Disbursement getDisbursement(@NotBlank String disbursementId) {
        return disbursementRepository.findByDisbursementId(disbursementId)
                .orElseThrow(() -> new DisbursementNotFoundException("Disbursement not found: " + disbursementId));
    }

    /**
     * @return financial transactions of the disbursement, each payment followed by its components
     */
    @Transactional
    public List<FinancialTransaction> getTransactions(@NotBlank String disbursementId) {
        getDisbursement(disbursementId);
        return transactionRepository.findByDisbursementIdInRecordingOrder(disbursementId);
    }

    /**
     * @return the non-cancelled disbursement of the application
     */
    @Transactional
    public Disbursement getActiveDisbursement(@NotBlank String applicationId) {
        if (!applicationRepository.existsByApplicationId(applicationId)) {
            throw new ApplicationNotFoundException(applicationId);
        }
        return disbursementRepository.findFirstByApplicationIdAndStatusNot(applicationId, DisbursementStatus.CANCELLED)
                .orElseThrow(() -> new DisbursementNotFoundException(
                        "No active disbursement for application " + applicationId));
    }

    private Disbursement settle(Disbursement disbursement, Application application, String reference,
                                DecisionAction action, String remarks, Actor actor, LocalDateTime now) {
        disbursement.setStatus(DisbursementStatus.DISBURSED);
        disbursement.setTransactionReference(reference);
        disbursement.setFailureReason(null);
        disbursement.setDisbursedAt(now);
        disbursement.setUpdatedAt(now);

        transitionService.transition(application, ApplicationStatus.DISBURSED, Stage.FINANCE, action,
                actor.id(), remarks, reference);

        eventPublisher.publishEvent(new DisbursementCompletedEvent(disbursement.getDisbursementId(),
                disbursement.getApplicationId(), disbursement.getAmount(), disbursement.getMethod(),
                reference, now));

        log.info("Disbursement {} completed: application={}, amount={}, reference={}",
                disbursement.getDisbursementId(), disbursement.getApplicationId(), disbursement.getAmount(), reference);
        return disbursement;
    }

    /**
     * Locks the owning application before the disbursement so lock order matches creation.
     * The disbursement is first loaded by the locking query, so its state is the committed one.
     */
    private Disbursement lockDisbursement(String disbursementId, Actor actor) {
        String applicationId = disbursementRepository.findApplicationIdByDisbursementId(disbursementId)
                .orElseThrow(() -> new DisbursementNotFoundException("Disbursement not found: " + disbursementId));
        Application application = lockApplication(applicationId);
        accessPolicy.check(actor, Capability.DISBURSE, application);

        return disbursementRepository.findByDisbursementIdForUpdate(disbursementId)
                .orElseThrow(() -> new DisbursementNotFoundException("Disbursement not found: " + disbursementId));
    }

    private Application lockApplication(String applicationId) {
        return applicationRepository.findByApplicationIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    private void appendLog(Application application, DecisionAction action, String actorId, String remarks,
                           String reference, LocalDateTime now) {
        decisionLogService.append(application, DecisionLogService.entry(Stage.FINANCE, action)
                .actorId(actorId)
                .remarks(remarks)
                .amountSnapshot(application.getApprovedAmount())
                .reference(reference)
                .createdAt(now));
        application.setUpdatedAt(now);
    }

    private void requireOpen(Disbursement disbursement, String operation) {
        DisbursementStatus status = disbursement.getStatus();
        if (status == DisbursementStatus.PENDING || status == DisbursementStatus.FAILED) {
            return;
        }
        if (status.isFinal()) {
            throw new AlreadyProcessedException(String.format("Cannot %s disbursement %s: already %s",
                    operation, disbursement.getDisbursementId(), status));
        }
        throw new NotEligibleException(String.format("Cannot %s disbursement %s while it is %s",
                operation, disbursement.getDisbursementId(), status));
    }

    private static RuntimeException wrongStatus(Disbursement disbursement, DisbursementStatus expected) {
        DisbursementStatus status = disbursement.getStatus();
        if (status.isFinal() || status == DisbursementStatus.PROCESSING) {
            return new AlreadyProcessedException(String.format("Disbursement %s is already %s",
                    disbursement.getDisbursementId(), status));
        }
        return new NotEligibleException(String.format("Disbursement %s is %s, expected %s",
                disbursement.getDisbursementId(), status, expected));
    }

    private String nextDisbursementId() {
        String id = identifierGenerator.nextDisbursementId();
        while (disbursementRepository.findByDisbursementId(id).isPresent()) {
            id = identifierGenerator.nextDisbursementId();
        }
        return id;
    }

    private static boolean isApproved(ApplicationStatus status) {
        return status == ApplicationStatus.APPROVED || status == ApplicationStatus.PARTIALLY_APPROVED;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
