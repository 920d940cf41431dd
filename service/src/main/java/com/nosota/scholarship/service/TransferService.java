package com.nosota.scholarship.service;

import com.nosota.scholarship.api.request.DisbursementRequest;
import com.nosota.scholarship.api.request.TransferRequest;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.dto.TransferClaim;
import com.nosota.scholarship.gateway.FundsTransferGateway;
import com.nosota.scholarship.gateway.TransferOutcome;
import com.nosota.scholarship.model.Disbursement;
import com.nosota.scholarship.security.AccessPolicy;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.security.Capability;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;

/**
 * Executes disbursements as DBT batches.
 *
 * <p>Each transfer is three steps: claim (commit PROCESSING), gateway call outside any
 * transaction, record the outcome (commit DISBURSED or FAILED). Transfers are never retried
 * automatically. Every attempt of a disbursement carries the same idempotency key, so a manual
 * retry after an unknown outcome is answered by the bank with the original result. If recording a
 * success fails after the gateway accepted the transfer, the disbursement stays PROCESSING and must
 * be reconciled by finance before anything else happens.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    static final String TRANSFER_FAILED = "TRANSFER_FAILED";

    private final DisbursementService disbursementService;
    private final FundsTransferGateway gateway;
    private final AccessPolicy accessPolicy;
    private final IdentifierGenerator identifierGenerator;
    private final Clock clock;

    /**
     * Creates one disbursement per application. Bank transfers are executed at once; other methods
     * stay PENDING until a manual payment is recorded. Items are keyed by application ID.
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public BatchResult createAndTransfer(@Valid @NotNull DisbursementRequest request, @NotNull Actor actor) {
        accessPolicy.check(actor, Capability.DISBURSE);

        boolean transfers = request.method().usesTransferGateway();
        String batchId = transfers ? identifierGenerator.nextTransferBatchId() : null;
        log.info("Creating {} {} disbursements by {} (batch={})",
                request.applicationIds().size(), request.method(), actor.id(), batchId);
        BatchCollector batch = new BatchCollector(batchId, transfers);

        for (String applicationId : request.applicationIds()) {
            Disbursement disbursement;
            try {
                disbursement = disbursementService.createDisbursement(applicationId, request.method(),
                        request.remarks(), actor);
            } catch (RuntimeException e) {
                batch.failure(applicationId, e);
                continue;
            }

            if (transfers) {
                transfer(batch, applicationId, disbursement.getDisbursementId(), batchId, false, actor);
            } else {
                batch.success(applicationId, "Disbursement created, awaiting manual payment",
                        disbursement.getDisbursementId(), disbursement.getAmount());
            }
        }

        return finish(batch, batchId);
    }

    /**
     * Executes transfers of PENDING disbursements. Items are keyed by disbursement ID.
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public BatchResult executeTransfers(@Valid @NotNull TransferRequest request, @NotNull Actor actor) {
        accessPolicy.check(actor, Capability.DISBURSE);

        String batchId = identifierGenerator.nextTransferBatchId();
        log.info("Executing {} transfers by {} (batch={})", request.disbursementIds().size(), actor.id(), batchId);
        BatchCollector batch = new BatchCollector(batchId, true);

        for (String disbursementId : request.disbursementIds()) {
            transfer(batch, disbursementId, disbursementId, batchId, false, actor);
        }
        return finish(batch, batchId);
    }

    /**
     * Manually retries a FAILED disbursement as a batch of one.
     */
    @Transactional(Transactional.TxType.NOT_SUPPORTED)
    public BatchResult retryTransfer(@NotBlank String disbursementId, @NotNull Actor actor) {
        accessPolicy.check(actor, Capability.DISBURSE);

        String batchId = identifierGenerator.nextTransferBatchId();
        log.info("Retrying transfer of disbursement {} by {} (batch={})", disbursementId, actor.id(), batchId);
        BatchCollector batch = new BatchCollector(batchId, true);

        transfer(batch, disbursementId, disbursementId, batchId, true, actor);
        return finish(batch, batchId);
    }

    private void transfer(BatchCollector batch, String itemId, String disbursementId, String batchId,
                          boolean retry, Actor actor) {
        TransferClaim claim;
        try {
            claim = disbursementService.claimForTransfer(disbursementId, batchId, retry, actor);
        } catch (RuntimeException e) {
            String code = BatchCollector.errorCode(e);
            if (BatchCollector.INTERNAL_ERROR.equals(code)) {
                log.error("Transfer of disbursement {} not started", disbursementId, e);
            } else {
                log.warn("Transfer of disbursement {} not started: {} - {}", disbursementId, code, e.getMessage());
            }
            batch.failure(itemId, code, e.getMessage(), disbursementId);
            return;
        }

        TransferOutcome outcome = callGateway(claim);

        try {
            if (outcome.success()) {
                disbursementService.recordTransferSuccess(disbursementId, outcome.reference(), actor);
                batch.successWithAmount(itemId, "Transferred, reference " + outcome.reference(),
                        disbursementId, claim.amount());
            } else {
                disbursementService.recordTransferFailure(disbursementId, outcome.reason(), actor);
                batch.failure(itemId, TRANSFER_FAILED, outcome.reason(), disbursementId);
            }
        } catch (RuntimeException e) {
            log.error("Outcome of disbursement {} could not be recorded (gateway success={}, reference={}); "
                            + "disbursement left PROCESSING for reconciliation",
                    disbursementId, outcome.success(), outcome.reference(), e);
            batch.failure(itemId, BatchCollector.INTERNAL_ERROR,
                    "Transfer outcome not recorded, reconciliation required: " + e.getMessage(), disbursementId);
        }
    }

    private TransferOutcome callGateway(TransferClaim claim) {
        try {
            TransferOutcome outcome = gateway.transfer(claim.instruction());
            return outcome != null ? outcome : TransferOutcome.failure("Transfer gateway returned no outcome");
        } catch (RuntimeException e) {
            log.error("Transfer gateway threw for disbursement {}", claim.disbursementId(), e);
            return TransferOutcome.failure("Transfer gateway error, outcome unknown: " + e.getMessage());
        }
    }

    private BatchResult finish(BatchCollector batch, String batchId) {
        BatchResult result = batch.finish(Timestamps.now(clock));
        log.info("Disbursement batch {} finished: processed={}, failed={}, total={}",
                batchId, result.processedCount(), result.failedCount(), result.totalAmount());
        return result;
    }
}
