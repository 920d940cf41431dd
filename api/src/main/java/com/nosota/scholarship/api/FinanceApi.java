package com.nosota.scholarship.api;

import com.nosota.scholarship.api.model.StaffRole;
import com.nosota.scholarship.api.request.BankDetailsRequest;
import com.nosota.scholarship.api.request.CalculationRequest;
import com.nosota.scholarship.api.request.CancelDisbursementRequest;
import com.nosota.scholarship.api.request.DisbursementRequest;
import com.nosota.scholarship.api.request.ManualPaymentRequest;
import com.nosota.scholarship.api.request.TransferRequest;
import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.api.response.CalculationResult;
import com.nosota.scholarship.api.response.DisbursementResponse;
import com.nosota.scholarship.api.response.FinancialTransactionResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Finance operations: amount calculation, disbursement creation and funds transfer.
 *
 * <p>Transfers are never retried automatically. A failed disbursement stays FAILED
 * until finance fixes the cause and calls {@link #retryTransfer} or cancels it.
 *
 * <p>Implemented by FinanceController (service module) and {@link FinanceClient}.
 */
@RequestMapping("/api/v1/finance")
public interface FinanceApi {

    // ==================== Calculation ====================

    /**
     * Calculates the scholarship amount for an application. Has no side effects.
     *
     * @param applicationId Application ID
     * @param request       Strategy and optional custom factors
     * @return Calculation result with breakdown and recommendations
     */
    @PostMapping("/applications/{applicationId}/calculate")
    ResponseEntity<CalculationResult> calculateAmount(
            @PathVariable("applicationId") String applicationId,
            @RequestBody @Valid CalculationRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    // ==================== Disbursement ====================

    /**
     * Creates a disbursement per application and executes bank transfers for the
     * BANK_TRANSFER method as one DBT batch.
     *
     * @param request Application IDs, method and remarks
     * @return Per-item outcomes and the total amount transferred
     */
    @PostMapping("/disbursements")
    ResponseEntity<BatchResult> createAndTransferDisbursements(
            @RequestBody @Valid DisbursementRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Executes bank transfers for existing pending disbursements.
     *
     * @param request Disbursement IDs
     * @return Per-item outcomes and the total amount transferred
     */
    @PostMapping("/disbursements/transfer")
    ResponseEntity<BatchResult> executeTransfers(
            @RequestBody @Valid TransferRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    @GetMapping("/disbursements/{disbursementId}")
    ResponseEntity<DisbursementResponse> getDisbursement(
            @PathVariable("disbursementId") String disbursementId);

    /**
     * Gets the active (non-cancelled) disbursement of an application.
     *
     * @param applicationId Application ID
     * @return Disbursement
     */
    @GetMapping("/applications/{applicationId}/disbursement")
    ResponseEntity<DisbursementResponse> getDisbursementForApplication(
            @PathVariable("applicationId") String applicationId);

    /**
     * Lists the financial transactions written for a disbursement: one per payment and one per
     * component that payment settled.
     *
     * @param disbursementId Disbursement ID
     * @return Transactions in recording order
     */
    @GetMapping("/disbursements/{disbursementId}/transactions")
    ResponseEntity<List<FinancialTransactionResponse>> getTransactions(
            @PathVariable("disbursementId") String disbursementId);

    /**
     * Sets the bank account and IFSC of a pending or failed disbursement.
     */
    @PutMapping("/disbursements/{disbursementId}/bank-details")
    ResponseEntity<DisbursementResponse> updateBankDetails(
            @PathVariable("disbursementId") String disbursementId,
            @RequestBody @Valid BankDetailsRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Retries the transfer of a FAILED disbursement.
     *
     * @param disbursementId Disbursement ID
     * @return Outcome of the single retried transfer
     */
    @PostMapping("/disbursements/{disbursementId}/retry")
    ResponseEntity<BatchResult> retryTransfer(
            @PathVariable("disbursementId") String disbursementId,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Cancels a pending or failed disbursement, which frees the application for a new one.
     */
    @PostMapping("/disbursements/{disbursementId}/cancel")
    ResponseEntity<DisbursementResponse> cancelDisbursement(
            @PathVariable("disbursementId") String disbursementId,
            @RequestBody @Valid CancelDisbursementRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Confirms a cheque, cash or fee adjustment payment of some or all components. The
     * disbursement is DISBURSED once every component is paid.
     */
    @PostMapping("/disbursements/{disbursementId}/manual-payment")
    ResponseEntity<DisbursementResponse> recordManualPayment(
            @PathVariable("disbursementId") String disbursementId,
            @RequestBody @Valid ManualPaymentRequest request,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);

    /**
     * Closes a disbursed application.
     *
     * @param applicationId Application ID
     * @return Application in COMPLETED status
     */
    @PostMapping("/applications/{applicationId}/complete")
    ResponseEntity<ApplicationResponse> completeApplication(
            @PathVariable("applicationId") String applicationId,
            @RequestHeader(ActorHeaders.ACTOR_ID) String actorId,
            @RequestHeader(ActorHeaders.ACTOR_ROLE) StaffRole actorRole,
            @RequestHeader(value = ActorHeaders.ACTOR_SCOPE, required = false) Long actorScope);
}
