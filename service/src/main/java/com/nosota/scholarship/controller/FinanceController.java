package com.nosota.scholarship.controller;

import com.nosota.scholarship.api.FinanceApi;
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
import com.nosota.scholarship.mapper.ApplicationMapper;
import com.nosota.scholarship.mapper.DisbursementMapper;
import com.nosota.scholarship.mapper.FinancialTransactionMapper;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.Disbursement;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.service.CalculationService;
import com.nosota.scholarship.service.DisbursementService;
import com.nosota.scholarship.service.TransferService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for finance operations.
 *
 * <p>Implements {@link FinanceApi} for:
 * <ul>
 *   <li>Amount calculation</li>
 *   <li>Disbursement creation and bank transfers</li>
 *   <li>Manual settlement per component, cancellation and completion</li>
 *   <li>Financial transactions of a disbursement</li>
 * </ul>
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class FinanceController implements FinanceApi {

    private final CalculationService calculationService;
    private final DisbursementService disbursementService;
    private final TransferService transferService;

    // ==================== Calculation ====================

    @Override
    public ResponseEntity<CalculationResult> calculateAmount(String applicationId, CalculationRequest request,
                                                             String actorId, StaffRole actorRole, Long actorScope) {
        return ResponseEntity.ok(calculationService.calculateAmount(applicationId, request,
                Actor.of(actorId, actorRole, actorScope)));
    }

    // ==================== Disbursement ====================

    @Override
    public ResponseEntity<BatchResult> createAndTransferDisbursements(DisbursementRequest request, String actorId,
                                                                      StaffRole actorRole, Long actorScope) {
        return ResponseEntity.ok(transferService.createAndTransfer(request, Actor.of(actorId, actorRole, actorScope)));
    }

    @Override
    public ResponseEntity<BatchResult> executeTransfers(TransferRequest request, String actorId, StaffRole actorRole,
                                                        Long actorScope) {
        return ResponseEntity.ok(transferService.executeTransfers(request, Actor.of(actorId, actorRole, actorScope)));
    }

    @Override
    public ResponseEntity<DisbursementResponse> getDisbursement(String disbursementId) {
        return ResponseEntity.ok(toResponse(disbursementService.getDisbursement(disbursementId)));
    }

    @Override
    public ResponseEntity<DisbursementResponse> getDisbursementForApplication(String applicationId) {
        return ResponseEntity.ok(toResponse(disbursementService.getActiveDisbursement(applicationId)));
    }

    @Override
    public ResponseEntity<List<FinancialTransactionResponse>> getTransactions(String disbursementId) {
        return ResponseEntity.ok(FinancialTransactionMapper.INSTANCE.toResponseList(
                disbursementService.getTransactions(disbursementId)));
    }

    @Override
    public ResponseEntity<DisbursementResponse> updateBankDetails(String disbursementId, BankDetailsRequest request,
                                                                  String actorId, StaffRole actorRole,
                                                                  Long actorScope) {
        Disbursement disbursement = disbursementService.updateBankDetails(disbursementId, request,
                Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(disbursement));
    }

    @Override
    public ResponseEntity<BatchResult> retryTransfer(String disbursementId, String actorId, StaffRole actorRole,
                                                     Long actorScope) {
        return ResponseEntity.ok(transferService.retryTransfer(disbursementId,
                Actor.of(actorId, actorRole, actorScope)));
    }

    @Override
    public ResponseEntity<DisbursementResponse> cancelDisbursement(String disbursementId,
                                                                   CancelDisbursementRequest request,
                                                                   String actorId, StaffRole actorRole,
                                                                   Long actorScope) {
        Disbursement disbursement = disbursementService.cancel(disbursementId, request.remarks(),
                Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(disbursement));
    }

    @Override
    public ResponseEntity<DisbursementResponse> recordManualPayment(String disbursementId, ManualPaymentRequest request,
                                                                    String actorId, StaffRole actorRole,
                                                                    Long actorScope) {
        Disbursement disbursement = disbursementService.recordManualPayment(disbursementId, request.reference(),
                request.remarks(), request.components(), Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(toResponse(disbursement));
    }

    @Override
    public ResponseEntity<ApplicationResponse> completeApplication(String applicationId, String actorId,
                                                                   StaffRole actorRole, Long actorScope) {
        Application application = disbursementService.completeApplication(applicationId,
                Actor.of(actorId, actorRole, actorScope));
        return ResponseEntity.ok(ApplicationMapper.INSTANCE.toResponse(application, false));
    }

    private static DisbursementResponse toResponse(Disbursement disbursement) {
        return DisbursementMapper.INSTANCE.toResponse(disbursement);
    }
}
