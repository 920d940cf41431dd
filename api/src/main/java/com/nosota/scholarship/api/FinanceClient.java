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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static com.nosota.scholarship.api.ReviewClient.actorHeaders;

/**
 * WebClient-based implementation of {@link FinanceApi}. Registered manually by consumers,
 * see {@link ApplicationClient}.
 */
@RequiredArgsConstructor
@Slf4j
public class FinanceClient implements FinanceApi {

    private final WebClient webClient;

    // ==================== Calculation ====================

    @Override
    public ResponseEntity<CalculationResult> calculateAmount(String applicationId, CalculationRequest request,
                                                             String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling calculateAmount: applicationId={}, strategy={}", applicationId, request.strategy());

        return webClient.post()
                .uri("/api/v1/finance/applications/{applicationId}/calculate", applicationId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(CalculationResult.class)
                .block();
    }

    // ==================== Disbursement ====================

    @Override
    public ResponseEntity<BatchResult> createAndTransferDisbursements(DisbursementRequest request, String actorId,
                                                                      StaffRole actorRole, Long actorScope) {
        log.debug("Calling createAndTransferDisbursements: count={}, method={}",
                request.applicationIds().size(), request.method());

        return webClient.post()
                .uri("/api/v1/finance/disbursements")
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(BatchResult.class)
                .block();
    }

    @Override
    public ResponseEntity<BatchResult> executeTransfers(TransferRequest request, String actorId,
                                                        StaffRole actorRole, Long actorScope) {
        log.debug("Calling executeTransfers: count={}", request.disbursementIds().size());

        return webClient.post()
                .uri("/api/v1/finance/disbursements/transfer")
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(BatchResult.class)
                .block();
    }

    @Override
    public ResponseEntity<DisbursementResponse> getDisbursement(String disbursementId) {
        log.debug("Calling getDisbursement: disbursementId={}", disbursementId);

        return webClient.get()
                .uri("/api/v1/finance/disbursements/{disbursementId}", disbursementId)
                .retrieve()
                .toEntity(DisbursementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisbursementResponse> getDisbursementForApplication(String applicationId) {
        log.debug("Calling getDisbursementForApplication: applicationId={}", applicationId);

        return webClient.get()
                .uri("/api/v1/finance/applications/{applicationId}/disbursement", applicationId)
                .retrieve()
                .toEntity(DisbursementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<List<FinancialTransactionResponse>> getTransactions(String disbursementId) {
        log.debug("Calling getTransactions: disbursementId={}", disbursementId);

        return webClient.get()
                .uri("/api/v1/finance/disbursements/{disbursementId}/transactions", disbursementId)
                .retrieve()
                .toEntityList(FinancialTransactionResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisbursementResponse> updateBankDetails(String disbursementId, BankDetailsRequest request,
                                                                  String actorId, StaffRole actorRole, Long actorScope) {
        log.debug("Calling updateBankDetails: disbursementId={}", disbursementId);

        return webClient.put()
                .uri("/api/v1/finance/disbursements/{disbursementId}/bank-details", disbursementId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisbursementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<BatchResult> retryTransfer(String disbursementId, String actorId,
                                                     StaffRole actorRole, Long actorScope) {
        log.debug("Calling retryTransfer: disbursementId={}", disbursementId);

        return webClient.post()
                .uri("/api/v1/finance/disbursements/{disbursementId}/retry", disbursementId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .retrieve()
                .toEntity(BatchResult.class)
                .block();
    }

    @Override
    public ResponseEntity<DisbursementResponse> cancelDisbursement(String disbursementId,
                                                                   CancelDisbursementRequest request, String actorId,
                                                                   StaffRole actorRole, Long actorScope) {
        log.debug("Calling cancelDisbursement: disbursementId={}", disbursementId);

        return webClient.post()
                .uri("/api/v1/finance/disbursements/{disbursementId}/cancel", disbursementId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisbursementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<DisbursementResponse> recordManualPayment(String disbursementId,
                                                                    ManualPaymentRequest request, String actorId,
                                                                    StaffRole actorRole, Long actorScope) {
        log.debug("Calling recordManualPayment: disbursementId={}, reference={}", disbursementId, request.reference());

        return webClient.post()
                .uri("/api/v1/finance/disbursements/{disbursementId}/manual-payment", disbursementId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .bodyValue(request)
                .retrieve()
                .toEntity(DisbursementResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ApplicationResponse> completeApplication(String applicationId, String actorId,
                                                                   StaffRole actorRole, Long actorScope) {
        log.debug("Calling completeApplication: applicationId={}", applicationId);

        return webClient.post()
                .uri("/api/v1/finance/applications/{applicationId}/complete", applicationId)
                .headers(actorHeaders(actorId, actorRole, actorScope))
                .retrieve()
                .toEntity(ApplicationResponse.class)
                .block();
    }
}
