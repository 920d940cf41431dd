package com.nosota.scholarship.service;

import com.nosota.scholarship.api.model.ItemOutcome;
import com.nosota.scholarship.api.response.BatchItemResult;
import com.nosota.scholarship.api.response.BatchResult;
import com.nosota.scholarship.error.ErrorCoded;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.security.access.AccessDeniedException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects per-item outcomes of a batch operation. A failed item is recorded with its error
 * code and never stops the batch.
 */
@Slf4j
final class BatchCollector {

    static final String ACCESS_DENIED = "ACCESS_DENIED";
    static final String CONCURRENT_MODIFICATION = "CONCURRENT_MODIFICATION";
    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final String batchId;
    private final List<BatchItemResult> results = new ArrayList<>();
    private BigDecimal totalAmount;

    BatchCollector(String batchId, boolean tracksAmount) {
        this.batchId = batchId;
        this.totalAmount = tracksAmount ? BigDecimal.ZERO.setScale(2) : null;
    }

    void success(String id, String message, String referenceId, BigDecimal amount) {
        results.add(new BatchItemResult(id, ItemOutcome.SUCCESS, null, message, referenceId, amount));
    }

    /**
     * Records a successful item whose amount counts towards the batch total.
     */
    void successWithAmount(String id, String message, String referenceId, BigDecimal amount) {
        success(id, message, referenceId, amount);
        if (totalAmount != null && amount != null) {
            totalAmount = totalAmount.add(amount);
        }
    }

    void failure(String id, String errorCode, String message, String referenceId) {
        results.add(new BatchItemResult(id, ItemOutcome.FAILED, errorCode, message, referenceId, null));
    }

    void failure(String id, RuntimeException e) {
        String code = errorCode(e);
        if (INTERNAL_ERROR.equals(code)) {
            log.error("Batch {} item {} failed unexpectedly", batchId, id, e);
        } else {
            log.warn("Batch {} item {} rejected: {} - {}", batchId, id, code, e.getMessage());
        }
        failure(id, code, e.getMessage(), null);
    }

    BatchResult finish(LocalDateTime processedAt) {
        int processed = (int) results.stream().filter(BatchItemResult::succeeded).count();
        return new BatchResult(batchId, results.size(), processed, results.size() - processed,
                totalAmount, List.copyOf(results), processedAt);
    }

    static String errorCode(RuntimeException e) {
        if (e instanceof ErrorCoded coded) {
            return coded.getCode();
        }
        if (e instanceof AccessDeniedException) {
            return ACCESS_DENIED;
        }
        if (e instanceof ConcurrencyFailureException) {
            return CONCURRENT_MODIFICATION;
        }
        if (e instanceof ConstraintViolationException || e instanceof IllegalArgumentException) {
            return INVALID_REQUEST;
        }
        return INTERNAL_ERROR;
    }
}
