package com.nosota.scholarship.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;

/**
 * Generates the externally visible identifiers:
 * <ul>
 *   <li>application: {@code APP{yyyy}{8 hex}}</li>
 *   <li>disbursement: {@code DISB{yyyyMMdd}{8 hex}}</li>
 *   <li>transfer batch: {@code DBT{yyyyMMddHHmm}{6 hex}}</li>
 *   <li>forward batch: {@code FWD{yyyyMMddHHmm}{6 hex}}</li>
 *   <li>financial transaction: {@code TXN{yyyyMMdd}{8 hex}}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class IdentifierGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter MINUTE = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private final Clock clock;

    public String nextApplicationId() {
        return "APP" + LocalDateTime.now(clock).getYear() + randomHex(8);
    }

    public String nextDisbursementId() {
        return "DISB" + LocalDateTime.now(clock).format(DAY) + randomHex(8);
    }

    public String nextTransferBatchId() {
        return "DBT" + LocalDateTime.now(clock).format(MINUTE) + randomHex(6);
    }

    public String nextForwardBatchId() {
        return "FWD" + LocalDateTime.now(clock).format(MINUTE) + randomHex(6);
    }

    public String nextTransactionId() {
        return "TXN" + LocalDateTime.now(clock).format(DAY) + randomHex(8);
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
