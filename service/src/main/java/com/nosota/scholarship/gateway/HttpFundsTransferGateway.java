package com.nosota.scholarship.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;

/**
 * {@link FundsTransferGateway} calling the bank's transfer API with WebClient.
 *
 * <p>Request: {@code POST /transfers} with account, routing code, amount and an
 * {@code Idempotency-Key} header. A {@code SUCCESS} status with a reference is a success;
 * everything else, including HTTP errors and timeouts, is a failure. A timeout leaves the real
 * outcome unknown, which the failure reason says. A retry sends the same key, so the bank returns
 * the original result instead of executing the transfer again.
 */
@Component
@Slf4j
public class HttpFundsTransferGateway implements FundsTransferGateway {

    static final String SUCCESS = "SUCCESS";

    private final WebClient webClient;

    public HttpFundsTransferGateway(@Qualifier("transferGatewayWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public TransferOutcome transfer(TransferInstruction instruction) {
        log.debug("Submitting transfer: amount={}, idempotencyKey={}", instruction.amount(), instruction.idempotencyKey());

        try {
            GatewayTransferResponse response = webClient.post()
                    .uri("/transfers")
                    .header("Idempotency-Key", instruction.idempotencyKey())
                    .bodyValue(new GatewayTransferRequest(instruction.accountNumber(), instruction.routingCode(),
                            instruction.amount()))
                    .retrieve()
                    .bodyToMono(GatewayTransferResponse.class)
                    .block();

            if (response == null) {
                return TransferOutcome.failure("Empty response from transfer gateway");
            }
            if (SUCCESS.equalsIgnoreCase(response.status()) && response.reference() != null) {
                return TransferOutcome.success(response.reference());
            }
            return TransferOutcome.failure(response.reason() != null
                    ? response.reason()
                    : "Transfer gateway returned status " + response.status());
        } catch (WebClientResponseException e) {
            log.error("Transfer gateway rejected {}: HTTP {}", instruction.idempotencyKey(), e.getStatusCode().value());
            return TransferOutcome.failure("Transfer gateway error: HTTP " + e.getStatusCode().value());
        } catch (WebClientRequestException e) {
            log.error("Transfer gateway unreachable for {}: {}", instruction.idempotencyKey(), e.getMessage());
            return TransferOutcome.failure("Transfer gateway unreachable, outcome unknown: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Transfer {} failed", instruction.idempotencyKey(), e);
            return TransferOutcome.failure("Transfer failed, outcome unknown: " + e.getMessage());
        }
    }

    public record GatewayTransferRequest(String accountNumber, String routingCode, BigDecimal amount) {
    }

    public record GatewayTransferResponse(String status, String reference, String reason) {
    }
}
