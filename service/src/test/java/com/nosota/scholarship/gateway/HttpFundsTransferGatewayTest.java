package com.nosota.scholarship.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HTTP Funds Transfer Gateway")
class HttpFundsTransferGatewayTest {

    private static final TransferInstruction INSTRUCTION = new TransferInstruction(
            "123456789012", "SBIN0001234", new BigDecimal("25000.00"), "DISB20240101ABCDEF01");

    @Test
    @DisplayName("GW-001: SUCCESS status with reference is a successful transfer")
    void testSuccess() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        HttpFundsTransferGateway gateway = gateway(request -> {
            captured.set(request);
            return Mono.just(json(HttpStatus.OK, "{\"status\":\"SUCCESS\",\"reference\":\"UTR123\"}"));
        });

        TransferOutcome outcome = gateway.transfer(INSTRUCTION);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.reference()).isEqualTo("UTR123");
        assertThat(captured.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(captured.get().url().getPath()).isEqualTo("/api/transfers");
        assertThat(captured.get().headers().getFirst("Idempotency-Key")).isEqualTo("DISB20240101ABCDEF01");
    }

    @Test
    @DisplayName("GW-002: declined transfer carries the bank's reason")
    void testDeclined() {
        HttpFundsTransferGateway gateway = gateway(request ->
                Mono.just(json(HttpStatus.OK, "{\"status\":\"FAILED\",\"reason\":\"Account closed\"}")));

        TransferOutcome outcome = gateway.transfer(INSTRUCTION);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.reason()).isEqualTo("Account closed");
    }

    @Test
    @DisplayName("GW-003: HTTP error is reported as a failure, not thrown")
    void testHttpError() {
        HttpFundsTransferGateway gateway = gateway(request ->
                Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

        TransferOutcome outcome = gateway.transfer(INSTRUCTION);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.reason()).contains("503");
    }

    @Test
    @DisplayName("GW-004: connection failure leaves the outcome unknown")
    void testUnreachable() {
        HttpFundsTransferGateway gateway = gateway(request -> Mono.error(new WebClientRequestException(
                new IOException("Connection refused"), HttpMethod.POST,
                URI.create("http://bank.test/api/transfers"), new HttpHeaders())));

        TransferOutcome outcome = gateway.transfer(INSTRUCTION);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.reason()).contains("outcome unknown");
    }

    private static HttpFundsTransferGateway gateway(ExchangeFunction exchange) {
        return new HttpFundsTransferGateway(WebClient.builder()
                .baseUrl("http://bank.test/api")
                .exchangeFunction(exchange)
                .build());
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
