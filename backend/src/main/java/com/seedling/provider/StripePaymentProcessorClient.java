package com.seedling.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seedling.config.PaymentProcessorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;

/**
 * Payment processor adapter for the Stripe REST API (PaymentIntents, Connect transfers, balance).
 */
@Component
@ConditionalOnProperty(prefix = "seedling.payments", name = "provider", havingValue = "stripe")
public class StripePaymentProcessorClient implements PaymentProcessorClient {

    private static final Logger log = LoggerFactory.getLogger(StripePaymentProcessorClient.class);
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public StripePaymentProcessorClient(
            RestClient.Builder restClientBuilder,
            PaymentProcessorProperties paymentProcessorProperties,
            ObjectMapper objectMapper
    ) {
        if (paymentProcessorProperties.getSecretKey() == null || paymentProcessorProperties.getSecretKey().isBlank()) {
            throw new IllegalStateException("seedling.payments.secret-key is required when provider=stripe");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(paymentProcessorProperties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(paymentProcessorProperties.getReadTimeoutMs());

        this.restClient = restClientBuilder
                .baseUrl(paymentProcessorProperties.getApiBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + paymentProcessorProperties.getSecretKey())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public ChargeHandle createCharge(long amountMinor, String currency, Map<String, String> metadata) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", Long.toString(amountMinor));
        form.add("currency", currency.toLowerCase(Locale.ROOT));
        form.add("automatic_payment_methods[enabled]", "true");
        form.add("automatic_payment_methods[allow_redirects]", "never");
        addMetadata(form, metadata);

        JsonNode body = execute("create payment intent", () -> restClient.post()
                .uri("/v1/payment_intents")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class));
        return toChargeHandle(body);
    }

    @Override
    public ChargeHandle getCharge(String chargeId) {
        JsonNode body = execute("retrieve payment intent " + chargeId, () -> restClient.get()
                .uri("/v1/payment_intents/{id}", chargeId)
                .retrieve()
                .body(JsonNode.class));
        return toChargeHandle(body);
    }

    @Override
    public TransferHandle createTransfer(
            long amountMinor,
            String currency,
            String destination,
            String idempotencyKey,
            Map<String, String> metadata
    ) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", Long.toString(amountMinor));
        form.add("currency", currency.toLowerCase(Locale.ROOT));
        form.add("destination", destination);
        addMetadata(form, metadata);

        JsonNode body = execute("create transfer", () -> restClient.post()
                .uri("/v1/transfers")
                .header(IDEMPOTENCY_KEY_HEADER, idempotencyKey)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class));

        String transferId = requireText(body, "id");
        log.info("Stripe transfer created: transferId={}, amountMinor={}, destination={}", transferId, amountMinor, destination);
        return new TransferHandle(transferId, body.path("amount").asLong(amountMinor), destination);
    }

    @Override
    public ProcessorBalance getBalance(String currency) {
        JsonNode body = execute("retrieve balance", () -> restClient.get()
                .uri("/v1/balance")
                .retrieve()
                .body(JsonNode.class));

        long available = 0L;
        for (JsonNode entry : body.path("available")) {
            if (currency.equalsIgnoreCase(entry.path("currency").asText())) {
                available += entry.path("amount").asLong();
            }
        }
        return new ProcessorBalance(available, currency.toLowerCase(Locale.ROOT));
    }

    private JsonNode execute(String operation, StripeCall call) {
        try {
            JsonNode body = call.execute();
            if (body == null || !body.isObject()) {
                throw new PaymentProcessorException("Empty response from Stripe while trying to " + operation);
            }
            return body;
        } catch (RestClientResponseException ex) {
            throw new PaymentProcessorException(
                    "Stripe rejected " + operation + " (HTTP " + ex.getStatusCode().value() + "): "
                            + stripeErrorMessage(ex.getResponseBodyAsString()),
                    ex
            );
        } catch (RestClientException ex) {
            throw new PaymentProcessorException("Stripe unavailable while trying to " + operation, ex);
        }
    }

    private String stripeErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return "no error body";
        }
        try {
            JsonNode message = objectMapper.readTree(responseBody).path("error").path("message");
            return message.isTextual() ? message.asText() : responseBody;
        } catch (IOException ex) {
            return responseBody;
        }
    }

    private static ChargeHandle toChargeHandle(JsonNode body) {
        return new ChargeHandle(
                requireText(body, "id"),
                body.path("client_secret").isTextual() ? body.get("client_secret").asText() : null,
                ChargeStatus.fromWire(body.path("status").asText(null))
        );
    }

    private static String requireText(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new PaymentProcessorException("Stripe response is missing '" + field + "'");
        }
        return value.asText();
    }

    private static void addMetadata(MultiValueMap<String, String> form, Map<String, String> metadata) {
        if (metadata == null) {
            return;
        }
        metadata.forEach((key, value) -> form.add("metadata[" + key + "]", value));
    }

    @FunctionalInterface
    private interface StripeCall {
        JsonNode execute();
    }
}
