package com.seedling.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seedling.config.PaymentProcessorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Authenticates processor webhooks signed as {@code t=<unix seconds>,v1=<hex hmac-sha256 of "t.payload">}.
 */
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String TIMESTAMP_PREFIX = "t=";
    private static final String SIGNATURE_PREFIX = "v1=";
    private static final Pattern HEX_SIGNATURE = Pattern.compile("(?:[0-9a-fA-F]{2})+");

    private final PaymentProcessorProperties paymentProcessorProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public WebhookSignatureVerifier(PaymentProcessorProperties paymentProcessorProperties, ObjectMapper objectMapper) {
        this(paymentProcessorProperties, objectMapper, Clock.systemUTC());
    }

    WebhookSignatureVerifier(PaymentProcessorProperties paymentProcessorProperties, ObjectMapper objectMapper, Clock clock) {
        this.paymentProcessorProperties = paymentProcessorProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ProcessorEvent verify(String payload, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookVerificationException("Missing signature header");
        }
        if (payload == null || payload.isBlank()) {
            throw new WebhookVerificationException("Invalid payload");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String trimmed = part.trim();
            if (trimmed.startsWith(TIMESTAMP_PREFIX)) {
                try {
                    timestamp = Long.parseLong(trimmed.substring(TIMESTAMP_PREFIX.length()));
                } catch (NumberFormatException ex) {
                    throw new WebhookVerificationException("Invalid signature", ex);
                }
            } else if (trimmed.startsWith(SIGNATURE_PREFIX)) {
                signatures.add(trimmed.substring(SIGNATURE_PREFIX.length()));
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw new WebhookVerificationException("Invalid signature");
        }

        long tolerance = paymentProcessorProperties.getSignatureToleranceSeconds();
        long now = clock.instant().getEpochSecond();
        if (tolerance > 0 && Math.abs(now - timestamp) > tolerance) {
            throw new WebhookVerificationException("Invalid signature");
        }

        byte[] expected = sign(timestamp + "." + payload);
        boolean matched = false;
        for (String signature : signatures) {
            if (!HEX_SIGNATURE.matcher(signature).matches()) {
                continue;
            }
            if (MessageDigest.isEqual(expected, HexFormat.of().parseHex(signature))) {
                matched = true;
                break;
            }
        }
        if (!matched) {
            throw new WebhookVerificationException("Invalid signature");
        }

        return parseEvent(payload);
    }

    public String signatureHeaderFor(String payload, long timestampSeconds) {
        return TIMESTAMP_PREFIX + timestampSeconds + "," + SIGNATURE_PREFIX
                + HexFormat.of().formatHex(sign(timestampSeconds + "." + payload));
    }

    private ProcessorEvent parseEvent(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new WebhookVerificationException("Invalid payload", ex);
        }
        JsonNode type = root == null ? null : root.get("type");
        if (type == null || !type.isTextual()) {
            throw new WebhookVerificationException("Invalid payload");
        }
        JsonNode object = root.path("data").path("object");
        return new ProcessorEvent(
                root.path("id").asText(null),
                type.asText(),
                object.isObject() ? object : null
        );
    }

    private byte[] sign(String signedPayload) {
        String secret = paymentProcessorProperties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("seedling.payments.webhook-secret is not configured");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(signedPayload.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("HMAC-SHA256 is unavailable", ex);
        }
    }
}
