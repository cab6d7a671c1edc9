package com.seedling.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class SettlementException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final Map<String, Object> details;

    public SettlementException(HttpStatus status, String code, String message, Map<String, Object> details) {
        super(message);
        this.status = status;
        this.code = code;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public SettlementException(HttpStatus status, String code, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
        this.details = details == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static SettlementException notFound(String detail) {
        return new SettlementException(HttpStatus.NOT_FOUND, "not_found", detail, null);
    }

    public static SettlementException preconditionFailed(String detail) {
        return new SettlementException(HttpStatus.CONFLICT, "precondition_failed", detail, null);
    }

    public static SettlementException preconditionFailed(String detail, Map<String, Object> details) {
        return new SettlementException(HttpStatus.CONFLICT, "precondition_failed", detail, details);
    }

    public static SettlementException validationFailed(String detail) {
        return new SettlementException(HttpStatus.BAD_REQUEST, "validation_failed", detail, null);
    }

    public static SettlementException validationFailed(String detail, Map<String, Object> details) {
        return new SettlementException(HttpStatus.BAD_REQUEST, "validation_failed", detail, details);
    }

    public static SettlementException forbidden(String detail) {
        return new SettlementException(HttpStatus.FORBIDDEN, "forbidden", detail, null);
    }

    public static SettlementException conflict(String detail) {
        return new SettlementException(HttpStatus.CONFLICT, "conflict", detail, null);
    }

    public static SettlementException externalServiceError(String detail, Throwable cause) {
        return new SettlementException(
                HttpStatus.BAD_GATEWAY,
                "external_service_error",
                detail,
                Map.of("retryable", true),
                cause
        );
    }
}
