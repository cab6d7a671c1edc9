package com.seedling.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class SettlementExceptionHandler {

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<SettlementErrorResponse> handle(SettlementException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new SettlementErrorResponse(ex.getCode(), ex.getMessage(), ex.getDetails()));
    }

    public record SettlementErrorResponse(
            String code,
            String message,
            Map<String, Object> details
    ) {
    }
}
