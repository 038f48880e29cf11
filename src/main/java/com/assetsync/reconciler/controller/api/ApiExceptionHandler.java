package com.assetsync.reconciler.controller.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.assetsync.reconciler.exception.AcquisitionException;
import com.assetsync.reconciler.exception.InventoryStoreException;
import com.assetsync.reconciler.exception.UnknownSourceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps reconciler exceptions to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnknownSourceException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownSource(UnknownSourceException ex) {
        return body("UNKNOWN_SOURCE", ex.getMessage());
    }

    @ExceptionHandler(AcquisitionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleAcquisition(AcquisitionException ex) {
        log.warn("Rejected source payload: {}", ex.getMessage());
        return body("UNREADABLE_SOURCE_DATA", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadArgument(IllegalArgumentException ex) {
        return body("BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(InventoryStoreException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleInventoryStore(InventoryStoreException ex) {
        log.error("Inventory store call failed: {}", ex.getMessage());
        return body("INVENTORY_STORE_ERROR", ex.getMessage());
    }

    private static Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", code);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
