package com.sandkev.tradewise.web;

import com.sandkev.tradewise.instrument.InstrumentNotFoundException;
import com.sandkev.tradewise.marketdata.MarketDataException;
import com.sandkev.tradewise.sync.PriceSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(InstrumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(InstrumentNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({MarketDataException.class, PriceSyncException.class})
    public ResponseEntity<Map<String, Object>> upstream(RuntimeException ex) {
        log.warn("Upstream failure: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "message", message == null ? status.getReasonPhrase() : message
        ));
    }
}
