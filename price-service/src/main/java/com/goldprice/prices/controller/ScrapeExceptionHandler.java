package com.goldprice.prices.controller;

import com.goldprice.common.exception.FetchFailureException;
import com.goldprice.common.exception.UnsupportedSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON error bodies for the price endpoints: {@code {error, source, ...}}.
 * The RSS endpoint handles its own failures and never reaches this advice.
 */
@RestControllerAdvice
public class ScrapeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ScrapeExceptionHandler.class);

    @ExceptionHandler(UnsupportedSourceException.class)
    public ResponseEntity<Map<String, Object>> unsupportedSource(UnsupportedSourceException e) {
        log.warn("Unsupported source requested. source={}", e.getSelector());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("source", e.getSelector());
        body.put("supportedSources", e.getSupportedSelectors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(FetchFailureException.class)
    public ResponseEntity<Map<String, Object>> fetchFailure(FetchFailureException e) {
        log.warn("Upstream fetch failed. source={} url={}", e.getSelector(), e.getUrl());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("source", e.getSelector());
        body.put("url", e.getUrl());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("Bad request. reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
