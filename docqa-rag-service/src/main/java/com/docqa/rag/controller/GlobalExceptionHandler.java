package com.docqa.rag.controller;

import com.docqa.rag.dto.ErrorResponse;
import com.docqa.rag.error.AllProvidersExhaustedException;
import com.docqa.rag.error.DocQaException;
import com.docqa.rag.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AllProvidersExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleExhausted(AllProvidersExhaustedException e) {
        log.warn("All providers failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of(e.getCode().name(), e.getMessage(), e.getErrors()));
    }

    @ExceptionHandler(DocQaException.class)
    public ResponseEntity<ErrorResponse> handleDocQa(DocQaException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.warn("Request rejected ({}): {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e.getCode().name(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed: {}", message);
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(ErrorCode.INTERNAL_ERROR.name(), e.getMessage()));
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALL_PROVIDERS_EXHAUSTED -> HttpStatus.BAD_GATEWAY;
            case CANCELLED, INVALID_STATE_TRANSITION -> HttpStatus.CONFLICT;
            case UNSUPPORTED_FORMAT -> HttpStatus.UNSUPPORTED_MEDIA_TYPE;
            case EMPTY_DOCUMENT, EXTRACTION_FAILED, DIMENSION_MISMATCH -> HttpStatus.UNPROCESSABLE_ENTITY;
            case EMBEDDING_FAILURE, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
            case INVALID_CHUNK_CONFIG, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
        };
    }
}
