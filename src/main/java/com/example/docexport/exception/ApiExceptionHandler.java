package com.example.docexport.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.nio.file.NoSuchFileException;
import java.time.Instant;

/**
 * Maps export failures onto JSON error bodies
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TemplateLoadingException.class)
    public ResponseEntity<ApiError> handleTemplate(TemplateLoadingException ex, HttpServletRequest req) {
        HttpStatus status = "TEMPLATE_NOT_FOUND".equals(ex.getCode()) ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        log.warn("Template error {}: {}", ex.getCode(), ex.getDescription());
        return build(status, ex.getCode(), ex.getDescription(), req);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest req) {
        return build(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), req);
    }

    @ExceptionHandler(ExportStorageException.class)
    public ResponseEntity<ApiError> handleStorage(ExportStorageException ex, HttpServletRequest req) {
        log.error("Storage failure on {}", req.getRequestURI(), ex);
        return build(HttpStatus.BAD_GATEWAY, "STORAGE_ERROR", ex.getMessage(), req);
    }

    @ExceptionHandler(DownloadLinkException.class)
    public ResponseEntity<ApiError> handleDownloadLink(DownloadLinkException ex, HttpServletRequest req) {
        log.warn("Rejected download {}: {}", req.getRequestURI(), ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "LINK_REJECTED", ex.getMessage(), req);
    }

    @ExceptionHandler(NoSuchFileException.class)
    public ResponseEntity<ApiError> handleMissingFile(NoSuchFileException ex, HttpServletRequest req) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", "No such export: " + ex.getFile(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "EXPORT_FAILED", "Unexpected error", req);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message, HttpServletRequest req) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .code(code)
                .message(message)
                .path(req.getRequestURI())
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
