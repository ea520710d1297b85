package com.amumal.backend.global.error;

import com.amumal.backend.global.web.RequestIdFilter;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;

@ControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    private final boolean exposeDetails;

    public RestExceptionHandler(@Value("${app.errors.expose-details:false}") boolean exposeDetails) {
        this.exposeDetails = exposeDetails;
    }

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        HttpStatus status = ex.getCategory().status();
        ProblemResponse body = ProblemResponse.of(status, ex.getCode(), ex.getDetailMessage(),
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RetryableProblemException retryable) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        return builder.body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode statusCode = ex.getStatusCode();
        HttpStatus status = statusCode instanceof HttpStatus httpStatus
                ? httpStatus
                : HttpStatus.valueOf(statusCode.value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        ProblemResponse body = ProblemResponse.of(status, message, message, request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        StringBuilder sb = new StringBuilder();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            sb.append(fieldError.getField()).append(": ").append(fieldError.getDefaultMessage()).append("; ");
        }
        String detail = sb.length() > 0 ? sb.substring(0, sb.length() - 2) : "Validation failed";
        ProblemResponse body = ProblemResponse.of(status, "validation_error", detail, request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemResponse body = ProblemResponse.of(status, "malformed_request", "요청 본문을 해석할 수 없습니다.",
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemResponse> handleIntegrityViolation(DataIntegrityViolationException ex, HttpServletRequest request) {
        log.warn("Uniqueness or integrity violation escaped the write coordinator: {}", ex.getMostSpecificCause().getMessage());
        HttpStatus status = ErrorCategory.CONFLICT.status();
        ProblemResponse body = ProblemResponse.of(status, "conflict", "이미 존재하는 값입니다.",
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemResponse> handleDataAccessException(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage failure while handling {}", request.getRequestURI(), ex);
        HttpStatus status = ErrorCategory.IO_ERROR.status();
        ProblemResponse body = ProblemResponse.of(status, "IO_ERROR", "저장소를 일시적으로 사용할 수 없습니다.",
                request.getRequestURI(), RequestIdFilter.currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        String requestId = RequestIdFilter.currentRequestId();
        log.error("Unhandled exception [requestId={}]", requestId, ex);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String detail = exposeDetails ? ex.getMessage() : "Internal Server Error";
        ProblemResponse body = ProblemResponse.of(status, "internal_error", detail, request.getRequestURI(), requestId);
        return ResponseEntity.status(status).body(body);
    }
}
