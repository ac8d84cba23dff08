package com.postpilot.scheduler.controller;

import com.postpilot.scheduler.counter.CounterStoreException;
import com.postpilot.scheduler.dto.ApiError;
import com.postpilot.scheduler.exception.CollaboratorUnavailableException;
import com.postpilot.scheduler.exception.JobNotFoundException;
import com.postpilot.scheduler.exception.NotCancellableException;
import com.postpilot.scheduler.exception.QuotaExceededException;
import com.postpilot.scheduler.exception.ValidationException;
import com.postpilot.scheduler.quota.QuotaDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> validation(ValidationException e) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage());
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            ServletRequestBindingException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ApiError> quotaExceeded(QuotaExceededException e) {
        QuotaDecision decision = e.getDecision();
        boolean unavailable = QuotaDecision.UNAVAILABLE.equals(decision.getReason());
        return ResponseEntity.status(unavailable ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.TOO_MANY_REQUESTS)
                .body(ApiError.builder()
                        .code(unavailable ? "quota_unavailable" : "quota_exceeded")
                        .message(e.getMessage())
                        .quota(decision)
                        .build());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> notFound(JobNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(NotCancellableException.class)
    public ResponseEntity<ApiError> notCancellable(NotCancellableException e) {
        return error(HttpStatus.CONFLICT, "not_cancellable", e.getMessage());
    }

    @ExceptionHandler({CounterStoreException.class, CollaboratorUnavailableException.class})
    public ResponseEntity<ApiError> unavailable(RuntimeException e) {
        log.error("Dependency unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable", "A required service is unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(ApiError.builder().code("request_error").message(e.getMessage()).build());
        }
        log.error("Request failed", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Request failed");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ApiError.builder().code(code).message(message).build());
    }
}
