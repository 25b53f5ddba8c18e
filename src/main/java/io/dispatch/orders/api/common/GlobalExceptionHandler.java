package io.dispatch.orders.api.common;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        var status = statusOf(e.errorCode());
        if (status.is5xxServerError()) {
            log.error("Request failed: code={}, message={}", e.errorCode(), e.getMessage(), e);
        } else {
            log.warn("Business exception occurred: code={}, message={}", e.errorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(e.errorCode(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.error(ErrorCode.VALIDATION_FAILED, ErrorCode.VALIDATION_FAILED.defaultMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("Unexpected exception occurred", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.defaultMessage()));
    }

    static HttpStatus statusOf(ErrorCode errorCode) {
        return switch (errorCode) {
            case VALIDATION_FAILED, INVALID_STATUS, INVALID_PAYMENT_METHOD, TENANT_UNRESOLVED ->
                    HttpStatus.BAD_REQUEST;
            case ORDER_ACCESS_DENIED -> HttpStatus.FORBIDDEN;
            case ORDER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONTENTION_EXCEEDED, CONSTRAINT_VIOLATION -> HttpStatus.CONFLICT;
            case REQUEST_CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
            case PERSISTENCE_FAILURE, INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
