package com.len.admission.api.common;

import com.len.admission.application.ratelimit.RateLimitedException;
import com.len.admission.common.exception.BusinessException;
import com.len.admission.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // ===== OTP 요청 제한 =====
    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(
            RateLimitedException e,
            HttpServletRequest request
    ) {
        log.info("[RATE_LIMITED] {} {} - resetTime={}",
                request.getMethod(), request.getRequestURI(), e.getResetTime());

        ErrorCode code = e.getErrorCode();
        return ResponseEntity.status(code.getHttpStatus())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(body(code, e.getMessage(), request));
    }

    // ===== 비즈니스 예외 =====
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(
            BusinessException e,
            HttpServletRequest request
    ) {
        ErrorCode code = e.getErrorCode();
        if (code.isRetryable()) {
            log.warn("[{}] {} {} - {}", code.getCode(), request.getMethod(), request.getRequestURI(), e.getMessage());
        } else {
            log.info("[{}] {} {} - {}", code.getCode(), request.getMethod(), request.getRequestURI(), e.getMessage());
        }

        return ResponseEntity.status(code.getHttpStatus())
                .body(body(code, e.getMessage(), request));
    }

    // ===== 요청 형식 오류 =====
    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            Exception e,
            HttpServletRequest request
    ) {
        log.info("[INVALID_REQUEST] {} {} - {}",
                request.getMethod(), request.getRequestURI(), e.getMessage());

        ErrorCode code = ErrorCode.INVALID_REQUEST;
        return ResponseEntity.status(code.getHttpStatus())
                .body(body(code, code.getMessage(), request));
    }

    // ===== 그 외 모든 예외 =====
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(
            Exception e,
            HttpServletRequest request
    ) {
        log.error("[INTERNAL_ERROR] {} {}",
                request.getMethod(), request.getRequestURI(), e);

        ErrorCode code = ErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(code, code.getMessage(), request));
    }

    private ErrorResponse body(ErrorCode code, String message, HttpServletRequest request) {
        return ErrorResponse.of(
                code.getHttpStatus().value(),
                code.getCode(),
                message,
                code.isRetryable(),
                request.getRequestURI()
        );
    }
}
