package com.len.admission.api.common;

import java.time.LocalDateTime;

public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String code,
        String message,
        boolean retryable,
        String path
) {
    public static ErrorResponse of(int status, String code, String message, boolean retryable, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, code, message, retryable, path);
    }
}
