package com.optiontracker.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's exceptions. The {@link ErrorCode} decides the HTTP status the
 * {@link GlobalExceptionHandler} answers with; {@code details} is copied into the error body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    /** True when the failure is ours or the pricing service's, not the caller's. */
    public boolean isServerError() {
        return errorCode.getHttpStatus() >= 500;
    }
}
