package com.optiontracker.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PRICING_SERVICE_ERROR("PRICING_SERVICE_ERROR", 502),
    PRICING_SERVICE_UNAVAILABLE("PRICING_SERVICE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
