package com.wheeltrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    SLOT_STATE_CONFLICT("SLOT_STATE_CONFLICT", 409),
    MARKET_CLOSED("MARKET_CLOSED", 409),
    NO_ELIGIBLE_CONTRACT("NO_ELIGIBLE_CONTRACT", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BROKER_ERROR("BROKER_ERROR", 502),
    BROKER_DISCONNECTED("BROKER_DISCONNECTED", 503);

    private final String code;
    private final int httpStatus;
}
