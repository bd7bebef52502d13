package com.tradetracker.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_SYMBOL("INVALID_SYMBOL", 422),
    ASSET_NOT_TRADABLE("ASSET_NOT_TRADABLE", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    VENUE_ERROR("VENUE_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
