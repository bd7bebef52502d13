package com.tradetracker.api.dto;

import com.tradetracker.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Error body returned by every endpoint. */
@Value
@Builder
public class ApiErrorResponse {

    String code;
    String message;
    Map<String, Object> details;
    String path;
    Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
