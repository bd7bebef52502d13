package com.tradetracker.exception;

import java.util.Map;

/** A request that violates a trading rule, e.g. a new trade on a paused asset. */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
