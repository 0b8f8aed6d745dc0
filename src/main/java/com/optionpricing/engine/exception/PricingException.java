package com.optionpricing.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public abstract class PricingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected PricingException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }
}
