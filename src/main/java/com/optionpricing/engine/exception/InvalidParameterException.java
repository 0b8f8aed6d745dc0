package com.optionpricing.engine.exception;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a pricing input is rejected before any computation or sampling starts.
 * The offending parameter name and value are carried in {@link #getDetails()}.
 */
@Getter
public class InvalidParameterException extends PricingException {

    private final String parameter;

    public InvalidParameterException(String parameter, Object rejectedValue, String reason) {
        super(ErrorCode.INVALID_PARAMETER,
                "Invalid parameter '" + parameter + "': " + reason,
                details(parameter, rejectedValue));
        this.parameter = parameter;
    }

    private static Map<String, Object> details(String parameter, Object rejectedValue) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("parameter", parameter);
        details.put("rejectedValue", String.valueOf(rejectedValue));
        return details;
    }
}
