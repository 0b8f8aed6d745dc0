package com.optionpricing.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.optionpricing.engine.exception.InvalidParameterException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Monte Carlo estimation strategy. Unknown codes are rejected, never mapped to {@link #STANDARD}.
 */
public enum SimulationMethod {
    STANDARD("standard"),
    ANTITHETIC("antithetic"),
    CONTROL_VARIATE("control_variate");

    private final String code;

    SimulationMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean usesAntitheticPaths() {
        return this == ANTITHETIC;
    }

    public static SimulationMethod fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (SimulationMethod method : values()) {
                if (method.code.equals(normalized)) {
                    return method;
                }
            }
        }
        throw new InvalidParameterException("method", code, "expected one of " + supportedCodes());
    }

    private static String supportedCodes() {
        return Arrays.stream(values())
                .map(SimulationMethod::getCode)
                .collect(Collectors.joining(", "));
    }
}
