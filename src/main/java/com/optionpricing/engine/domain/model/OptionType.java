package com.optionpricing.engine.domain.model;

import com.optionpricing.engine.exception.InvalidParameterException;

import java.util.Locale;

public enum OptionType {
    CALL("call") {
        @Override
        public double payoff(double terminalPrice, double strike) {
            return Math.max(terminalPrice - strike, 0.0);
        }
    },
    PUT("put") {
        @Override
        public double payoff(double terminalPrice, double strike) {
            return Math.max(strike - terminalPrice, 0.0);
        }
    };

    private final String code;

    OptionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public abstract double payoff(double terminalPrice, double strike);

    public static OptionType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (OptionType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new InvalidParameterException("optionType", code, "expected one of call, put");
    }
}
