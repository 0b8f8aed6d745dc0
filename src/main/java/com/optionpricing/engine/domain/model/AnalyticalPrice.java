package com.optionpricing.engine.domain.model;

public record AnalyticalPrice(double callPrice, double putPrice) {

    public double priceOf(OptionType type) {
        return type == OptionType.CALL ? callPrice : putPrice;
    }
}
