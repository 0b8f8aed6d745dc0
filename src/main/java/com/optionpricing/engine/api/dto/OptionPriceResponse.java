package com.optionpricing.engine.api.dto;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.OptionType;

public record OptionPriceResponse(String type, double price) {

    public static OptionPriceResponse of(AnalyticalPrice analytical, OptionType type) {
        return new OptionPriceResponse(type.getCode(), analytical.priceOf(type));
    }
}
