package com.optionpricing.engine.domain.model;

public record VolatilityEstimate(double currentPrice, double volatility,
                                 int observations, double riskFreeRate) {
}
