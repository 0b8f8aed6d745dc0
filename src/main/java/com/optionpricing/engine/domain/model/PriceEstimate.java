package com.optionpricing.engine.domain.model;

/**
 * Discounted Monte Carlo price and the standard error of that estimate.
 */
public record PriceEstimate(double price, double standardError) {
}
