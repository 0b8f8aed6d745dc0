package com.optionpricing.engine.domain.model;

import com.optionpricing.engine.exception.InvalidParameterException;

/**
 * Black-Scholes-Merton market and contract inputs.
 *
 * @param spot          current underlying price (S0)
 * @param strike        strike price (K)
 * @param maturity      time to maturity in years (T)
 * @param rate          continuously compounded risk-free rate (r)
 * @param volatility    annualized volatility (sigma)
 * @param dividendYield continuous dividend yield (q)
 */
public record ModelParameters(double spot, double strike, double maturity,
                              double rate, double volatility, double dividendYield) {

    public ModelParameters {
        requirePositive("S0", spot);
        requirePositive("K", strike);
        requirePositive("T", maturity);
        requirePositive("sigma", volatility);
        requireFinite("r", rate);
        requireFinite("q", dividendYield);
    }

    public static ModelParameters of(double spot, double strike, double maturity,
                                     double rate, double volatility) {
        return new ModelParameters(spot, strike, maturity, rate, volatility, 0.0);
    }

    public double sqrtMaturity() {
        return Math.sqrt(maturity);
    }

    public double discountFactor() {
        return Math.exp(-rate * maturity);
    }

    public double dividendDiscountFactor() {
        return Math.exp(-dividendYield * maturity);
    }

    /**
     * Risk-neutral expectation of the terminal price, {@code S0 * exp((r - q) * T)}.
     */
    public double expectedTerminalPrice() {
        return spot * Math.exp((rate - dividendYield) * maturity);
    }

    private static void requirePositive(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidParameterException(name, value, "must be a positive finite number");
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name, value, "must be a finite number");
        }
    }
}
