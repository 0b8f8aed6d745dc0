package com.optionpricing.engine.domain.service;

import org.apache.commons.math3.special.Erf;

public final class NormalDistribution {

    private static final double SQRT_2 = Math.sqrt(2.0);

    private NormalDistribution() {
    }

    /**
     * Standard normal CDF, {@code 0.5 * (1 + erf(x / sqrt(2)))}. Saturates to 0 and 1 in the tails.
     */
    public static double cdf(double x) {
        if (Double.isNaN(x)) {
            throw new IllegalArgumentException("cdf argument must not be NaN");
        }
        return 0.5 * (1.0 + Erf.erf(x / SQRT_2));
    }
}
