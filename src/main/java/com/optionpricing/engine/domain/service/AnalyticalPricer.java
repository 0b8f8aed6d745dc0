package com.optionpricing.engine.domain.service;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Closed-form European call and put prices under dividend-adjusted Black-Scholes.
 *
 * <ul>
 *   <li>d1 = [ln(S0/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>call = S0 * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>put = K * e^(-rT) * N(-d2) - S0 * e^(-qT) * N(-d1)
 * </ul>
 */
@Slf4j
@Component
public class AnalyticalPricer {

    public AnalyticalPrice price(ModelParameters params) {
        double sigmaSqrtT = params.volatility() * params.sqrtMaturity();
        if (!(sigmaSqrtT > 0) || !Double.isFinite(sigmaSqrtT)) {
            throw new InvalidParameterException("sigma*sqrt(T)", sigmaSqrtT, "must be positive");
        }

        double sigma = params.volatility();
        double d1 = (Math.log(params.spot() / params.strike())
                + (params.rate() - params.dividendYield() + 0.5 * sigma * sigma) * params.maturity())
                / sigmaSqrtT;
        double d2 = d1 - sigmaSqrtT;

        double forwardSpot = params.spot() * params.dividendDiscountFactor();
        double discountedStrike = params.strike() * params.discountFactor();

        double call = forwardSpot * NormalDistribution.cdf(d1) - discountedStrike * NormalDistribution.cdf(d2);
        double put = discountedStrike * NormalDistribution.cdf(-d2) - forwardSpot * NormalDistribution.cdf(-d1);

        log.debug("[BS] d1={}, d2={}, call={}, put={}", d1, d2, call, put);
        return new AnalyticalPrice(call, put);
    }
}
