package com.optionpricing.engine.domain.service.montecarlo;

import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.OptionType;
import com.optionpricing.engine.domain.model.PriceEstimate;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.springframework.stereotype.Component;

/**
 * Turns terminal prices into a discounted price and standard error.
 *
 * <ul>
 *   <li>standard: mean and sample standard deviation of the payoffs
 *   <li>antithetic: the standard formula over payoffs of (Z, -Z) paired paths
 *   <li>control_variate: payoff - beta * (ST - E[ST]) with beta = Cov(payoff, ST) / Var(ST)
 * </ul>
 */
@Slf4j
@Component
public class VarianceReducedEstimator {

    public PriceEstimate estimate(double[] terminalPrices, ModelParameters params,
                                  SimulationMethod method, OptionType optionType) {
        if (terminalPrices == null || terminalPrices.length == 0) {
            throw new InvalidParameterException("terminalPrices", "empty", "at least one terminal price is required");
        }
        if (method == null) {
            throw new InvalidParameterException("method", null, "must be provided");
        }
        if (optionType == null) {
            throw new InvalidParameterException("optionType", null, "must be provided");
        }

        double strike = params.strike();
        double[] payoffs = new double[terminalPrices.length];
        for (int i = 0; i < terminalPrices.length; i++) {
            payoffs[i] = optionType.payoff(terminalPrices[i], strike);
        }

        double discount = params.discountFactor();
        return switch (method) {
            case STANDARD, ANTITHETIC -> discounted(payoffs, discount);
            case CONTROL_VARIATE -> controlVariate(payoffs, terminalPrices, params, discount, optionType);
        };
    }

    private PriceEstimate discounted(double[] samples, double discount) {
        double mean = new Mean().evaluate(samples);
        double stdDev = new StandardDeviation().evaluate(samples);
        return new PriceEstimate(discount * mean, discount * stdDev / Math.sqrt(samples.length));
    }

    private PriceEstimate controlVariate(double[] payoffs, double[] terminalPrices, ModelParameters params,
                                         double discount, OptionType optionType) {
        double expectedTerminal = params.expectedTerminalPrice();
        double varTerminal = new Variance().evaluate(terminalPrices);

        double beta;
        if (varTerminal > 0) {
            beta = new Covariance().covariance(payoffs, terminalPrices) / varTerminal;
        } else {
            log.debug("[Estimator] control variate has zero variance, beta=0: type={}, paths={}",
                    optionType, terminalPrices.length);
            beta = 0.0;
        }

        double[] adjusted = new double[payoffs.length];
        for (int i = 0; i < payoffs.length; i++) {
            adjusted[i] = payoffs[i] - beta * (terminalPrices[i] - expectedTerminal);
        }

        log.debug("[Estimator] control variate: type={}, beta={}, E[ST]={}", optionType, beta, expectedTerminal);
        return discounted(adjusted, discount);
    }
}
