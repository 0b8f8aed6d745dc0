package com.optionpricing.engine.domain.service;

import com.optionpricing.engine.domain.model.VolatilityEstimate;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Annualized close-to-close volatility: population standard deviation of daily
 * log returns scaled by sqrt(trading days per year).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistoricalVolatilityCalculator {

    private final MarketProperties properties;

    public VolatilityEstimate estimate(List<Double> closes) {
        if (closes == null || closes.size() < 2) {
            throw new InvalidParameterException("closes", closes == null ? null : closes.size(),
                    "at least two closing prices are required");
        }

        double[] logReturns = computeLogReturns(closes);
        double dailyStdDev = new StandardDeviation(false).evaluate(logReturns);
        double annualized = dailyStdDev * Math.sqrt(properties.getTradingDaysPerYear());
        double currentPrice = closes.get(closes.size() - 1);

        log.debug("[Volatility] close-to-close: observations={}, sigmaDaily={}, sigmaAnnual={}",
                closes.size(), dailyStdDev, annualized);

        return new VolatilityEstimate(currentPrice, annualized, closes.size(), properties.getDefaultRiskFreeRate());
    }

    private double[] computeLogReturns(List<Double> closes) {
        double[] returns = new double[closes.size() - 1];
        double prev = requireValidClose(closes, 0);
        for (int i = 1; i < closes.size(); i++) {
            double curr = requireValidClose(closes, i);
            returns[i - 1] = Math.log(curr / prev);
            prev = curr;
        }
        return returns;
    }

    private double requireValidClose(List<Double> closes, int index) {
        Double close = closes.get(index);
        if (close == null || !Double.isFinite(close) || close <= 0) {
            throw new InvalidParameterException("closes[" + index + "]", close, "must be a positive finite price");
        }
        return close;
    }
}
