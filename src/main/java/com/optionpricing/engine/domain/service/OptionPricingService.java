package com.optionpricing.engine.domain.service;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.ConvergenceResult;
import com.optionpricing.engine.domain.model.EstimationResult;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.OptionType;
import com.optionpricing.engine.domain.model.PathBundle;
import com.optionpricing.engine.domain.model.PriceEstimate;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.domain.service.montecarlo.ConvergenceAnalyzer;
import com.optionpricing.engine.domain.service.montecarlo.MonteCarloProperties;
import com.optionpricing.engine.domain.service.montecarlo.PathSimulator;
import com.optionpricing.engine.domain.service.montecarlo.RandomGeneratorFactory;
import com.optionpricing.engine.domain.service.montecarlo.SimulationConfig;
import com.optionpricing.engine.domain.service.montecarlo.VarianceReducedEstimator;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.random.RandomGenerator;
import java.util.stream.IntStream;

/**
 * Entry point for callers of the pricing engine. Inputs arrive as validated value
 * objects, so every rejection happens before the first random draw.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptionPricingService {

    private final AnalyticalPricer analyticalPricer;
    private final PathSimulator pathSimulator;
    private final VarianceReducedEstimator estimator;
    private final ConvergenceAnalyzer convergenceAnalyzer;
    private final RandomGeneratorFactory randomGeneratorFactory;
    private final MonteCarloProperties properties;
    private final PricingMetricsCollector metrics;

    public AnalyticalPrice priceAnalytical(ModelParameters params) {
        requireParams(params);
        return analyticalPricer.price(params);
    }

    public EstimationResult simulate(ModelParameters params, SimulationConfig config) {
        requireParams(params);
        if (config == null) {
            throw new InvalidParameterException("config", null, "must be provided");
        }

        SimulationMethod method = config.method();
        RandomGenerator rng = randomGeneratorFactory.create(config.seed());
        int samplePathCount = properties.getSamplePathCount();

        long startNano = System.nanoTime();

        PathBundle bundle = pathSimulator.simulate(params, config.numSteps(), config.numSimulations(),
                method.usesAntitheticPaths(), samplePathCount, rng);
        PriceEstimate call = estimator.estimate(bundle.terminalPrices(), params, method, OptionType.CALL);
        PriceEstimate put = estimator.estimate(bundle.terminalPrices(), params, method, OptionType.PUT);

        long elapsedNanos = System.nanoTime() - startNano;
        metrics.recordSimulation(method.getCode(), elapsedNanos);
        log.info("[MC] simulation complete: method={}, paths={}, steps={}, call={}±{}, put={}±{}, elapsed={}ms",
                method.getCode(), config.numSimulations(), config.numSteps(),
                call.price(), call.standardError(), put.price(), put.standardError(),
                elapsedNanos / 1_000_000);

        return EstimationResult.builder()
                .callPrice(call.price())
                .callStdErr(call.standardError())
                .putPrice(put.price())
                .putStdErr(put.standardError())
                .method(method)
                .numSimulations(config.numSimulations())
                .numSteps(config.numSteps())
                .paths(bundle.samplePaths(samplePathCount))
                .steps(IntStream.rangeClosed(0, config.numSteps()).toArray())
                .calcDurationMicros(elapsedNanos / 1_000)
                .build();
    }

    public ConvergenceResult analyzeConvergence(ModelParameters params, String methodCode) {
        return analyzeConvergence(params, SimulationMethod.fromCode(methodCode), null);
    }

    public ConvergenceResult analyzeConvergence(ModelParameters params, SimulationMethod method, Long seed) {
        requireParams(params);
        if (method == null) {
            throw new InvalidParameterException("method", null, "must be provided");
        }

        long startNano = System.nanoTime();
        ConvergenceResult result = convergenceAnalyzer.analyze(params, method, randomGeneratorFactory.create(seed));
        long elapsedNanos = System.nanoTime() - startNano;

        metrics.recordConvergence(method.getCode(), elapsedNanos);
        log.info("[MC] convergence complete: method={}, points={}, elapsed={}ms",
                method.getCode(), result.getSampleSizes().size(), elapsedNanos / 1_000_000);
        return result;
    }

    private void requireParams(ModelParameters params) {
        if (params == null) {
            throw new InvalidParameterException("params", null, "must be provided");
        }
    }
}
