package com.optionpricing.engine.domain.service.montecarlo;

import com.optionpricing.engine.domain.model.ConvergenceResult;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.OptionType;
import com.optionpricing.engine.domain.model.PathBundle;
import com.optionpricing.engine.domain.model.PriceEstimate;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.domain.service.AnalyticalPricer;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Prices the call at each point of a linearly spaced sample-size ladder, every point
 * from freshly simulated paths, next to the analytical call price.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConvergenceAnalyzer {

    private final PathSimulator pathSimulator;
    private final VarianceReducedEstimator estimator;
    private final AnalyticalPricer analyticalPricer;
    private final MonteCarloProperties properties;

    public ConvergenceResult analyze(ModelParameters params, SimulationMethod method, RandomGenerator rng) {
        MonteCarloProperties.Convergence settings = properties.getConvergence();
        List<Integer> ladder = sampleSizeLadder(
                settings.getMinSimulations(), settings.getMaxSimulations(), settings.getPoints());
        int numSteps = settings.getNumSteps();
        if (numSteps <= 0) {
            throw new InvalidParameterException("numSteps", numSteps, "must be positive");
        }

        double baseline = analyticalPricer.price(params).callPrice();

        long startNano = System.nanoTime();
        List<Double> callPrices = new ArrayList<>(ladder.size());
        for (int numSimulations : ladder) {
            PathBundle bundle = pathSimulator.simulate(
                    params, numSteps, numSimulations, method.usesAntitheticPaths(), 0, rng);
            PriceEstimate call = estimator.estimate(bundle.terminalPrices(), params, method, OptionType.CALL);
            callPrices.add(call.price());
        }

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.debug("[Convergence] ladder evaluated: method={}, points={}, steps={}, elapsed={}ms",
                method.getCode(), ladder.size(), numSteps, elapsedMs);

        return ConvergenceResult.builder()
                .method(method)
                .sampleSizes(ladder)
                .callPrices(callPrices)
                .analyticalCallPrices(Collections.nCopies(ladder.size(), baseline))
                .build();
    }

    /**
     * {@code points} values linearly spaced over [min, max], both ends included, truncated to int.
     */
    static List<Integer> sampleSizeLadder(int min, int max, int points) {
        if (min <= 0) {
            throw new InvalidParameterException("minSimulations", min, "must be positive");
        }
        if (max < min) {
            throw new InvalidParameterException("maxSimulations", max, "must not be below minSimulations");
        }
        if (points < 1) {
            throw new InvalidParameterException("points", points, "must be positive");
        }
        if (points == 1) {
            return List.of(min);
        }

        List<Integer> ladder = new ArrayList<>(points);
        for (int i = 0; i < points - 1; i++) {
            ladder.add((int) (min + (max - min) * (double) i / (points - 1)));
        }
        ladder.add(max);
        return Collections.unmodifiableList(ladder);
    }
}
