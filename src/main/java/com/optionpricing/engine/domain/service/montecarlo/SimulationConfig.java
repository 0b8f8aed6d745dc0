package com.optionpricing.engine.domain.service.montecarlo;

import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.exception.InvalidParameterException;

/**
 * @param seed optional generator seed; {@code null} draws from an unseeded generator
 */
public record SimulationConfig(int numSimulations, int numSteps, SimulationMethod method, Long seed) {

    public static final int MAX_SIMULATIONS = 5_000_000;
    public static final int MAX_STEPS = 100_000;

    public SimulationConfig {
        if (numSimulations <= 0) {
            throw new InvalidParameterException("numSimulations", numSimulations, "must be positive");
        }
        if (numSimulations > MAX_SIMULATIONS) {
            throw new InvalidParameterException("numSimulations", numSimulations, "must not exceed " + MAX_SIMULATIONS);
        }
        if (numSteps <= 0) {
            throw new InvalidParameterException("numSteps", numSteps, "must be positive");
        }
        if (numSteps > MAX_STEPS) {
            throw new InvalidParameterException("numSteps", numSteps, "must not exceed " + MAX_STEPS);
        }
        if (method == null) {
            throw new InvalidParameterException("method", null, "must be provided");
        }
    }

    public static SimulationConfig of(int numSimulations, int numSteps, String methodCode) {
        return new SimulationConfig(numSimulations, numSteps, SimulationMethod.fromCode(methodCode), null);
    }

    public SimulationConfig withSeed(Long newSeed) {
        return new SimulationConfig(numSimulations, numSteps, method, newSeed);
    }
}
