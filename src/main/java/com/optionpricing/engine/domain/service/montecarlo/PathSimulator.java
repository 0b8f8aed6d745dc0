package com.optionpricing.engine.domain.service.montecarlo;

import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.PathBundle;
import com.optionpricing.engine.exception.InvalidParameterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.random.RandomGenerator;

/**
 * Risk-neutral GBM paths. Each path accumulates i.i.d. log increments
 * {@code (r - q - sigma^2/2) dt + sigma sqrt(dt) Z} on top of ln(S0).
 *
 * <p>In antithetic mode paths 2k and 2k+1 share every draw with opposite sign.
 * For an odd path count the last path is unpaired and uses its own draws.
 */
@Slf4j
@Component
public class PathSimulator {

    public PathBundle simulate(ModelParameters params, int numSteps, int numSimulations,
                               boolean antithetic, RandomGenerator rng) {
        return simulate(params, numSteps, numSimulations, antithetic, numSimulations, rng);
    }

    public PathBundle simulate(ModelParameters params, int numSteps, int numSimulations,
                               boolean antithetic, int retainedPaths, RandomGenerator rng) {
        validate(numSteps, numSimulations, retainedPaths);

        double dt = params.maturity() / numSteps;
        double sigma = params.volatility();
        double drift = (params.rate() - params.dividendYield() - 0.5 * sigma * sigma) * dt;
        double diffusion = sigma * Math.sqrt(dt);
        double logSpot = Math.log(params.spot());

        int retainCount = Math.min(retainedPaths, numSimulations);
        double[] terminal = new double[numSimulations];
        double[][] retained = new double[numSteps + 1][retainCount];
        for (int i = 0; i < retainCount; i++) {
            retained[0][i] = params.spot();
        }

        long startNano = System.nanoTime();

        int path = 0;
        if (antithetic) {
            for (; path + 1 < numSimulations; path += 2) {
                double logA = logSpot;
                double logB = logSpot;
                for (int t = 1; t <= numSteps; t++) {
                    double z = rng.nextGaussian();
                    logA += drift + diffusion * z;
                    logB += drift - diffusion * z;
                    if (path + 1 < retainCount) {
                        retained[t][path] = Math.exp(logA);
                        retained[t][path + 1] = Math.exp(logB);
                    } else if (path < retainCount) {
                        retained[t][path] = Math.exp(logA);
                    }
                }
                terminal[path] = Math.exp(logA);
                terminal[path + 1] = Math.exp(logB);
            }
        }
        for (; path < numSimulations; path++) {
            double logS = logSpot;
            for (int t = 1; t <= numSteps; t++) {
                logS += drift + diffusion * rng.nextGaussian();
                if (path < retainCount) {
                    retained[t][path] = Math.exp(logS);
                }
            }
            terminal[path] = Math.exp(logS);
        }

        long elapsedMs = (System.nanoTime() - startNano) / 1_000_000;
        log.debug("[PathSimulator] generated: paths={}, steps={}, antithetic={}, retained={}, elapsed={}ms",
                numSimulations, numSteps, antithetic, retainCount, elapsedMs);

        return new PathBundle(numSteps, terminal, retained);
    }

    private void validate(int numSteps, int numSimulations, int retainedPaths) {
        if (numSteps <= 0) {
            throw new InvalidParameterException("numSteps", numSteps, "must be positive");
        }
        if (numSteps > SimulationConfig.MAX_STEPS) {
            throw new InvalidParameterException("numSteps", numSteps, "must not exceed " + SimulationConfig.MAX_STEPS);
        }
        if (numSimulations <= 0) {
            throw new InvalidParameterException("numSimulations", numSimulations, "must be positive");
        }
        if (numSimulations > SimulationConfig.MAX_SIMULATIONS) {
            throw new InvalidParameterException("numSimulations", numSimulations,
                    "must not exceed " + SimulationConfig.MAX_SIMULATIONS);
        }
        if (retainedPaths < 0) {
            throw new InvalidParameterException("retainedPaths", retainedPaths, "must not be negative");
        }
    }
}
