package com.optionpricing.engine.domain.model;

/**
 * Simulated GBM prices for one run. The terminal price of every path is kept;
 * full trajectories are kept only for the first {@link #getRetainedPathCount()} paths,
 * indexed [step][path] with step 0 equal to S0.
 */
public final class PathBundle {

    private final int numSteps;
    private final double[] terminalPrices;
    private final double[][] retained;

    public PathBundle(int numSteps, double[] terminalPrices, double[][] retained) {
        if (retained.length != numSteps + 1) {
            throw new IllegalArgumentException("retained matrix must have numSteps + 1 rows");
        }
        this.numSteps = numSteps;
        this.terminalPrices = terminalPrices;
        this.retained = retained;
    }

    public int getNumSteps() {
        return numSteps;
    }

    public int getNumSimulations() {
        return terminalPrices.length;
    }

    public int getRetainedPathCount() {
        return retained[0].length;
    }

    /**
     * Terminal prices of all paths. The array belongs to this bundle; callers must not modify it.
     */
    public double[] terminalPrices() {
        return terminalPrices;
    }

    /**
     * Copies the first {@code limit} retained paths, one row per path and one column per step.
     */
    public double[][] samplePaths(int limit) {
        int rows = Math.min(Math.max(limit, 0), getRetainedPathCount());
        double[][] sample = new double[rows][numSteps + 1];
        for (int t = 0; t <= numSteps; t++) {
            for (int i = 0; i < rows; i++) {
                sample[i][t] = retained[t][i];
            }
        }
        return sample;
    }
}
