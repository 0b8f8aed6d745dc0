package com.optionpricing.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EstimationResult {

    private double callPrice;
    private double callStdErr;
    private double putPrice;
    private double putStdErr;
    private SimulationMethod method;
    private int numSimulations;
    private int numSteps;
    /** First paths of the run, indexed [path][step]. */
    private double[][] paths;
    private int[] steps;
    private long calcDurationMicros;
}
