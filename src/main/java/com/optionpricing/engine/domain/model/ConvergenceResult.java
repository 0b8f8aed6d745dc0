package com.optionpricing.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConvergenceResult {

    private SimulationMethod method;
    private List<Integer> sampleSizes;
    private List<Double> callPrices;
    private List<Double> analyticalCallPrices;
}
