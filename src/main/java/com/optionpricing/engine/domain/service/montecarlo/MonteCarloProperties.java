package com.optionpricing.engine.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "montecarlo")
public class MonteCarloProperties {

    private int defaultNumSimulations = 5_000;
    private int defaultNumSteps = 252;
    private String defaultMethod = "standard";
    private int samplePathCount = 20;

    private Convergence convergence = new Convergence();

    @Getter
    @Setter
    public static class Convergence {
        private int minSimulations = 100;
        private int maxSimulations = 10_000;
        private int points = 20;
        private int numSteps = 100;
    }
}
