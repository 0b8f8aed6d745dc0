package com.optionpricing.engine.report;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@Profile("report")
@ConfigurationProperties(prefix = "report")
public class ReportProperties {

    private double spot = 100.0;
    private double strike = 100.0;
    private double maturity = 1.0;
    private double rate = 0.05;
    private double volatility = 0.2;
    private int numSimulations = 100_000;
    private int numSteps = 252;
    private String method = "standard";
    private Long seed;
}
