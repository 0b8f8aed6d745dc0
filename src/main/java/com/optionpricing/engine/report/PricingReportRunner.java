package com.optionpricing.engine.report;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.EstimationResult;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.domain.service.OptionPricingService;
import com.optionpricing.engine.domain.service.montecarlo.SimulationConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prints a Black-Scholes versus Monte Carlo comparison table at startup when the
 * {@code report} profile is active. Inputs come from the {@code report.*} properties.
 */
@Slf4j
@Component
@Profile("report")
@RequiredArgsConstructor
public class PricingReportRunner implements CommandLineRunner {

    private static final String ROW = "%-20s | %-11s | %-10s | %-10s";
    private static final String RULE = "-".repeat(60);

    private final OptionPricingService pricingService;
    private final ReportProperties properties;

    @Override
    public void run(String... args) {
        for (String line : buildReport()) {
            log.info(line);
        }
    }

    public List<String> buildReport() {
        ModelParameters params = ModelParameters.of(properties.getSpot(), properties.getStrike(),
                properties.getMaturity(), properties.getRate(), properties.getVolatility());
        SimulationConfig config = new SimulationConfig(properties.getNumSimulations(), properties.getNumSteps(),
                SimulationMethod.fromCode(properties.getMethod()), properties.getSeed());

        AnalyticalPrice analytical = pricingService.priceAnalytical(params);
        EstimationResult estimate = pricingService.simulate(params, config);

        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "[Report] S0=%s, K=%s, T=%s, r=%s, sigma=%s, paths=%d, steps=%d, method=%s",
                params.spot(), params.strike(), params.maturity(), params.rate(), params.volatility(),
                config.numSimulations(), config.numSteps(), config.method().getCode()));
        lines.add(RULE);
        lines.add(String.format(Locale.ROOT, ROW, "Method", "Option Type", "Price", "Std Error"));
        lines.add(RULE);
        lines.add(String.format(Locale.ROOT, ROW, "Black-Scholes", "Call", format(analytical.callPrice()), "N/A"));
        lines.add(String.format(Locale.ROOT, ROW, "Black-Scholes", "Put", format(analytical.putPrice()), "N/A"));
        lines.add(String.format(Locale.ROOT, ROW, "Monte Carlo", "Call", format(estimate.getCallPrice()),
                format(estimate.getCallStdErr())));
        lines.add(String.format(Locale.ROOT, ROW, "Monte Carlo", "Put", format(estimate.getPutPrice()),
                format(estimate.getPutStdErr())));
        lines.add(RULE);
        return lines;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
