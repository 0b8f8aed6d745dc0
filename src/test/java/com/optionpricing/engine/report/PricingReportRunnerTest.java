package com.optionpricing.engine.report;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.EstimationResult;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.domain.service.OptionPricingService;
import com.optionpricing.engine.domain.service.montecarlo.SimulationConfig;
import com.optionpricing.engine.exception.InvalidParameterException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PricingReportRunnerTest {

    @Mock
    private OptionPricingService pricingService;

    private ReportProperties properties;
    private PricingReportRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ReportProperties();
        runner = new PricingReportRunner(pricingService, properties);
    }

    @Test
    @DisplayName("Table lists analytical and Monte Carlo rows for call and put")
    void comparisonTable() {
        when(pricingService.priceAnalytical(ModelParameters.of(100, 100, 1, 0.05, 0.2)))
                .thenReturn(new AnalyticalPrice(10.450583572185565, 5.573526022256971));
        when(pricingService.simulate(any(), any())).thenReturn(EstimationResult.builder()
                .callPrice(10.4723).callStdErr(0.0466)
                .putPrice(5.5612).putStdErr(0.0279)
                .method(SimulationMethod.STANDARD)
                .numSimulations(100_000).numSteps(252)
                .paths(new double[0][0]).steps(new int[0])
                .build());

        List<String> lines = runner.buildReport();

        assertThat(lines).anySatisfy(line -> assertThat(line).contains("Method", "Option Type", "Price", "Std Error"));
        assertThat(lines).anySatisfy(line -> assertThat(line).contains("Black-Scholes", "Call", "10.4506", "N/A"));
        assertThat(lines).anySatisfy(line -> assertThat(line).contains("Black-Scholes", "Put", "5.5735", "N/A"));
        assertThat(lines).anySatisfy(line -> assertThat(line).contains("Monte Carlo", "Call", "10.4723", "0.0466"));
        assertThat(lines).anySatisfy(line -> assertThat(line).contains("Monte Carlo", "Put", "5.5612", "0.0279"));
        verify(pricingService).simulate(ModelParameters.of(100, 100, 1, 0.05, 0.2),
                new SimulationConfig(100_000, 252, SimulationMethod.STANDARD, null));
    }

    @Test
    void invalidReportInputsFailBeforePricing() {
        properties.setVolatility(-0.2);

        assertThatThrownBy(runner::buildReport)
                .isInstanceOf(InvalidParameterException.class)
                .extracting("parameter").isEqualTo("sigma");
        verifyNoInteractions(pricingService);
    }
}
