package com.optionpricing.engine.api;

import com.optionpricing.engine.api.dto.ConvergenceRequest;
import com.optionpricing.engine.api.dto.OptionParametersRequest;
import com.optionpricing.engine.api.dto.OptionPriceResponse;
import com.optionpricing.engine.api.dto.SimulateRequest;
import com.optionpricing.engine.api.dto.SimulationResponse;
import com.optionpricing.engine.api.dto.VolatilityRequest;
import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.ConvergenceResult;
import com.optionpricing.engine.domain.model.EstimationResult;
import com.optionpricing.engine.domain.model.ModelParameters;
import com.optionpricing.engine.domain.model.OptionType;
import com.optionpricing.engine.domain.model.SimulationMethod;
import com.optionpricing.engine.domain.model.VolatilityEstimate;
import com.optionpricing.engine.domain.service.HistoricalVolatilityCalculator;
import com.optionpricing.engine.domain.service.OptionPricingService;
import com.optionpricing.engine.domain.service.montecarlo.MonteCarloProperties;
import com.optionpricing.engine.domain.service.montecarlo.SimulationConfig;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class PricingController {

    private final OptionPricingService pricingService;
    private final HistoricalVolatilityCalculator volatilityCalculator;
    private final MonteCarloProperties properties;

    @PostMapping("/analytical")
    public ResponseEntity<AnalyticalPrice> analytical(@Valid @RequestBody OptionParametersRequest request) {
        return ResponseEntity.ok(pricingService.priceAnalytical(request.toModelParameters()));
    }

    @PostMapping("/analytical/{type}")
    public ResponseEntity<OptionPriceResponse> analyticalForType(@PathVariable String type,
                                                                 @Valid @RequestBody OptionParametersRequest request) {
        OptionType optionType = OptionType.fromCode(type);
        AnalyticalPrice analytical = pricingService.priceAnalytical(request.toModelParameters());
        return ResponseEntity.ok(OptionPriceResponse.of(analytical, optionType));
    }

    @PostMapping("/simulate")
    public ResponseEntity<SimulationResponse> simulate(@Valid @RequestBody SimulateRequest request) {
        ModelParameters params = request.toModelParameters();
        SimulationConfig config = new SimulationConfig(
                request.getNumSimulations() != null ? request.getNumSimulations() : properties.getDefaultNumSimulations(),
                request.getNumSteps() != null ? request.getNumSteps() : properties.getDefaultNumSteps(),
                SimulationMethod.fromCode(methodOrDefault(request.getMethod())),
                request.getSeed());

        log.info("[Pricing API] simulate: S0={}, K={}, T={}, method={}, sims={}, steps={}",
                params.spot(), params.strike(), params.maturity(),
                config.method().getCode(), config.numSimulations(), config.numSteps());

        AnalyticalPrice analytical = pricingService.priceAnalytical(params);
        EstimationResult estimate = pricingService.simulate(params, config);
        return ResponseEntity.ok(new SimulationResponse(analytical, estimate));
    }

    @PostMapping("/convergence")
    public ResponseEntity<ConvergenceResult> convergence(@Valid @RequestBody ConvergenceRequest request) {
        ModelParameters params = request.toModelParameters();
        SimulationMethod method = SimulationMethod.fromCode(methodOrDefault(request.getMethod()));

        log.info("[Pricing API] convergence: S0={}, K={}, T={}, method={}",
                params.spot(), params.strike(), params.maturity(), method.getCode());

        return ResponseEntity.ok(pricingService.analyzeConvergence(params, method, request.getSeed()));
    }

    @PostMapping("/volatility")
    public ResponseEntity<VolatilityEstimate> volatility(@Valid @RequestBody VolatilityRequest request) {
        return ResponseEntity.ok(volatilityCalculator.estimate(request.getCloses()));
    }

    private String methodOrDefault(String method) {
        return method != null ? method : properties.getDefaultMethod();
    }
}
