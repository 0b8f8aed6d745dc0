package com.optionpricing.engine.domain.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class PricingMetricsCollector {

    static final String SIMULATION_TIMER = "pricing.simulation.duration";
    static final String CONVERGENCE_TIMER = "pricing.convergence.duration";
    static final String REJECTED_COUNTER = "pricing.requests.rejected";

    private final MeterRegistry meterRegistry;

    public PricingMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordSimulation(String method, long elapsedNanos) {
        Timer.builder(SIMULATION_TIMER)
                .tag("method", method)
                .description("Monte Carlo simulate-and-estimate duration")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordConvergence(String method, long elapsedNanos) {
        Timer.builder(CONVERGENCE_TIMER)
                .tag("method", method)
                .description("Convergence ladder duration")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRejected(String parameter) {
        Counter.builder(REJECTED_COUNTER)
                .tag("parameter", parameter == null ? "unknown" : parameter)
                .description("Pricing requests rejected for an invalid parameter")
                .register(meterRegistry)
                .increment();
    }
}
