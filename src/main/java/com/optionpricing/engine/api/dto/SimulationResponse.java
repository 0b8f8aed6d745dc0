package com.optionpricing.engine.api.dto;

import com.optionpricing.engine.domain.model.AnalyticalPrice;
import com.optionpricing.engine.domain.model.EstimationResult;

public record SimulationResponse(AnalyticalPrice bs, EstimationResult mc) {
}
