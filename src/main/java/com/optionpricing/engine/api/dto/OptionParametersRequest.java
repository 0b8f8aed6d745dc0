package com.optionpricing.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.optionpricing.engine.domain.model.ModelParameters;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OptionParametersRequest {

    @NotNull(message = "S0 is required")
    @JsonProperty("S0")
    private Double spot;

    @NotNull(message = "K is required")
    @JsonProperty("K")
    private Double strike;

    @NotNull(message = "T is required")
    @JsonProperty("T")
    private Double maturity;

    @NotNull(message = "r is required")
    @JsonProperty("r")
    private Double rate;

    @NotNull(message = "sigma is required")
    @JsonProperty("sigma")
    private Double volatility;

    @JsonProperty("q")
    private Double dividendYield;

    public ModelParameters toModelParameters() {
        return new ModelParameters(spot, strike, maturity, rate, volatility,
                dividendYield != null ? dividendYield : 0.0);
    }
}
