package com.optionpricing.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulateRequest extends OptionParametersRequest {

    @JsonProperty("steps")
    private Integer numSteps;

    @JsonProperty("sims")
    private Integer numSimulations;

    private String method;

    private Long seed;
}
