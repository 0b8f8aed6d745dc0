package com.optionpricing.engine.domain.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    private double defaultRiskFreeRate = 0.045;
    private int tradingDaysPerYear = 252;
}
