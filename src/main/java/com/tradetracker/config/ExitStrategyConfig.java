package com.tradetracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Defaults for the exit evaluators. Per-trade fields override these where present. */
@Configuration
@ConfigurationProperties(prefix = "tradetracker.exit")
@Getter
@Setter
public class ExitStrategyConfig {

    private double momentumWindowMinutes = 5.0;

    private double momentumThresholdPct = 0.5;

    /** Base trailing distance in percent before state and volatility multipliers. */
    private double trailingBaseDistancePct = 2.0;

    private double preTp1Multiplier = 1.5;

    private double tp1Tp2Multiplier = 1.0;

    private double postTp2Multiplier = 0.7;
}
