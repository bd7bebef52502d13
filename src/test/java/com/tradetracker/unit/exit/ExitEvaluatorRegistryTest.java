package com.tradetracker.unit.exit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradetracker.config.ExitStrategyConfig;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.exit.AdaptiveTrailingEvaluator;
import com.tradetracker.exit.EarlyMomentumEvaluator;
import com.tradetracker.exit.ExitEvaluatorRegistry;
import com.tradetracker.exit.StaticStopEvaluator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExitEvaluatorRegistryTest {

    private final ExitStrategyConfig config = new ExitStrategyConfig();

    @Test
    @DisplayName("forStrategy: returns the evaluator bound to each strategy")
    void dispatchByStrategy() {
        ExitEvaluatorRegistry registry = new ExitEvaluatorRegistry(List.of(
                new StaticStopEvaluator(), new EarlyMomentumEvaluator(config), new AdaptiveTrailingEvaluator(config)));

        assertThat(registry.forStrategy(RiskStrategy.STATIC)).isInstanceOf(StaticStopEvaluator.class);
        assertThat(registry.forStrategy(RiskStrategy.EARLY_MOMENTUM)).isInstanceOf(EarlyMomentumEvaluator.class);
        assertThat(registry.forStrategy(RiskStrategy.ADAPTIVE_TRAILING))
                .isInstanceOf(AdaptiveTrailingEvaluator.class);
    }

    @Test
    @DisplayName("forStrategy: null or unregistered strategy falls back to the static stop")
    void fallbackToStatic() {
        ExitEvaluatorRegistry registry = new ExitEvaluatorRegistry(List.of(new StaticStopEvaluator()));

        assertThat(registry.forStrategy(null)).isInstanceOf(StaticStopEvaluator.class);
        assertThat(registry.forStrategy(RiskStrategy.ADAPTIVE_TRAILING)).isInstanceOf(StaticStopEvaluator.class);
    }

    @Test
    @DisplayName("constructor: duplicate strategy registration fails")
    void duplicateRejected() {
        assertThatThrownBy(() -> new ExitEvaluatorRegistry(List.of(new StaticStopEvaluator(), new StaticStopEvaluator())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("constructor: missing static evaluator fails")
    void staticRequired() {
        assertThatThrownBy(() -> new ExitEvaluatorRegistry(List.of(new EarlyMomentumEvaluator(config))))
                .isInstanceOf(IllegalStateException.class);
    }
}
