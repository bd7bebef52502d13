package com.tradetracker.exit;

import com.tradetracker.domain.enums.RiskStrategy;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lookup table from {@link RiskStrategy} to its evaluator, built once from every
 * {@link ExitEvaluator} bean.
 *
 * <p>Adding a strategy: add the enum constant and a new {@code ExitEvaluator} bean
 * returning it from {@code getStrategy()}. A trade with no strategy, or one without
 * a registered evaluator, uses the static stop.
 */
@Component
public class ExitEvaluatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExitEvaluatorRegistry.class);

    private final Map<RiskStrategy, ExitEvaluator> evaluators = new EnumMap<>(RiskStrategy.class);

    public ExitEvaluatorRegistry(List<ExitEvaluator> exitEvaluators) {
        for (ExitEvaluator evaluator : exitEvaluators) {
            ExitEvaluator previous = evaluators.put(evaluator.getStrategy(), evaluator);
            if (previous != null) {
                throw new IllegalStateException("Two exit evaluators registered for " + evaluator.getStrategy() + ": "
                        + previous.getClass().getSimpleName() + ", " + evaluator.getClass().getSimpleName());
            }
        }
        if (!evaluators.containsKey(RiskStrategy.STATIC)) {
            throw new IllegalStateException("No exit evaluator registered for " + RiskStrategy.STATIC);
        }
        log.info("Exit evaluators registered: {}", evaluators.keySet());
    }

    public ExitEvaluator forStrategy(RiskStrategy strategy) {
        ExitEvaluator evaluator = strategy != null ? evaluators.get(strategy) : null;
        return evaluator != null ? evaluator : evaluators.get(RiskStrategy.STATIC);
    }
}
