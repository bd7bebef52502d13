package com.tradetracker.observability;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.TradeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the tracker.
 *
 * <ul>
 *   <li><b>ticks.processed</b> / <b>ticks.throttled</b> (counters): instrument ticks
 *       handled by the engine vs dropped by the per-instrument rate limit</li>
 *   <li><b>tick.processing</b> (timer): time to evaluate all trades for one tick</li>
 *   <li><b>trades.closed</b> (counter, tag outcome)</li>
 *   <li><b>batch.flush.failures</b> (counter): commits rolled back and re-queued</li>
 *   <li><b>venue.failovers</b>, <b>venue.polling.fallbacks</b>, <b>watch.restarts</b> (counters)</li>
 *   <li><b>asset.status.changes</b> (counter, tag status)</li>
 * </ul>
 *
 * <p>Gauges are registered by the components that own the measured state via
 * {@link #registerGauge}, keeping this service free of dependencies on them.
 */
@Service
public class TrackerMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter ticksProcessed;
    private final Counter ticksThrottled;
    private final Counter flushFailures;
    private final Counter venueFailovers;
    private final Counter pollingFallbacks;
    private final Counter watchRestarts;
    private final Timer tickProcessingTimer;
    private final Map<TradeOutcome, Counter> closedByOutcome = new EnumMap<>(TradeOutcome.class);
    private final Map<AssetStatus, Counter> statusChanges = new EnumMap<>(AssetStatus.class);

    public TrackerMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.ticksProcessed = Counter.builder("ticks.processed")
                .description("Instrument ticks evaluated against open trades")
                .register(meterRegistry);
        this.ticksThrottled = Counter.builder("ticks.throttled")
                .description("Instrument ticks dropped by the processing interval")
                .register(meterRegistry);
        this.flushFailures = Counter.builder("batch.flush.failures")
                .description("Batch commits that failed and were re-queued")
                .register(meterRegistry);
        this.venueFailovers = Counter.builder("venue.failovers")
                .description("Streaming venue failures that moved a symbol to the next venue")
                .register(meterRegistry);
        this.pollingFallbacks = Counter.builder("venue.polling.fallbacks")
                .description("Symbols that fell back to REST polling")
                .register(meterRegistry);
        this.watchRestarts = Counter.builder("watch.restarts")
                .description("Watch loops restarted by the health monitor")
                .register(meterRegistry);
        this.tickProcessingTimer = Timer.builder("tick.processing")
                .description("Time to evaluate all trades of an instrument for one tick")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        for (TradeOutcome outcome : TradeOutcome.values()) {
            closedByOutcome.put(
                    outcome,
                    Counter.builder("trades.closed")
                            .tag("outcome", outcome.name())
                            .register(meterRegistry));
        }
        for (AssetStatus status : AssetStatus.values()) {
            statusChanges.put(
                    status,
                    Counter.builder("asset.status.changes")
                            .tag("status", status.name())
                            .register(meterRegistry));
        }
    }

    public void registerGauge(String name, String description, Supplier<Number> supplier) {
        Gauge.builder(name, supplier).description(description).register(meterRegistry);
    }

    public void recordTickProcessed(long elapsedNanos) {
        ticksProcessed.increment();
        tickProcessingTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordTickThrottled() {
        ticksThrottled.increment();
    }

    public void recordTradeClosed(TradeOutcome outcome) {
        closedByOutcome.get(outcome).increment();
    }

    public void recordFlushFailure() {
        flushFailures.increment();
    }

    public void recordVenueFailover() {
        venueFailovers.increment();
    }

    public void recordPollingFallback() {
        pollingFallbacks.increment();
    }

    public void recordWatchRestart() {
        watchRestarts.increment();
    }

    public void recordStatusChange(AssetStatus status) {
        statusChanges.get(status).increment();
    }
}
