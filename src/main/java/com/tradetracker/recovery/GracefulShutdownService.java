package com.tradetracker.recovery;

import com.tradetracker.marketdata.ConnectionMultiplexer;
import com.tradetracker.tracking.TradeTrackingEngine;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Orderly shutdown of the tracker.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs BEFORE the
 * datasource and executors shut down. The shutdown sequence:
 * <ol>
 *   <li>Stop the tracking engine: release subscriptions and flush buffered writes to H2</li>
 *   <li>Shut down the connection multiplexer: cancel watch loops and close venue sockets</li>
 * </ol>
 *
 * <p>Trades are NOT closed. They stay ACTIVE in the database and are reloaded on the
 * next start.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final TradeTrackingEngine tradeTrackingEngine;
    private final ConnectionMultiplexer connectionMultiplexer;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public GracefulShutdownService(
            TradeTrackingEngine tradeTrackingEngine, ConnectionMultiplexer connectionMultiplexer) {
        this.tradeTrackingEngine = tradeTrackingEngine;
        this.connectionMultiplexer = connectionMultiplexer;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        log.info("Graceful shutdown initiated...");
        try {
            stopTracking();
            shutdownMarketData();
            log.info("Graceful shutdown completed");
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    void stopTracking() {
        try {
            tradeTrackingEngine.stop();
            log.info("Trade tracking stopped, pending writes flushed");
        } catch (Exception e) {
            log.error("Failed to stop trade tracking cleanly", e);
        }
    }

    void shutdownMarketData() {
        try {
            connectionMultiplexer.shutdown();
            log.info("Market data connections closed");
        } catch (Exception e) {
            log.warn("Failed to shut down market data connections cleanly", e);
        }
    }
}
