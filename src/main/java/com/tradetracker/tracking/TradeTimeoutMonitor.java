package com.tradetracker.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically closes trades that have been open longer than the timeout horizon. */
@Component
public class TradeTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(TradeTimeoutMonitor.class);

    private final TradeTrackingEngine tradeTrackingEngine;

    public TradeTimeoutMonitor(TradeTrackingEngine tradeTrackingEngine) {
        this.tradeTrackingEngine = tradeTrackingEngine;
    }

    @Scheduled(
            fixedDelayString = "${tradetracker.tracking.timeout-check-interval-ms:60000}",
            initialDelayString = "${tradetracker.tracking.timeout-check-interval-ms:60000}")
    public void checkTimeouts() {
        try {
            int closed = tradeTrackingEngine.closeTimedOutTrades();
            if (closed > 0) {
                log.info("Closed {} timed-out trades", closed);
            }
        } catch (Exception e) {
            log.error("Timeout check failed: {}", e.getMessage(), e);
        }
    }
}
