package com.tradetracker.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Snapshot of every asset record plus the alerts raised in the retention window. */
@Value
@Builder
public class CircuitBreakerSummary {

    List<AssetEntry> assets;
    List<CircuitBreakerAlert> alerts;
    int totalAssets;
    int blacklisted;
    int paused;
    int recovery;
    int active;
    int criticalAlerts;
    int highAlerts;

    @Value
    @Builder
    public static class AssetEntry {
        AssetHealth health;

        /** 0-100; null when the record has no metrics yet. */
        Double healthScore;
    }
}
