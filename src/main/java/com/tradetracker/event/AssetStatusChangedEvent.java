package com.tradetracker.event;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.domain.model.CircuitBreakerAlert;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the CircuitBreakerService when an asset key changes status.
 * Pause and blacklist transitions carry the alert raised for them; recovery
 * transitions carry none.
 */
public class AssetStatusChangedEvent extends ApplicationEvent {

    private final AssetKey key;
    private final AssetStatus previousStatus;
    private final AssetStatus newStatus;
    private final String reason;
    private final CircuitBreakerAlert alert;

    public AssetStatusChangedEvent(
            Object source,
            AssetKey key,
            AssetStatus previousStatus,
            AssetStatus newStatus,
            String reason,
            CircuitBreakerAlert alert) {
        super(source);
        this.key = key;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.reason = reason;
        this.alert = alert;
    }

    public AssetKey getKey() {
        return key;
    }

    public AssetStatus getPreviousStatus() {
        return previousStatus;
    }

    public AssetStatus getNewStatus() {
        return newStatus;
    }

    public String getReason() {
        return reason;
    }

    /** Null for transitions that raise no alert. */
    public CircuitBreakerAlert getAlert() {
        return alert;
    }
}
