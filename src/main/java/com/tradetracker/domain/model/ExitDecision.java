package com.tradetracker.domain.model;

/**
 * Result of one exit evaluation. {@code reason} names the rule that fired and is
 * null when the trade stays open.
 */
public record ExitDecision(boolean close, String reason) {

    private static final ExitDecision KEEP_OPEN = new ExitDecision(false, null);

    public static ExitDecision keepOpen() {
        return KEEP_OPEN;
    }

    public static ExitDecision close(String reason) {
        return new ExitDecision(true, reason);
    }
}
