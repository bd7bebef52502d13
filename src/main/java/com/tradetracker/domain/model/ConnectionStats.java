package com.tradetracker.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Point-in-time view of the connection multiplexer. */
@Value
@Builder
public class ConnectionStats {

    int totalSymbols;
    int totalSubscribers;
    int activeStreams;
    int pollingSymbols;

    /** Venue name to number of symbols currently served by it ("polling" for fallback). */
    Map<String, Integer> venueDistribution;

    /** Seconds since the last tick per symbol. */
    Map<String, Long> lastTickAgeSeconds;
}
