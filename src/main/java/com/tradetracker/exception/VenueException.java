package com.tradetracker.exception;

import java.util.Map;

/**
 * Failure talking to a market-data venue. Always recoverable from the caller's
 * point of view: the multiplexer fails over to the next venue or to polling.
 */
public class VenueException extends BaseException {

    private final String venue;

    public VenueException(String venue, String message) {
        super(ErrorCode.VENUE_ERROR, venue + ": " + message, Map.of("venue", venue));
        this.venue = venue;
    }

    public VenueException(String venue, String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, venue + ": " + message, Map.of("venue", venue), cause);
        this.venue = venue;
    }

    public String getVenue() {
        return venue;
    }
}
