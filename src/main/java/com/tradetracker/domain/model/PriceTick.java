package com.tradetracker.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single price update received from a market-data venue, already keyed by the
 * venue-neutral symbol.
 */
public record PriceTick(String symbol, BigDecimal price, LocalDateTime timestamp, String venue) {}
