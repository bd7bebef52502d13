package com.tradetracker.api.controller;

import com.tradetracker.domain.model.ConnectionStats;
import com.tradetracker.marketdata.ConnectionMultiplexer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the market data connections. */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final ConnectionMultiplexer connectionMultiplexer;

    public MarketDataController(ConnectionMultiplexer connectionMultiplexer) {
        this.connectionMultiplexer = connectionMultiplexer;
    }

    @GetMapping("/stats")
    public ResponseEntity<ConnectionStats> getStats() {
        return ResponseEntity.ok(connectionMultiplexer.getConnectionStats());
    }
}
