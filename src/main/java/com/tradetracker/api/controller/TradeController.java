package com.tradetracker.api.controller;

import com.tradetracker.domain.model.Trade;
import com.tradetracker.exception.ResourceNotFoundException;
import com.tradetracker.tracking.TradeTrackingEngine;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trades")
public class TradeController {

    private final TradeTrackingEngine tradeTrackingEngine;

    public TradeController(TradeTrackingEngine tradeTrackingEngine) {
        this.tradeTrackingEngine = tradeTrackingEngine;
    }

    @GetMapping("/active")
    public ResponseEntity<List<Trade>> getActiveTrades() {
        return ResponseEntity.ok(tradeTrackingEngine.getActiveTrades());
    }

    @GetMapping("/active/{tradeId}")
    public ResponseEntity<Trade> getActiveTrade(@PathVariable Long tradeId) {
        return tradeTrackingEngine
                .findActiveTrade(tradeId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Active trade", tradeId));
    }
}
