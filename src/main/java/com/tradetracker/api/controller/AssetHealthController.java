package com.tradetracker.api.controller;

import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.domain.model.CircuitBreakerSummary;
import com.tradetracker.risk.CircuitBreakerService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the circuit breaker.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/assets/status -- status of one (symbol, direction, source) key</li>
 *   <li>GET /api/assets/position-size -- position size multiplier for one key</li>
 *   <li>GET /api/assets/summary -- all records, recent alerts and counts</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/assets")
public class AssetHealthController {

    private final CircuitBreakerService circuitBreakerService;

    public AssetHealthController(CircuitBreakerService circuitBreakerService) {
        this.circuitBreakerService = circuitBreakerService;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus(
            @RequestParam String symbol, @RequestParam TradeDirection direction, @RequestParam String source) {
        AssetKey key = new AssetKey(symbol, direction, source);
        AssetStatus status = circuitBreakerService.checkAssetStatus(key);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key.toString());
        body.put("status", status);
        body.put("tradable", status.allowsTrading());
        circuitBreakerService.getAssetHealth(key).ifPresent(health -> {
            body.put("profile", health.getStrategyProfile());
            body.put("reason", health.getPauseReason());
            body.put("pauseCount", health.getPauseCount());
        });
        return ResponseEntity.ok(body);
    }

    @GetMapping("/position-size")
    public ResponseEntity<Map<String, Object>> getPositionSize(
            @RequestParam String symbol, @RequestParam TradeDirection direction, @RequestParam String source) {
        AssetKey key = new AssetKey(symbol, direction, source);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key.toString());
        body.put("multiplier", circuitBreakerService.positionSizeMultiplier(key));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/summary")
    public ResponseEntity<CircuitBreakerSummary> getSummary() {
        return ResponseEntity.ok(circuitBreakerService.getSummary());
    }
}
