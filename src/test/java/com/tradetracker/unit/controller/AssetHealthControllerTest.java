package com.tradetracker.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradetracker.api.controller.AssetHealthController;
import com.tradetracker.config.ApiResponseAdvice;
import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.model.AssetHealth;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.domain.model.CircuitBreakerSummary;
import com.tradetracker.exception.GlobalExceptionHandler;
import com.tradetracker.risk.CircuitBreakerService;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/** Standalone MockMvc tests for the AssetHealthController. */
@ExtendWith(MockitoExtension.class)
class AssetHealthControllerTest {

    private static final AssetKey KEY = new AssetKey("BTCUSDT", TradeDirection.LONG, "tv");

    private MockMvc mockMvc;

    @Mock
    private CircuitBreakerService circuitBreakerService;

    @InjectMocks
    private AssetHealthController assetHealthController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(assetHealthController)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/assets/status returns status and pause details of a known key")
    void statusOfPausedKey() throws Exception {
        AssetHealth health = AssetHealth.newRecord(KEY, LocalDateTime.of(2024, 3, 1, 0, 0));
        health.setStatus(AssetStatus.PAUSED);
        health.setPauseReason("Consecutive losses: 5 (limit: 5 for STANDARD)");
        health.setPauseCount(1);
        when(circuitBreakerService.checkAssetStatus(KEY)).thenReturn(AssetStatus.PAUSED);
        when(circuitBreakerService.getAssetHealth(KEY)).thenReturn(Optional.of(health));

        mockMvc.perform(get("/api/assets/status")
                        .param("symbol", "BTCUSDT")
                        .param("direction", "LONG")
                        .param("source", "tv"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.key").value("BTCUSDT_LONG_tv"))
                .andExpect(jsonPath("$.data.status").value("PAUSED"))
                .andExpect(jsonPath("$.data.tradable").value(false))
                .andExpect(jsonPath("$.data.profile").value("STANDARD"))
                .andExpect(jsonPath("$.data.pauseCount").value(1));
    }

    @Test
    @DisplayName("GET /api/assets/status on an unknown key is ACTIVE without details")
    void statusOfUnknownKey() throws Exception {
        when(circuitBreakerService.checkAssetStatus(KEY)).thenReturn(AssetStatus.ACTIVE);
        when(circuitBreakerService.getAssetHealth(KEY)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/assets/status")
                        .param("symbol", "BTCUSDT")
                        .param("direction", "LONG")
                        .param("source", "tv"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ACTIVE"))
                .andExpect(jsonPath("$.data.tradable").value(true))
                .andExpect(jsonPath("$.data.profile").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/assets/status without source returns 400")
    void missingParameter() throws Exception {
        mockMvc.perform(get("/api/assets/status").param("symbol", "BTCUSDT").param("direction", "LONG"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.details.parameter").value("source"));
    }

    @Test
    @DisplayName("GET /api/assets/status with an unknown direction returns 400")
    void invalidDirection() throws Exception {
        mockMvc.perform(get("/api/assets/status")
                        .param("symbol", "BTCUSDT")
                        .param("direction", "SIDEWAYS")
                        .param("source", "tv"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.parameter").value("direction"));
    }

    @Test
    @DisplayName("GET /api/assets/position-size returns the multiplier")
    void positionSize() throws Exception {
        when(circuitBreakerService.positionSizeMultiplier(KEY)).thenReturn(0.375);

        mockMvc.perform(get("/api/assets/position-size")
                        .param("symbol", "BTCUSDT")
                        .param("direction", "LONG")
                        .param("source", "tv"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.multiplier").value(0.375));
    }

    @Test
    @DisplayName("GET /api/assets/summary returns counts and assets")
    void summary() throws Exception {
        AssetHealth health = AssetHealth.newRecord(KEY, LocalDateTime.of(2024, 3, 1, 0, 0));
        health.setStrategyProfile(StrategyProfile.HIGH_WR);
        when(circuitBreakerService.getSummary()).thenReturn(CircuitBreakerSummary.builder()
                .assets(List.of(CircuitBreakerSummary.AssetEntry.builder()
                        .health(health)
                        .healthScore(90.0)
                        .build()))
                .alerts(List.of())
                .totalAssets(1)
                .active(1)
                .build());

        mockMvc.perform(get("/api/assets/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalAssets").value(1))
                .andExpect(jsonPath("$.data.active").value(1))
                .andExpect(jsonPath("$.data.assets[0].health.symbol").value("BTCUSDT"))
                .andExpect(jsonPath("$.data.assets[0].healthScore").value(90.0));
    }
}
