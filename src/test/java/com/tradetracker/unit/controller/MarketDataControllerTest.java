package com.tradetracker.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradetracker.api.controller.MarketDataController;
import com.tradetracker.config.ApiResponseAdvice;
import com.tradetracker.domain.model.ConnectionStats;
import com.tradetracker.marketdata.ConnectionMultiplexer;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class MarketDataControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ConnectionMultiplexer connectionMultiplexer;

    @InjectMocks
    private MarketDataController marketDataController;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(marketDataController)
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/market-data/stats returns the multiplexer snapshot")
    void stats() throws Exception {
        when(connectionMultiplexer.getConnectionStats()).thenReturn(ConnectionStats.builder()
                .totalSymbols(2)
                .totalSubscribers(3)
                .activeStreams(1)
                .pollingSymbols(1)
                .venueDistribution(Map.of("binance", 1, "polling", 1))
                .lastTickAgeSeconds(Map.of("BTC/USDT:USDT", 2L))
                .build());

        mockMvc.perform(get("/api/market-data/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalSymbols").value(2))
                .andExpect(jsonPath("$.data.activeStreams").value(1))
                .andExpect(jsonPath("$.data.venueDistribution.polling").value(1));
    }
}
