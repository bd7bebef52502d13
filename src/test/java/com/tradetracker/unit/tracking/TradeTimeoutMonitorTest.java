package com.tradetracker.unit.tracking;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradetracker.tracking.TradeTimeoutMonitor;
import com.tradetracker.tracking.TradeTrackingEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeTimeoutMonitorTest {

    @Mock
    private TradeTrackingEngine tradeTrackingEngine;

    @InjectMocks
    private TradeTimeoutMonitor monitor;

    @Test
    void checkTimeouts_delegatesToEngine() {
        when(tradeTrackingEngine.closeTimedOutTrades()).thenReturn(2);

        monitor.checkTimeouts();

        verify(tradeTrackingEngine).closeTimedOutTrades();
    }

    @Test
    void checkTimeouts_engineFailureDoesNotEscapeScheduler() {
        when(tradeTrackingEngine.closeTimedOutTrades()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> monitor.checkTimeouts()).doesNotThrowAnyException();
    }
}
