package com.tradetracker.unit.milestone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradetracker.domain.model.Trade;
import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.entity.TradeMilestonesEntity;
import com.tradetracker.mapper.TradeMilestonesMapper;
import com.tradetracker.milestone.MilestoneRecorder;
import com.tradetracker.milestone.MilestoneThreshold;
import com.tradetracker.repository.jpa.TradeMilestonesJpaRepository;
import com.tradetracker.tracking.TradeWriteBuffer;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for MilestoneRecorder: lazy single-row creation, first-crossing
 * immutability and the running extremes.
 */
@ExtendWith(MockitoExtension.class)
class MilestoneRecorderTest {

    private static final String SYMBOL = "BTC/USDT:USDT";
    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private TradeMilestonesJpaRepository repository;

    @Mock
    private TradeWriteBuffer tradeWriteBuffer;

    private MilestoneRecorder recorder;
    private Trade trade;

    @BeforeEach
    void setUp() {
        recorder = new MilestoneRecorder(repository, Mappers.getMapper(TradeMilestonesMapper.class), tradeWriteBuffer);
        trade = Trade.builder()
                .id(1L)
                .tradeIdentifier("T-1")
                .symbol("BTCUSDT")
                .tradingSymbol(SYMBOL)
                .entryPrice(new BigDecimal("100"))
                .entryTime(T0)
                .build();
    }

    private void stubCreate() {
        when(repository.findByTradeId(1L)).thenReturn(Optional.empty());
        when(repository.save(any(TradeMilestonesEntity.class))).thenAnswer(invocation -> {
            TradeMilestonesEntity entity = invocation.getArgument(0);
            entity.setId(99L);
            return entity;
        });
    }

    // ==============================
    // RECORD LIFECYCLE
    // ==============================

    @Nested
    @DisplayName("Record lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("ensureRecord: creates one row and returns the cached record afterwards")
        void createsOnce() {
            stubCreate();

            TradeMilestones first = recorder.ensureRecord(trade);
            TradeMilestones second = recorder.ensureRecord(trade);

            assertThat(second).isSameAs(first);
            assertThat(first.getId()).isEqualTo(99L);
            assertThat(first.getEntryPrice()).isEqualByComparingTo("100");
            verify(repository, times(1)).save(any(TradeMilestonesEntity.class));
            assertThat(recorder.getCachedCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("ensureRecord: an existing row is loaded instead of inserting a new one")
        void loadsExisting() {
            TradeMilestonesEntity existing = new TradeMilestonesEntity();
            existing.setId(5L);
            existing.setTradeId(1L);
            existing.setProfit05At(T0.plusMinutes(3));
            when(repository.findByTradeId(1L)).thenReturn(Optional.of(existing));

            TradeMilestones milestones = recorder.ensureRecord(trade);

            assertThat(milestones.getId()).isEqualTo(5L);
            assertThat(milestones.getProfit05At()).isEqualTo(T0.plusMinutes(3));
        }

        @Test
        @DisplayName("clearCache: next access reloads from storage")
        void clearCacheReloads() {
            stubCreate();
            recorder.ensureRecord(trade);

            recorder.clearCache(1L);

            assertThat(recorder.getCachedCount()).isZero();
        }
    }

    // ==============================
    // THRESHOLDS
    // ==============================

    @Nested
    @DisplayName("Thresholds")
    class Thresholds {

        @Test
        @DisplayName("updateMilestones: every threshold crossed by a jump is stamped")
        void jumpStampsAllCrossed() {
            stubCreate();

            recorder.updateMilestones(trade, 2.1, T0.plusMinutes(5));
            TradeMilestones milestones = recorder.ensureRecord(trade);

            assertThat(MilestoneThreshold.PROFIT_0_5.reachedAt(milestones)).isEqualTo(T0.plusMinutes(5));
            assertThat(MilestoneThreshold.PROFIT_2.reachedAt(milestones)).isEqualTo(T0.plusMinutes(5));
            assertThat(MilestoneThreshold.PROFIT_3.reachedAt(milestones)).isNull();
            assertThat(MilestoneThreshold.DRAWDOWN_0_5.reachedAt(milestones)).isNull();
        }

        @Test
        @DisplayName("updateMilestones: a threshold keeps its first crossing time")
        void firstCrossingIsKept() {
            stubCreate();

            recorder.updateMilestones(trade, 0.6, T0.plusMinutes(1));
            recorder.updateMilestones(trade, -0.2, T0.plusMinutes(2));
            recorder.updateMilestones(trade, 0.7, T0.plusMinutes(3));
            TradeMilestones milestones = recorder.ensureRecord(trade);

            assertThat(milestones.getProfit05At()).isEqualTo(T0.plusMinutes(1));
        }

        @Test
        @DisplayName("updateMilestones: drawdown thresholds are crossed at or below their level")
        void drawdownThresholds() {
            stubCreate();

            recorder.updateMilestones(trade, -1.0, T0.plusMinutes(4));
            TradeMilestones milestones = recorder.ensureRecord(trade);

            assertThat(milestones.getDrawdown05At()).isEqualTo(T0.plusMinutes(4));
            assertThat(milestones.getDrawdown1At()).isEqualTo(T0.plusMinutes(4));
            assertThat(milestones.getDrawdown15At()).isNull();
        }

        @Test
        @DisplayName("updateMilestones: running extremes follow the best and worst PnL")
        void extremesTracked() {
            stubCreate();

            recorder.updateMilestones(trade, 0.8, T0.plusMinutes(1));
            recorder.updateMilestones(trade, -0.4, T0.plusMinutes(2));
            recorder.updateMilestones(trade, 0.3, T0.plusMinutes(3));
            TradeMilestones milestones = recorder.ensureRecord(trade);

            assertThat(milestones.getMaxProfitPct()).isEqualTo(0.8);
            assertThat(milestones.getMaxProfitAt()).isEqualTo(T0.plusMinutes(1));
            assertThat(milestones.getMaxDrawdownPct()).isEqualTo(-0.4);
            assertThat(milestones.getMaxDrawdownAt()).isEqualTo(T0.plusMinutes(2));
            verify(tradeWriteBuffer, times(3)).markMilestonesDirty(eq(SYMBOL), any(TradeMilestones.class));
        }
    }

    // ==============================
    // EXIT
    // ==============================

    @Test
    @DisplayName("recordExit: stamps exit price, time and final PnL")
    void recordExit() {
        stubCreate();

        TradeMilestones milestones =
                recorder.recordExit(trade, new BigDecimal("103.5"), 3.5, T0.plusHours(2));

        assertThat(milestones.getExitPrice()).isEqualByComparingTo("103.5");
        assertThat(milestones.getExitAt()).isEqualTo(T0.plusHours(2));
        assertThat(milestones.getFinalPnlPct()).isEqualTo(3.5);
    }
}
