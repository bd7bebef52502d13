package com.tradetracker.unit.tracking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradetracker.config.ExitStrategyConfig;
import com.tradetracker.config.TrackingConfig;
import com.tradetracker.domain.enums.RiskStrategy;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.enums.TradeOutcome;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.entity.PriceSampleEntity;
import com.tradetracker.entity.TradeEntity;
import com.tradetracker.entity.TradeMilestonesEntity;
import com.tradetracker.exit.AdaptiveTrailingEvaluator;
import com.tradetracker.exit.EarlyMomentumEvaluator;
import com.tradetracker.exit.ExitEvaluatorRegistry;
import com.tradetracker.exit.StaticStopEvaluator;
import com.tradetracker.mapper.PriceSampleMapper;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.mapper.TradeMilestonesMapper;
import com.tradetracker.marketdata.ConnectionMultiplexer;
import com.tradetracker.milestone.MilestoneRecorder;
import com.tradetracker.observability.TrackerMetricsService;
import com.tradetracker.repository.jpa.PriceSampleJpaRepository;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import com.tradetracker.repository.jpa.TradeMilestonesJpaRepository;
import com.tradetracker.tracking.DefaultPostTradePipeline;
import com.tradetracker.tracking.TradeTrackingEngine;
import com.tradetracker.tracking.TradeWriteBuffer;
import com.tradetracker.unit.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Closing a trade while its instrument's batch cannot be committed must not let a later
 * retry of that batch reopen the trade, strip its exit or re-insert deleted samples.
 */
@ExtendWith(MockitoExtension.class)
class TradeCloseAfterFailedCommitTest {

    private static final String SYMBOL = "BTC/USDT:USDT";
    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private ConnectionMultiplexer connectionMultiplexer;

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    @Mock
    private TradeMilestonesJpaRepository tradeMilestonesJpaRepository;

    @Mock
    private PriceSampleJpaRepository priceSampleJpaRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final List<TradeStatus> tradeWrites = new ArrayList<>();
    private final List<TradeMilestonesEntity> batchedMilestones = new ArrayList<>();
    private final List<Integer> batchedSampleCounts = new ArrayList<>();

    private MutableClock clock;
    private TradeWriteBuffer buffer;
    private TradeTrackingEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        TrackingConfig config = new TrackingConfig();
        TrackerMetricsService metrics = new TrackerMetricsService(new SimpleMeterRegistry());
        TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);
        TradeMilestonesMapper milestonesMapper = Mappers.getMapper(TradeMilestonesMapper.class);

        buffer = new TradeWriteBuffer(
                tradeJpaRepository,
                tradeMilestonesJpaRepository,
                priceSampleJpaRepository,
                tradeMapper,
                milestonesMapper,
                Mappers.getMapper(PriceSampleMapper.class),
                transactionTemplate,
                config,
                clock,
                metrics);
        ExitStrategyConfig exitConfig = new ExitStrategyConfig();
        engine = new TradeTrackingEngine(
                connectionMultiplexer,
                tradeJpaRepository,
                tradeMapper,
                new MilestoneRecorder(tradeMilestonesJpaRepository, milestonesMapper, buffer),
                new ExitEvaluatorRegistry(List.of(
                        new StaticStopEvaluator(),
                        new EarlyMomentumEvaluator(exitConfig),
                        new AdaptiveTrailingEvaluator(exitConfig))),
                buffer,
                new DefaultPostTradePipeline(priceSampleJpaRepository, buffer, config),
                eventPublisher,
                config,
                clock,
                metrics);

        when(tradeMilestonesJpaRepository.findByTradeId(1L)).thenReturn(Optional.empty());
        when(tradeMilestonesJpaRepository.save(any(TradeMilestonesEntity.class))).thenAnswer(invocation -> {
            TradeMilestonesEntity entity = invocation.getArgument(0);
            entity.setId(5L);
            return entity;
        });
        when(tradeJpaRepository.save(any(TradeEntity.class))).thenAnswer(invocation -> {
            TradeEntity entity = invocation.getArgument(0);
            tradeWrites.add(entity.getStatus());
            return entity;
        });
        doAnswer(invocation -> {
                    Iterable<TradeEntity> trades = invocation.getArgument(0);
                    trades.forEach(t -> tradeWrites.add(t.getStatus()));
                    return List.of();
                })
                .when(tradeJpaRepository)
                .saveAll(any());
        doAnswer(invocation -> {
                    Iterable<TradeMilestonesEntity> milestones = invocation.getArgument(0);
                    milestones.forEach(batchedMilestones::add);
                    return List.of();
                })
                .when(tradeMilestonesJpaRepository)
                .saveAll(any());
        doAnswer(invocation -> {
                    Iterable<PriceSampleEntity> samples = invocation.getArgument(0);
                    int count = 0;
                    for (PriceSampleEntity ignored : samples) {
                        count++;
                    }
                    batchedSampleCounts.add(count);
                    return List.of();
                })
                .when(priceSampleJpaRepository)
                .saveAll(any());

        // First commit fails, every later one runs.
        doThrow(new IllegalStateException("connection reset"))
                .doAnswer(invocation -> {
                    Consumer<TransactionStatus> callback = invocation.getArgument(0);
                    callback.accept(null);
                    return null;
                })
                .when(transactionTemplate)
                .executeWithoutResult(any());
    }

    private static Trade longWithStop() {
        return Trade.builder()
                .id(1L)
                .tradeIdentifier("T-1")
                .symbol("BTCUSDT.P")
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("100"))
                .entryTime(START)
                .createdAt(START)
                .webhookSource("tv")
                .riskStrategy(RiskStrategy.STATIC)
                .slPrice(new BigDecimal("98"))
                .status(TradeStatus.ACTIVE)
                .build();
    }

    private void tick(String price) {
        engine.onPrice(SYMBOL, new BigDecimal(price), clock.now());
    }

    @Test
    @DisplayName("close after a failed commit: the retried batch writes the completed state")
    void retriedBatchKeepsTradeCompleted() {
        Trade trade = longWithStop();
        engine.addTrade(trade);

        tick("100");
        clock.advance(Duration.ofSeconds(3));
        tick("99");
        clock.advance(Duration.ofSeconds(3));
        tick("97");

        assertThat(trade.getFinalOutcome()).isEqualTo(TradeOutcome.SL);
        assertThat(engine.isTracking(1L)).isFalse();

        clock.advance(Duration.ofSeconds(6));
        buffer.flushDue();

        assertThat(tradeWrites).isNotEmpty().containsOnly(TradeStatus.COMPLETED);
        assertThat(batchedMilestones).singleElement().satisfies(m -> {
            assertThat(m.getExitPrice()).isEqualByComparingTo("97");
            assertThat(m.getExitAt()).isEqualTo(START.plusSeconds(6));
        });
        assertThat(batchedSampleCounts).containsExactly(0);
        assertThat(buffer.hasPendingWrites(SYMBOL)).isFalse();
        verify(priceSampleJpaRepository).deleteByTradeId(1L);
    }
}
