package com.tradetracker.unit.tracking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.tradetracker.config.TrackingConfig;
import com.tradetracker.domain.enums.TradeDirection;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.domain.model.PriceSample;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.domain.model.TradeMilestones;
import com.tradetracker.entity.PriceSampleEntity;
import com.tradetracker.entity.TradeEntity;
import com.tradetracker.mapper.PriceSampleMapper;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.mapper.TradeMilestonesMapper;
import com.tradetracker.observability.TrackerMetricsService;
import com.tradetracker.repository.jpa.PriceSampleJpaRepository;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import com.tradetracker.repository.jpa.TradeMilestonesJpaRepository;
import com.tradetracker.tracking.TradeWriteBuffer;
import com.tradetracker.unit.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Unit tests for TradeWriteBuffer: interval-bounded commits, snapshot de-duplication
 * and retention of a batch whose commit failed.
 */
@ExtendWith(MockitoExtension.class)
class TradeWriteBufferTest {

    private static final String SYMBOL = "BTC/USDT:USDT";
    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 12, 0);

    @Mock
    private TradeJpaRepository tradeJpaRepository;

    @Mock
    private TradeMilestonesJpaRepository tradeMilestonesJpaRepository;

    @Mock
    private PriceSampleJpaRepository priceSampleJpaRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    @Captor
    private ArgumentCaptor<Iterable<PriceSampleEntity>> samplesCaptor;

    @Captor
    private ArgumentCaptor<Iterable<TradeEntity>> tradesCaptor;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private TradeWriteBuffer buffer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        meterRegistry = new SimpleMeterRegistry();
        buffer = new TradeWriteBuffer(
                tradeJpaRepository,
                tradeMilestonesJpaRepository,
                priceSampleJpaRepository,
                Mappers.getMapper(TradeMapper.class),
                Mappers.getMapper(TradeMilestonesMapper.class),
                Mappers.getMapper(PriceSampleMapper.class),
                transactionTemplate,
                new TrackingConfig(),
                clock,
                new TrackerMetricsService(meterRegistry));
    }

    private static Answer<Void> runCallback() {
        return invocation -> {
            Consumer<TransactionStatus> callback = invocation.getArgument(0);
            callback.accept(null);
            return null;
        };
    }

    private PriceSample sample(long tradeId, String price) {
        return PriceSample.builder()
                .tradeId(tradeId)
                .timestamp(clock.now())
                .price(new BigDecimal(price))
                .pnlPct(0.1)
                .build();
    }

    private static Trade trade(long id, double maxProfit) {
        return Trade.builder()
                .id(id)
                .tradeIdentifier("T-" + id)
                .symbol("BTCUSDT.P")
                .tradingSymbol(SYMBOL)
                .direction(TradeDirection.LONG)
                .entryPrice(new BigDecimal("100"))
                .status(TradeStatus.ACTIVE)
                .maxProfitPct(maxProfit)
                .build();
    }

    private static <T> List<T> toList(Iterable<T> items) {
        List<T> list = new ArrayList<>();
        items.forEach(list::add);
        return list;
    }

    // ==============================
    // INTERVAL
    // ==============================

    @Test
    @DisplayName("flushDue: nothing is committed before the commit interval elapses")
    void respectsInterval() {
        doAnswer(runCallback()).when(transactionTemplate).executeWithoutResult(any());
        buffer.addSample(SYMBOL, sample(1, "100.1"));

        clock.advance(Duration.ofSeconds(2));
        buffer.flushDue();
        verify(transactionTemplate, never()).executeWithoutResult(any());
        assertThat(buffer.getPendingSampleCount(SYMBOL)).isEqualTo(1);

        clock.advance(Duration.ofSeconds(3));
        buffer.flushDue();
        verify(priceSampleJpaRepository).saveAll(samplesCaptor.capture());
        assertThat(toList(samplesCaptor.getValue())).hasSize(1);
        assertThat(buffer.hasPendingWrites(SYMBOL)).isFalse();
    }

    @Test
    @DisplayName("markTradeDirty: the latest snapshot of a trade replaces the queued one")
    void latestSnapshotWins() {
        doAnswer(runCallback()).when(transactionTemplate).executeWithoutResult(any());
        buffer.markTradeDirty(SYMBOL, trade(1, 0.4));
        buffer.markTradeDirty(SYMBOL, trade(1, 0.9));
        buffer.markTradeDirty(SYMBOL, trade(2, 0.1));

        assertThat(buffer.forceFlush(SYMBOL)).isTrue();

        verify(tradeJpaRepository).saveAll(tradesCaptor.capture());
        List<TradeEntity> saved = toList(tradesCaptor.getValue());
        assertThat(saved).hasSize(2);
        assertThat(saved.get(0).getMaxProfitPct()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("markMilestonesDirty: queued records are committed with the batch")
    void milestonesCommitted() {
        doAnswer(runCallback()).when(transactionTemplate).executeWithoutResult(any());
        buffer.markMilestonesDirty(SYMBOL, TradeMilestones.builder().id(7L).tradeId(1L).build());

        buffer.forceFlush(SYMBOL);

        verify(tradeMilestonesJpaRepository).saveAll(any());
        assertThat(buffer.hasPendingWrites(SYMBOL)).isFalse();
    }

    // ==============================
    // FAILURES
    // ==============================

    @Test
    @DisplayName("forceFlush: failed commit keeps the batch queued and the next interval retries it")
    void failedCommitRetained() {
        doThrow(new IllegalStateException("db down"))
                .doAnswer(runCallback())
                .when(transactionTemplate)
                .executeWithoutResult(any());
        buffer.addSample(SYMBOL, sample(1, "100.1"));
        buffer.addSample(SYMBOL, sample(1, "100.2"));

        assertThat(buffer.forceFlush(SYMBOL)).isFalse();
        assertThat(buffer.getPendingSampleCount(SYMBOL)).isEqualTo(2);
        assertThat(meterRegistry.get("batch.flush.failures").counter().count()).isEqualTo(1.0);

        clock.advance(Duration.ofSeconds(5));
        buffer.flushDue();

        verify(transactionTemplate, times(2)).executeWithoutResult(any());
        verify(priceSampleJpaRepository).saveAll(samplesCaptor.capture());
        assertThat(toList(samplesCaptor.getValue())).hasSize(2);
        assertThat(buffer.getPendingSampleCount(SYMBOL)).isZero();
    }

    @Test
    @DisplayName("discardSamples: drops only the given trade's queued samples")
    void discardSamplesOfOneTrade() {
        buffer.addSample(SYMBOL, sample(1, "100.1"));
        buffer.addSample(SYMBOL, sample(2, "100.2"));
        buffer.addSample(SYMBOL, sample(1, "100.3"));

        assertThat(buffer.discardSamples(SYMBOL, 1L)).isEqualTo(2);
        assertThat(buffer.getPendingSampleCount(SYMBOL)).isEqualTo(1);
        assertThat(buffer.discardSamples("ETH/USDT:USDT", 1L)).isZero();
    }

    @Test
    @DisplayName("forceFlush: unknown or empty instrument succeeds without a transaction")
    void emptyFlush() {
        assertThat(buffer.forceFlush("ETH/USDT:USDT")).isTrue();
        verify(transactionTemplate, never()).executeWithoutResult(any());
    }

    @Test
    @DisplayName("flushAll: commits every instrument regardless of interval")
    void flushAllCommitsEverything() {
        doAnswer(runCallback()).when(transactionTemplate).executeWithoutResult(any());
        buffer.addSample(SYMBOL, sample(1, "100.1"));
        buffer.addSample("ETH/USDT:USDT", sample(2, "3000"));

        buffer.flushAll();

        verify(transactionTemplate, times(2)).executeWithoutResult(any());
        assertThat(buffer.hasPendingWrites(SYMBOL)).isFalse();
        assertThat(buffer.hasPendingWrites("ETH/USDT:USDT")).isFalse();
    }
}
