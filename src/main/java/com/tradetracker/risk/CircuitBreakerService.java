package com.tradetracker.risk;

import com.tradetracker.config.CircuitBreakerConfig;
import com.tradetracker.domain.enums.AlertSeverity;
import com.tradetracker.domain.enums.AssetStatus;
import com.tradetracker.domain.enums.StrategyProfile;
import com.tradetracker.domain.enums.TradeStatus;
import com.tradetracker.domain.model.AssetHealth;
import com.tradetracker.domain.model.AssetKey;
import com.tradetracker.domain.model.CircuitBreakerAlert;
import com.tradetracker.domain.model.CircuitBreakerSummary;
import com.tradetracker.domain.model.PerformanceMetrics;
import com.tradetracker.domain.model.Trade;
import com.tradetracker.entity.AssetHealthEntity;
import com.tradetracker.event.AssetStatusChangedEvent;
import com.tradetracker.event.TradeClosedEvent;
import com.tradetracker.mapper.AssetHealthMapper;
import com.tradetracker.mapper.TradeMapper;
import com.tradetracker.observability.TrackerMetricsService;
import com.tradetracker.repository.jpa.AssetHealthJpaRepository;
import com.tradetracker.repository.jpa.TradeJpaRepository;
import com.tradetracker.repository.redis.AssetHealthRedisRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Learns per-(symbol, direction, source) performance from completed trades and
 * pauses, recovers or blacklists keys that stop performing.
 *
 * <p>State machine:
 * <pre>
 *   ACTIVE ──trip──▶ PAUSED ──pause days elapse──▶ RECOVERY ──recovered──▶ ACTIVE
 *     │                                              │
 *     └──trip with pause budget spent / HIGH_WR collapse──▶ BLACKLISTED (terminal)
 * </pre>
 * The profile (from win rate and risk-reward) selects the {@link ProfileThresholds}.
 * While in RECOVERY, conditions are checked against the trades taken since recovery
 * started, so the losses that caused the pause do not immediately re-trip it.
 *
 * <p><b>Concurrency model:</b> evaluations for one key run under that key's
 * ReentrantLock; different keys evaluate in parallel. Evaluation is triggered
 * asynchronously from {@link TradeClosedEvent}, so a slow or failing evaluation never
 * delays closing a trade.
 *
 * <p>Status reads on the trade-acceptance path go through a short-TTL Redis copy and
 * fall back to H2 when Redis is unavailable.
 */
@Service
public class CircuitBreakerService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);

    private static final Map<AssetStatus, Integer> SUMMARY_ORDER = Map.of(
            AssetStatus.BLACKLISTED, 1,
            AssetStatus.RECOVERY, 2,
            AssetStatus.PAUSED, 3,
            AssetStatus.ACTIVE, 4);

    private final Map<AssetKey, ReentrantLock> keyLocks = new ConcurrentHashMap<>();
    private final Deque<CircuitBreakerAlert> alerts = new ConcurrentLinkedDeque<>();

    private final TradeJpaRepository tradeJpaRepository;
    private final TradeMapper tradeMapper;
    private final AssetHealthJpaRepository assetHealthJpaRepository;
    private final AssetHealthMapper assetHealthMapper;
    private final AssetHealthRedisRepository assetHealthRedisRepository;
    private final PerformanceMetricsCalculator metricsCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final TrackerMetricsService metrics;

    public CircuitBreakerService(
            TradeJpaRepository tradeJpaRepository,
            TradeMapper tradeMapper,
            AssetHealthJpaRepository assetHealthJpaRepository,
            AssetHealthMapper assetHealthMapper,
            AssetHealthRedisRepository assetHealthRedisRepository,
            PerformanceMetricsCalculator metricsCalculator,
            ApplicationEventPublisher eventPublisher,
            CircuitBreakerConfig config,
            Clock clock,
            TrackerMetricsService metrics) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeMapper = tradeMapper;
        this.assetHealthJpaRepository = assetHealthJpaRepository;
        this.assetHealthMapper = assetHealthMapper;
        this.assetHealthRedisRepository = assetHealthRedisRepository;
        this.metricsCalculator = metricsCalculator;
        this.eventPublisher = eventPublisher;
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;
    }

    // ---- Evaluation ----

    @Async("eventExecutor")
    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        try {
            onTradeCompleted(event.getTrade());
        } catch (Exception e) {
            log.error(
                    "Circuit breaker evaluation failed for trade {}: {}",
                    event.getTrade().getTradeIdentifier(),
                    e.getMessage(),
                    e);
        }
    }

    public AssetHealth onTradeCompleted(Trade trade) {
        return evaluate(AssetKey.of(trade));
    }

    /**
     * Recomputes the key's metrics from its most recent completed trades and applies
     * the state machine. Returns the saved record.
     */
    public AssetHealth evaluate(AssetKey key) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            AssetHealth health = loadRecord(key).orElseGet(() -> AssetHealth.newRecord(key, now));
            AssetStatus previous = health.getStatus();

            List<Trade> recent = recentCompletedTrades(key, config.getHistorySize());
            PerformanceMetrics performance = metricsCalculator.calculate(recent, now);
            StrategyProfile profile = performance.getTotalTrades() > 0
                    ? StrategyProfile.classify(performance.getWinRate(), performance.getRiskReward())
                    : health.getStrategyProfile();
            applyMetrics(health, performance, profile, now);
            ProfileThresholds thresholds = ProfileThresholds.forProfile(profile);

            log.info(
                    "Circuit breaker check {}: status {} profile {} WR {}% consecutive losses {} P&L(20) {}%",
                    key,
                    previous,
                    profile,
                    String.format("%.1f", performance.getWinRate()),
                    performance.getConsecutiveLosses(),
                    String.format("%.2f", performance.getCumulativePnl20()));

            if (config.isEnabled()) {
                switch (previous) {
                    case BLACKLISTED -> {
                        // Terminal until manual review; metrics are still refreshed.
                    }
                    case PAUSED -> {
                        if (isPauseElapsed(health, now)) {
                            startRecovery(health, now);
                        }
                    }
                    case RECOVERY -> evaluateRecovery(health, thresholds, profile, now);
                    case ACTIVE -> {
                        if (performance.getTotalTrades() >= config.getMinimumTrades()) {
                            Trip trip = checkConditions(performance, thresholds, profile);
                            if (trip != null) {
                                applyTrip(health, thresholds, performance, trip, now);
                            }
                        }
                    }
                }
            }

            AssetHealth saved = save(health, now);
            if (saved.getStatus() != previous) {
                publishStatusChange(saved, previous, performance, now);
            }
            return saved;
        } finally {
            lock.unlock();
        }
    }

    /** A tripped condition: the status to move to and why. */
    record Trip(AssetStatus status, String reason) {}

    /**
     * Checks the conditions in fixed order and returns the first one tripped, or null.
     * Only HIGH_WR keys can be blacklisted directly (losses in 10).
     */
    Trip checkConditions(PerformanceMetrics m, ProfileThresholds t, StrategyProfile profile) {
        if (m.getConsecutiveLosses() >= t.consecutiveLossLimit()) {
            return pause(format(
                    "Consecutive losses: %d (limit: %d for %s)", m.getConsecutiveLosses(), t.consecutiveLossLimit(), profile));
        }
        if (profile == StrategyProfile.HIGH_WR && m.getLossesIn10() != null && m.getLossesIn10() >= t.lossesIn10Limit()) {
            return new Trip(
                    AssetStatus.BLACKLISTED,
                    format("HIGH-WR FAILURE: %d losses in 10 trades (limit: %d)", m.getLossesIn10(), t.lossesIn10Limit()));
        }
        if (m.getMaxDrawdown() < t.maxDrawdownPct()) {
            return pause(format("Max drawdown: %.2f%% (limit: %.1f%%)", m.getMaxDrawdown(), t.maxDrawdownPct()));
        }
        if (m.getTotalTrades() >= 10 && m.getCumulativePnl10() < t.maxDrawdownPct()) {
            return pause(format("10-trade P&L: %.2f%% (limit: %.1f%%)", m.getCumulativePnl10(), t.maxDrawdownPct()));
        }
        if (m.getTotalTrades() >= config.getHistorySize() && m.getWinRate() < t.minWinRate20()) {
            if (profile == StrategyProfile.HIGH_WR) {
                return pause(format(
                        "WIN RATE DEGRADATION: %.1f%% (minimum: %.1f%%) - strategy regeneration needed",
                        m.getWinRate(),
                        t.minWinRate20()));
            }
            return pause(format(
                    "Low win rate: %.1f%% over %d trades (minimum: %.1f%%)",
                    m.getWinRate(),
                    m.getTotalTrades(),
                    t.minWinRate20()));
        }
        if (m.getHourlyPnl() < t.hourlyLossCapPct()) {
            return pause(format("Rapid hourly loss: %.2f%% (limit: %.1f%%)", m.getHourlyPnl(), t.hourlyLossCapPct()));
        }
        if (m.getDailyPnl() < t.dailyLossCapPct()) {
            return pause(format("Daily loss: %.2f%% (limit: %.1f%%)", m.getDailyPnl(), t.dailyLossCapPct()));
        }
        return null;
    }

    /** Reasons are stored and compared, so they never follow the JVM locale. */
    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }

    private static Trip pause(String reason) {
        return new Trip(AssetStatus.PAUSED, reason);
    }

    private void applyTrip(
            AssetHealth health, ProfileThresholds t, PerformanceMetrics m, Trip trip, LocalDateTime now) {
        if (trip.status() == AssetStatus.BLACKLISTED) {
            blacklist(health, trip.reason(), m, now);
            return;
        }
        int newCount = health.getPauseCount() + 1;
        if (newCount >= t.maxPauseCount()) {
            blacklist(health, "Exceeded max pause count (" + t.maxPauseCount() + "): " + trip.reason(), m, now);
            return;
        }
        health.setStatus(AssetStatus.PAUSED);
        health.setPauseReason(trip.reason());
        health.setPausedAt(now);
        health.setPauseCount(newCount);
        health.setRecoveryStartedAt(null);
        log.warn(
                "Pausing {} (profile {}, pause {}/{}): {}",
                health.key(),
                health.getStrategyProfile(),
                newCount,
                t.maxPauseCount(),
                trip.reason());
        raiseAlert(health, AlertSeverity.HIGH, m, now);
    }

    private void blacklist(AssetHealth health, String reason, PerformanceMetrics m, LocalDateTime now) {
        health.setStatus(AssetStatus.BLACKLISTED);
        health.setPauseReason(reason);
        health.setPausedAt(now);
        health.setRecoveryStartedAt(null);
        log.error("Blacklisting {} (profile {}): {}", health.key(), health.getStrategyProfile(), reason);
        raiseAlert(health, AlertSeverity.CRITICAL, m, now);
    }

    private void startRecovery(AssetHealth health, LocalDateTime now) {
        int days = ProfileThresholds.forProfile(health.getStrategyProfile()).pauseDurationDays();
        health.setStatus(AssetStatus.RECOVERY);
        health.setRecoveryStartedAt(now);
        health.setPauseReason("In recovery: pause of " + days + " days elapsed");
        log.info("Pause elapsed for {}, entering recovery", health.key());
    }

    /**
     * Exits recovery on enough consecutive wins, a good win rate over a full recovery
     * window, or enough recovery PnL. Otherwise re-checks the conditions against the
     * recovery trades alone.
     */
    private void evaluateRecovery(
            AssetHealth health, ProfileThresholds t, StrategyProfile profile, LocalDateTime now) {
        LocalDateTime since = health.getRecoveryStartedAt() != null ? health.getRecoveryStartedAt() : health.getPausedAt();
        List<Trade> recoveryTrades = since != null
                ? tradeMapper.toDomainList(tradeJpaRepository.findByAssetSince(
                        health.getSymbol(),
                        health.getDirection(),
                        health.getWebhookSource(),
                        TradeStatus.COMPLETED,
                        since,
                        PageRequest.of(0, config.getRecoveryWindow())))
                : List.of();

        if (recoveryTrades.isEmpty()) {
            health.setPauseReason("In recovery: no trades completed yet");
            return;
        }

        int wins = PerformanceMetricsCalculator.streak(recoveryTrades, true);
        double recoveryPnl = PerformanceMetricsCalculator.sumPnl(recoveryTrades);
        String recoveredBy = null;
        if (wins >= t.recoveryWinsRequired()) {
            recoveredBy = wins + " consecutive wins";
        } else if (recoveryTrades.size() >= config.getRecoveryWindow()) {
            long winCount = recoveryTrades.stream().filter(tr -> PerformanceMetricsCalculator.pnlOf(tr) > 0).count();
            double winRate = winCount * 100.0 / recoveryTrades.size();
            if (winRate >= t.recoveryWinRate10()) {
                recoveredBy = format("%.1f%% win rate over %d trades", winRate, recoveryTrades.size());
            }
        }
        if (recoveredBy == null && recoveryPnl >= t.recoveryPnlThreshold()) {
            recoveredBy = format("+%.2f%% P&L", recoveryPnl);
        }

        if (recoveredBy != null) {
            health.setStatus(AssetStatus.ACTIVE);
            health.setPauseReason(null);
            health.setRecoveryStartedAt(null);
            log.info("Recovery complete for {}: {}", health.key(), recoveredBy);
            return;
        }

        PerformanceMetrics recoveryMetrics = metricsCalculator.calculate(recoveryTrades, now);
        Trip trip = checkConditions(recoveryMetrics, t, profile);
        if (trip != null) {
            applyTrip(health, t, recoveryMetrics, trip, now);
            return;
        }
        health.setPauseReason(format(
                "In recovery: %d/%d wins, P&L: %.2f%%/%.1f%%",
                wins,
                t.recoveryWinsRequired(),
                recoveryPnl,
                t.recoveryPnlThreshold()));
    }

    // ---- Status queries ----

    /**
     * Current status for a key. Unknown keys are ACTIVE. A PAUSED key whose pause
     * duration has elapsed is moved to RECOVERY (and stored) before returning.
     */
    public AssetStatus checkAssetStatus(AssetKey key) {
        if (!config.isEnabled()) {
            return AssetStatus.ACTIVE;
        }
        Optional<AssetHealth> cached = findCachedOrStored(key);
        if (cached.isEmpty()) {
            return AssetStatus.ACTIVE;
        }
        AssetHealth health = cached.get();
        LocalDateTime now = LocalDateTime.now(clock);
        if (health.getStatus() == AssetStatus.PAUSED && isPauseElapsed(health, now)) {
            return resumeIntoRecovery(key, now);
        }
        return health.getStatus();
    }

    public Optional<AssetHealth> getAssetHealth(AssetKey key) {
        return loadRecord(key);
    }

    /**
     * Fraction (0 to 1) of the normal position size to use for a new trade on this key.
     * Zero while the key is PAUSED or BLACKLISTED.
     */
    public double positionSizeMultiplier(AssetKey key) {
        AssetStatus status = checkAssetStatus(key);
        if (!status.allowsTrading()) {
            return 0.0;
        }
        StrategyProfile profile = findCachedOrStored(key)
                .map(AssetHealth::getStrategyProfile)
                .orElse(StrategyProfile.STANDARD);
        PerformanceMetrics performance =
                metricsCalculator.calculate(recentCompletedTrades(key, config.getHistorySize()), LocalDateTime.now(clock));
        return computePositionSizeMultiplier(profile, status, performance);
    }

    /** Pure sizing rule; see {@link #positionSizeMultiplier(AssetKey)}. */
    public static double computePositionSizeMultiplier(
            StrategyProfile profile, AssetStatus status, PerformanceMetrics m) {
        if (status == AssetStatus.PAUSED || status == AssetStatus.BLACKLISTED) {
            return 0.0;
        }
        double multiplier = ProfileThresholds.forProfile(profile).positionSizeMultiplier();
        if (status == AssetStatus.RECOVERY) {
            multiplier *= 0.25;
        }

        if (m.getConsecutiveLosses() >= 2) {
            multiplier *= 0.5;
        } else if (m.getConsecutiveLosses() >= 1) {
            multiplier *= 0.75;
        }

        if (m.getCumulativePnl10() < -2.0) {
            multiplier *= 0.7;
        }

        if (profile == StrategyProfile.HIGH_WR) {
            if (m.getWinRate() < m.getExpectedWinRate() - 10) {
                multiplier *= 0.5;
            } else if (m.getWinRate() < m.getExpectedWinRate() - 5) {
                multiplier *= 0.75;
            }
        }

        if (m.getKellyFraction() > 0) {
            multiplier *= 1 + m.getKellyFraction() * 0.5;
        }
        return Math.max(0.0, Math.min(multiplier, 1.0));
    }

    /** 0-100 score: win rate against expectation, 20-trade PnL and the current loss streak. */
    public static double healthScore(PerformanceMetrics m) {
        double score = 100.0;

        double expected = m.getExpectedWinRate();
        if (expected > 0) {
            double deviation = (m.getWinRate() - expected) / expected * 100;
            if (deviation < -20) {
                score -= 40;
            } else if (deviation < -10) {
                score -= 30;
            } else if (deviation < -5) {
                score -= 20;
            } else if (deviation < 0) {
                score -= 10;
            }
        }

        double pnl = m.getCumulativePnl20();
        if (pnl < -15) {
            score -= 40;
        } else if (pnl < -10) {
            score -= 30;
        } else if (pnl < -5) {
            score -= 20;
        } else if (pnl < 0) {
            score -= 10;
        }

        int losses = m.getConsecutiveLosses();
        if (losses >= 5) {
            score -= 20;
        } else if (losses >= 4) {
            score -= 15;
        } else if (losses >= 3) {
            score -= 10;
        } else if (losses >= 2) {
            score -= 5;
        }
        return Math.max(0.0, Math.min(score, 100.0));
    }

    public CircuitBreakerSummary getSummary() {
        List<AssetHealth> records = assetHealthMapper.toDomainList(assetHealthJpaRepository.findAll());
        List<CircuitBreakerSummary.AssetEntry> entries = records.stream()
                .sorted(Comparator.comparing((AssetHealth h) -> SUMMARY_ORDER.getOrDefault(h.getStatus(), 5))
                        .thenComparing(
                                AssetHealth::getCumulativePnlLast20, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(h -> CircuitBreakerSummary.AssetEntry.builder()
                        .health(h)
                        .healthScore(scoreOf(h))
                        .build())
                .toList();
        List<CircuitBreakerAlert> recentAlerts = getRecentAlerts();

        return CircuitBreakerSummary.builder()
                .assets(entries)
                .alerts(recentAlerts)
                .totalAssets(records.size())
                .blacklisted(countStatus(records, AssetStatus.BLACKLISTED))
                .paused(countStatus(records, AssetStatus.PAUSED))
                .recovery(countStatus(records, AssetStatus.RECOVERY))
                .active(countStatus(records, AssetStatus.ACTIVE))
                .criticalAlerts(countSeverity(recentAlerts, AlertSeverity.CRITICAL))
                .highAlerts(countSeverity(recentAlerts, AlertSeverity.HIGH))
                .build();
    }

    /** Alerts raised within the retention window, oldest first. */
    public List<CircuitBreakerAlert> getRecentAlerts() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusHours(config.getAlertRetentionHours());
        return alerts.stream().filter(a -> a.getTimestamp().isAfter(cutoff)).toList();
    }

    // ---- Helpers ----

    private AssetStatus resumeIntoRecovery(AssetKey key, LocalDateTime now) {
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            Optional<AssetHealth> stored = loadRecord(key);
            if (stored.isEmpty()) {
                return AssetStatus.ACTIVE;
            }
            AssetHealth health = stored.get();
            if (health.getStatus() == AssetStatus.PAUSED && isPauseElapsed(health, now)) {
                startRecovery(health, now);
                AssetHealth saved = save(health, now);
                publishStatusChange(saved, AssetStatus.PAUSED, null, now);
            }
            return health.getStatus();
        } finally {
            lock.unlock();
        }
    }

    private boolean isPauseElapsed(AssetHealth health, LocalDateTime now) {
        if (health.getPausedAt() == null) {
            return true;
        }
        int days = ProfileThresholds.forProfile(health.getStrategyProfile()).pauseDurationDays();
        return !now.isBefore(health.getPausedAt().plusDays(days));
    }

    private static void applyMetrics(
            AssetHealth health, PerformanceMetrics m, StrategyProfile profile, LocalDateTime now) {
        health.setStrategyProfile(profile);
        health.setTotalTrades(m.getTotalTrades());
        health.setWinRateLast20(m.getWinRate());
        health.setCumulativePnlLast20(m.getCumulativePnl20());
        health.setConsecutiveLosses(m.getConsecutiveLosses());
        health.setConsecutiveWins(m.getConsecutiveWins());
        health.setExpectedWinRate(m.getExpectedWinRate());
        health.setExpectedRiskReward(m.getRiskReward());
        health.setLastCheckedAt(now);
    }

    private void raiseAlert(AssetHealth health, AlertSeverity severity, PerformanceMetrics m, LocalDateTime now) {
        CircuitBreakerAlert alert = CircuitBreakerAlert.builder()
                .id(health.key() + "_" + now.toInstant(ZoneOffset.UTC).toEpochMilli())
                .timestamp(now)
                .key(health.key())
                .status(health.getStatus())
                .severity(severity)
                .reason(health.getPauseReason())
                .winRate(m.getWinRate())
                .consecutiveLosses(m.getConsecutiveLosses())
                .maxDrawdown(m.getMaxDrawdown())
                .cumulativePnl20(m.getCumulativePnl20())
                .build();
        alerts.addLast(alert);
        while (alerts.size() > config.getMaxAlerts()) {
            alerts.pollFirst();
        }
        log.error("[{}] {} alert: {}", health.key(), severity, alert.getReason());
    }

    private void publishStatusChange(
            AssetHealth health, AssetStatus previous, PerformanceMetrics m, LocalDateTime now) {
        metrics.recordStatusChange(health.getStatus());
        CircuitBreakerAlert alert = null;
        if (health.getStatus() == AssetStatus.PAUSED || health.getStatus() == AssetStatus.BLACKLISTED) {
            alert = alerts.peekLast();
        }
        eventPublisher.publishEvent(new AssetStatusChangedEvent(
                this, health.key(), previous, health.getStatus(), health.getPauseReason(), alert));
    }

    private AssetHealth save(AssetHealth health, LocalDateTime now) {
        health.setUpdatedAt(now);
        AssetHealthEntity saved = assetHealthJpaRepository.save(assetHealthMapper.toEntity(health));
        health.setId(saved.getId());
        try {
            assetHealthRedisRepository.save(health);
        } catch (Exception e) {
            log.warn("Failed to cache asset status for {} in Redis: {}", health.key(), e.getMessage());
        }
        return health;
    }

    private Optional<AssetHealth> loadRecord(AssetKey key) {
        return assetHealthJpaRepository
                .findBySymbolAndDirectionAndWebhookSource(key.symbol(), key.direction(), key.source())
                .map(assetHealthMapper::toDomain);
    }

    private Optional<AssetHealth> findCachedOrStored(AssetKey key) {
        try {
            Optional<AssetHealth> cached = assetHealthRedisRepository.findByKey(key);
            if (cached.isPresent()) {
                return cached;
            }
        } catch (Exception e) {
            log.warn("Redis read failed for {}, falling back to database: {}", key, e.getMessage());
        }
        Optional<AssetHealth> stored = loadRecord(key);
        stored.ifPresent(health -> {
            try {
                assetHealthRedisRepository.save(health);
            } catch (Exception e) {
                log.warn("Failed to cache asset status for {} in Redis: {}", key, e.getMessage());
            }
        });
        return stored;
    }

    private List<Trade> recentCompletedTrades(AssetKey key, int limit) {
        return tradeMapper.toDomainList(tradeJpaRepository.findRecentByAsset(
                key.symbol(), key.direction(), key.source(), TradeStatus.COMPLETED, PageRequest.of(0, limit)));
    }

    private static Double scoreOf(AssetHealth health) {
        if (health.getWinRateLast20() == null || health.getCumulativePnlLast20() == null) {
            return null;
        }
        PerformanceMetrics m = PerformanceMetrics.builder()
                .winRate(health.getWinRateLast20())
                .cumulativePnl20(health.getCumulativePnlLast20())
                .consecutiveLosses(health.getConsecutiveLosses())
                .expectedWinRate(health.getStrategyProfile() == StrategyProfile.HIGH_WR ? 70.0 : 50.0)
                .build();
        return healthScore(m);
    }

    private static int countStatus(List<AssetHealth> records, AssetStatus status) {
        return (int) records.stream().filter(h -> h.getStatus() == status).count();
    }

    private static int countSeverity(List<CircuitBreakerAlert> list, AlertSeverity severity) {
        return (int) list.stream().filter(a -> a.getSeverity() == severity).count();
    }

    private ReentrantLock lockFor(AssetKey key) {
        return keyLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }
}
