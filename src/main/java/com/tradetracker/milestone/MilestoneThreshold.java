package com.tradetracker.milestone;

import com.tradetracker.domain.model.TradeMilestones;
import java.time.LocalDateTime;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The 8 profit and 8 drawdown thresholds tracked per trade. Drawdown thresholds
 * carry negative percentages and are crossed when PnL falls to or below them.
 */
public enum MilestoneThreshold {
    PROFIT_0_5(0.5, TradeMilestones::getProfit05At, TradeMilestones::setProfit05At),
    PROFIT_1(1.0, TradeMilestones::getProfit1At, TradeMilestones::setProfit1At),
    PROFIT_1_5(1.5, TradeMilestones::getProfit15At, TradeMilestones::setProfit15At),
    PROFIT_2(2.0, TradeMilestones::getProfit2At, TradeMilestones::setProfit2At),
    PROFIT_3(3.0, TradeMilestones::getProfit3At, TradeMilestones::setProfit3At),
    PROFIT_5(5.0, TradeMilestones::getProfit5At, TradeMilestones::setProfit5At),
    PROFIT_8(8.0, TradeMilestones::getProfit8At, TradeMilestones::setProfit8At),
    PROFIT_10(10.0, TradeMilestones::getProfit10At, TradeMilestones::setProfit10At),

    DRAWDOWN_0_5(-0.5, TradeMilestones::getDrawdown05At, TradeMilestones::setDrawdown05At),
    DRAWDOWN_1(-1.0, TradeMilestones::getDrawdown1At, TradeMilestones::setDrawdown1At),
    DRAWDOWN_1_5(-1.5, TradeMilestones::getDrawdown15At, TradeMilestones::setDrawdown15At),
    DRAWDOWN_2(-2.0, TradeMilestones::getDrawdown2At, TradeMilestones::setDrawdown2At),
    DRAWDOWN_3(-3.0, TradeMilestones::getDrawdown3At, TradeMilestones::setDrawdown3At),
    DRAWDOWN_5(-5.0, TradeMilestones::getDrawdown5At, TradeMilestones::setDrawdown5At),
    DRAWDOWN_8(-8.0, TradeMilestones::getDrawdown8At, TradeMilestones::setDrawdown8At),
    DRAWDOWN_10(-10.0, TradeMilestones::getDrawdown10At, TradeMilestones::setDrawdown10At);

    private final double pct;
    private final Function<TradeMilestones, LocalDateTime> reader;
    private final BiConsumer<TradeMilestones, LocalDateTime> writer;

    MilestoneThreshold(
            double pct,
            Function<TradeMilestones, LocalDateTime> reader,
            BiConsumer<TradeMilestones, LocalDateTime> writer) {
        this.pct = pct;
        this.reader = reader;
        this.writer = writer;
    }

    public double getPct() {
        return pct;
    }

    public boolean isProfit() {
        return pct > 0;
    }

    public boolean isCrossedBy(double pnlPct) {
        return isProfit() ? pnlPct >= pct : pnlPct <= pct;
    }

    public LocalDateTime reachedAt(TradeMilestones milestones) {
        return reader.apply(milestones);
    }

    /** Stamps the threshold if it has not been reached yet. Returns true when stamped. */
    public boolean markReached(TradeMilestones milestones, LocalDateTime at) {
        if (reader.apply(milestones) != null) {
            return false;
        }
        writer.accept(milestones, at);
        return true;
    }
}
