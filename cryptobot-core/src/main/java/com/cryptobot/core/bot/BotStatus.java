package com.cryptobot.core.bot;

import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.store.PairStatus;
import com.cryptobot.core.store.TradeStats;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the bot. {@code startTime} is null while stopped.
 */
public record BotStatus(
    boolean enabled,
    BotState state,
    TradingMode mode,
    BotConfig config,
    List<Position> openPositions,
    TradeStats stats,
    Map<String, PairStatus> pairStatus,
    int pendingApprovals,
    Instant startTime,
    long runningDurationSecs
) {
    public BotStatus {
        openPositions = List.copyOf(openPositions);
        pairStatus = Map.copyOf(pairStatus);
    }
}
