package com.cryptobot.core.event;

import com.cryptobot.core.bot.BotStatus;
import com.cryptobot.core.decision.PendingTrade;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.Trade;

/**
 * Notifications pushed out of the core. All methods default to no-ops.
 * Implementations must not block; they are called from the scheduler and monitor threads.
 */
public interface BotEventListener {

    BotEventListener NOOP = new BotEventListener() { };

    default void onAnalysis(AnalysisResult result) {
    }

    default void onTradeExecuted(Trade trade) {
    }

    default void onPositionClosed(Trade closeTrade) {
    }

    default void onPendingTrade(PendingTrade pending) {
    }

    default void onBotStatus(BotStatus status) {
    }
}
