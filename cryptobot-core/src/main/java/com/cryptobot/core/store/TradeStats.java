package com.cryptobot.core.store;

/**
 * Counters over the life of the store.
 *
 * @param totalTrades closed trades
 * @param totalProfit realized PnL across closed trades, USDT
 */
public record TradeStats(int tradesToday, int totalTrades, int winningTrades, double totalProfit) {

    public double winRate() {
        return totalTrades == 0 ? 0.0 : (double) winningTrades / totalTrades * 100.0;
    }
}
