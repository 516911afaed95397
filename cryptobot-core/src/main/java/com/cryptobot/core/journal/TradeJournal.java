package com.cryptobot.core.journal;

import com.cryptobot.core.model.Trade;

import java.util.List;

/**
 * Durable trade history.
 */
public interface TradeJournal {

    void record(Trade trade);

    /**
     * Most recent trades first.
     */
    List<Trade> recent(int limit);
}
