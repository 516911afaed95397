package com.cryptobot.core.decision;

import com.cryptobot.core.model.Trade;

/**
 * Outcome of running an analysis through the decision gates.
 */
public sealed interface TradeDecision permits TradeDecision.Rejected, TradeDecision.AwaitingApproval,
        TradeDecision.Aborted, TradeDecision.Executed, TradeDecision.Exited {

    String symbol();

    /** A gate said no. Nothing was mutated. */
    record Rejected(String symbol, String reason) implements TradeDecision {}

    /** Manual approval mode: parked until someone confirms it. */
    record AwaitingApproval(PendingTrade pending) implements TradeDecision {
        @Override
        public String symbol() {
            return pending.symbol();
        }
    }

    /** Price moved past the slippage tolerance between decision and submission. */
    record Aborted(String symbol, String reason) implements TradeDecision {}

    record Executed(Trade trade) implements TradeDecision {
        @Override
        public String symbol() {
            return trade.symbol();
        }
    }

    /** An open position was closed because the signal turned against it. */
    record Exited(Trade trade) implements TradeDecision {
        @Override
        public String symbol() {
            return trade.symbol();
        }
    }
}
