package com.cryptobot.protocol;

import com.cryptobot.core.bot.ManualTrade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded client request. Each variant maps to exactly one response type; {@link Visitor} keeps
 * the dispatcher exhaustive.
 */
public sealed interface BotRequest {

    String type();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(Ping request);
        R visit(StartBot request);
        R visit(StopBot request);
        R visit(GetBotStatus request);
        R visit(UpdateBotConfig request);
        R visit(GetPositions request);
        R visit(GetTradeHistory request);
        R visit(GetAiAnalysis request);
        R visit(GetAnalysisLogs request);
        R visit(ExecuteTrade request);
        R visit(ClosePosition request);
        R visit(ApproveTrade request);
        R visit(RejectTrade request);
        R visit(GetPendingTrades request);
        R visit(SetTradingMode request);
        R visit(GetTradingBalance request);
        R visit(GetAllTradingBalances request);
        R visit(GetCategorizedBalances request);
        R visit(GetPortfolioSummary request);
        R visit(Unknown request);
    }

    record Ping() implements BotRequest {
        public String type() { return "ping"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /** @param config partial overrides, may be null */
    record StartBot(JsonNode config) implements BotRequest {
        public String type() { return "start_bot"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record StopBot() implements BotRequest {
        public String type() { return "stop_bot"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetBotStatus() implements BotRequest {
        public String type() { return "get_bot_status"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record UpdateBotConfig(JsonNode config) implements BotRequest {
        public String type() { return "update_bot_config"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetPositions() implements BotRequest {
        public String type() { return "get_positions"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetTradeHistory(int limit) implements BotRequest {
        public String type() { return "get_trade_history"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetAiAnalysis(String symbol) implements BotRequest {
        public String type() { return "get_ai_analysis"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetAnalysisLogs(int limit) implements BotRequest {
        public String type() { return "get_analysis_logs"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ExecuteTrade(ManualTrade trade) implements BotRequest {
        public String type() { return "execute_trade"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ClosePosition(String symbol) implements BotRequest {
        public String type() { return "close_position"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record ApproveTrade(String tradeId) implements BotRequest {
        public String type() { return "approve_trade"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record RejectTrade(String tradeId) implements BotRequest {
        public String type() { return "reject_trade"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetPendingTrades() implements BotRequest {
        public String type() { return "get_pending_trades"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record SetTradingMode(TradingMode mode) implements BotRequest {
        public String type() { return "set_trading_mode"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /** @param walletType null means the trading wallet */
    record GetTradingBalance(String asset, WalletType walletType) implements BotRequest {
        public String type() { return "get_trading_balance"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetAllTradingBalances() implements BotRequest {
        public String type() { return "get_all_trading_balances"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetCategorizedBalances() implements BotRequest {
        public String type() { return "get_categorized_balances"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    record GetPortfolioSummary() implements BotRequest {
        public String type() { return "get_portfolio_summary"; }
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }

    /** Well-formed frame with a type nobody handles. */
    record Unknown(String type) implements BotRequest {
        public <R> R accept(Visitor<R> visitor) { return visitor.visit(this); }
    }
}
