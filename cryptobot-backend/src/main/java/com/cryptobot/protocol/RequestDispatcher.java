package com.cryptobot.protocol;

import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.bot.BotController;
import com.cryptobot.core.bot.BotStatus;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.config.BotConfigParser;
import com.cryptobot.core.decision.ApprovalQueue;
import com.cryptobot.core.decision.TradeDecision;
import com.cryptobot.core.error.ConfigException;
import com.cryptobot.core.error.ExchangeException;
import com.cryptobot.core.error.TradingException;
import com.cryptobot.core.journal.TradeJournal;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.scheduler.AnalysisLog;
import com.cryptobot.core.signal.SymbolAnalyzer;
import com.cryptobot.core.store.PositionStore;
import com.cryptobot.core.store.TradeStats;
import com.cryptobot.metrics.MetricsService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns each {@link BotRequest} into exactly one response frame. Failures never escape:
 * they come back as an {@code error} frame carrying the message.
 */
public final class RequestDispatcher implements BotRequest.Visitor<ObjectNode> {
    private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

    private final BotController controller;
    private final BalanceResolver balances;
    private final PositionStore store;
    private final TradeJournal journal;
    private final AnalysisLog analysisLog;
    private final ApprovalQueue approvals;
    private final SymbolAnalyzer analyzer;
    private final RequestParser parser;
    private final BotConfigParser configParser;
    private final ProtocolMapper json;
    private final MetricsService metrics;

    public RequestDispatcher(BotController controller, BalanceResolver balances, PositionStore store,
                             TradeJournal journal, AnalysisLog analysisLog, ApprovalQueue approvals,
                             SymbolAnalyzer analyzer, RequestParser parser, ProtocolMapper json,
                             MetricsService metrics) {
        this.controller = controller;
        this.balances = balances;
        this.store = store;
        this.journal = journal;
        this.analysisLog = analysisLog;
        this.approvals = approvals;
        this.analyzer = analyzer;
        this.parser = parser;
        this.configParser = new BotConfigParser(json.objectMapper());
        this.json = json;
        this.metrics = metrics;
    }

    /**
     * Parse and dispatch one raw frame.
     */
    public ObjectNode handle(String frame) {
        BotRequest request;
        try {
            request = parser.parse(frame);
        } catch (ProtocolException e) {
            logger.warn("Rejected client frame: {}", e.getMessage());
            metrics.incrementRequestErrors("invalid");
            return json.error(e.getMessage());
        }
        return dispatch(request);
    }

    public ObjectNode dispatch(BotRequest request) {
        metrics.incrementRequests(request.type());
        try {
            return request.accept(this);
        } catch (ConfigException e) {
            metrics.incrementRequestErrors(request.type());
            logger.warn("{} rejected: {}", request.type(), e.getMessage());
            ObjectNode response = json.error(e.getMessage());
            var violations = ((ObjectNode) response.get("data")).putArray("violations");
            e.getViolations().forEach(violations::add);
            return response;
        } catch (ExchangeException e) {
            metrics.incrementRequestErrors(request.type());
            logger.error("❌ {} failed at the exchange: {}", request.type(), e.getMessage());
            ObjectNode response = json.error(e.getMessage());
            e.getFailedTrade().ifPresent(trade -> ((ObjectNode) response.get("data")).set("trade", json.trade(trade)));
            return response;
        } catch (TradingException | IllegalArgumentException | IllegalStateException e) {
            metrics.incrementRequestErrors(request.type());
            logger.warn("{} rejected: {}", request.type(), e.getMessage());
            return json.error(e.getMessage());
        } catch (RuntimeException e) {
            metrics.incrementRequestErrors(request.type());
            logger.error("Unexpected failure handling {}", request.type(), e);
            return json.error("Internal error: " + e.getMessage());
        }
    }

    @Override
    public ObjectNode visit(BotRequest.Ping request) {
        return json.message("pong", json.createObject());
    }

    @Override
    public ObjectNode visit(BotRequest.StartBot request) {
        BotConfig config = configParser.parse(request.config(), controller.config());
        BotStatus status = controller.start(config);
        ObjectNode data = json.createObject();
        data.put("success", true);
        data.put("message", "Bot started in " + status.mode() + " mode");
        data.set("status", json.status(status));
        return json.message("bot_start_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.StopBot request) {
        boolean stopped = controller.stop();
        ObjectNode data = json.createObject();
        data.put("success", stopped);
        data.put("message", stopped ? "Bot stopped" : "Bot is not running");
        data.set("status", json.status(controller.status()));
        return json.message("bot_stop_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetBotStatus request) {
        return json.message("bot_status_response", json.status(controller.status()));
    }

    @Override
    public ObjectNode visit(BotRequest.UpdateBotConfig request) {
        BotConfig updated = controller.updateConfig(configParser.parse(request.config(), controller.config()));
        ObjectNode data = json.createObject();
        data.put("success", true);
        data.set("config", configParser.toJson(updated));
        return json.message("bot_config_updated", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetPositions request) {
        ObjectNode data = json.createObject();
        data.set("positions", json.positions(store.positions()));
        return json.message("positions_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetTradeHistory request) {
        ObjectNode data = json.createObject();
        data.set("trades", json.trades(journal.recent(request.limit())));
        return json.message("trade_history_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetAiAnalysis request) {
        AnalysisResult result = analyzer.analyze(request.symbol(), controller.config());
        ObjectNode data = json.createObject();
        data.set("analysis", json.analysis(result));
        return json.message("ai_analysis_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetAnalysisLogs request) {
        ObjectNode data = json.createObject();
        data.set("logs", json.analyses(analysisLog.recent(request.limit())));
        return json.message("analysis_logs_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.ExecuteTrade request) {
        Trade trade = controller.executeTrade(request.trade());
        ObjectNode data = json.createObject();
        data.put("success", trade.isFilled());
        data.set("trade", json.trade(trade));
        return json.message("trade_executed", data);
    }

    @Override
    public ObjectNode visit(BotRequest.ClosePosition request) {
        Trade trade = controller.closePosition(request.symbol());
        ObjectNode data = json.createObject();
        data.put("success", trade.isFilled());
        data.put("symbol", request.symbol());
        data.set("trade", json.trade(trade));
        return json.message("position_close_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.ApproveTrade request) {
        TradeDecision decision = controller.approveTrade(request.tradeId());
        ObjectNode data = json.createObject();
        data.put("trade_id", request.tradeId());
        data.put("success", decision instanceof TradeDecision.Executed);
        data.set("decision", json.decision(decision));
        return json.message("trade_approved", data);
    }

    @Override
    public ObjectNode visit(BotRequest.RejectTrade request) {
        boolean removed = controller.rejectTrade(request.tradeId());
        ObjectNode data = json.createObject();
        data.put("trade_id", request.tradeId());
        data.put("success", removed);
        return json.message("trade_rejected", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetPendingTrades request) {
        ObjectNode data = json.createObject();
        data.set("pending_trades", json.pendingTrades(approvals.list()));
        return json.message("pending_trades_response", data);
    }

    @Override
    public ObjectNode visit(BotRequest.SetTradingMode request) {
        controller.setTradingMode(request.mode());
        ObjectNode data = json.createObject();
        data.put("success", true);
        data.put("mode", controller.mode().name());
        return json.message("trading_mode_set", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetTradingBalance request) {
        TradingMode mode = controller.mode();
        Balance balance = balances.getBalance(request.asset(), mode, request.walletType());
        ObjectNode data = json.balance(balance);
        data.put("mode", mode.name());
        return json.message("trading_balance", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetAllTradingBalances request) {
        TradingMode mode = controller.mode();
        ObjectNode data = json.createObject();
        data.put("mode", mode.name());
        data.set("balances", json.balances(balances.getAllBalances(mode)));
        return json.message("all_trading_balances", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetCategorizedBalances request) {
        TradingMode mode = controller.mode();
        ObjectNode data = json.createObject();
        data.put("mode", mode.name());
        data.set("wallets", json.wallets(balances.getCategorizedBalances(mode)));
        return json.message("categorized_balances", data);
    }

    @Override
    public ObjectNode visit(BotRequest.GetPortfolioSummary request) {
        TradingMode mode = controller.mode();
        List<Balance> all = balances.getAllBalances(mode);
        TradeStats stats = store.stats();

        double unrealized = 0.0;
        for (Position position : store.positions()) {
            Optional<Double> price = store.lastPrice(position.symbol());
            if (price.isPresent()) {
                unrealized += position.unrealizedPnl(price.get());
            }
        }

        double realized = stats.totalProfit();
        double totalValue;
        double initial;
        if (mode == TradingMode.MOCK) {
            // the paper ledger is fixed; account value tracks booked and open PnL on top of it
            initial = balances.paperBalance();
            totalValue = initial + realized + unrealized;
        } else {
            totalValue = balances.valueInUsdt(all) + unrealized;
            initial = totalValue - realized - unrealized;
        }
        double pnl = realized + unrealized;

        ObjectNode data = json.createObject();
        data.put("mode", mode.name());
        data.put("total_value_usdt", totalValue);
        data.put("initial_balance", initial);
        data.put("pnl", pnl);
        data.put("pnl_percentage", initial > 0 ? pnl / initial * 100.0 : 0.0);
        data.put("realized_pnl", realized);
        data.put("unrealized_pnl", unrealized);
        data.put("open_positions", store.activePositionCount());
        data.set("balances", json.balances(all));
        return json.message("portfolio_summary", data);
    }

    @Override
    public ObjectNode visit(BotRequest.Unknown request) {
        logger.warn("Unknown message type from client: {}", request.type());
        return json.error("Unknown message type: " + request.type());
    }
}
