package com.cryptobot.protocol;

import com.cryptobot.core.bot.BotStatus;
import com.cryptobot.core.config.BotConfigParser;
import com.cryptobot.core.decision.PendingTrade;
import com.cryptobot.core.decision.TradeDecision;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.WalletSummary;
import com.cryptobot.core.model.WalletType;
import com.cryptobot.core.store.PairStatus;
import com.cryptobot.core.store.TradeStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Renders domain objects as the snake_case JSON the dashboard reads, and wraps them in
 * {@code {type, timestamp, data}} envelopes.
 */
public final class ProtocolMapper {
    private final ObjectMapper mapper;
    private final BotConfigParser configParser;
    private final Function<String, Optional<Double>> lastPrices;
    private final Clock clock;

    public ProtocolMapper(ObjectMapper mapper, Function<String, Optional<Double>> lastPrices, Clock clock) {
        this.mapper = mapper;
        this.configParser = new BotConfigParser(mapper);
        this.lastPrices = lastPrices;
        this.clock = clock;
    }

    public ObjectMapper objectMapper() {
        return mapper;
    }

    public ObjectNode createObject() {
        return mapper.createObjectNode();
    }

    public ArrayNode createArray() {
        return mapper.createArrayNode();
    }

    public ObjectNode message(String type, ObjectNode data) {
        ObjectNode message = mapper.createObjectNode();
        message.put("type", type);
        message.put("timestamp", clock.millis());
        message.set("data", data);
        return message;
    }

    public ObjectNode error(String text) {
        ObjectNode data = mapper.createObjectNode();
        data.put("message", text);
        return message("error", data);
    }

    public ObjectNode position(Position position) {
        ObjectNode node = mapper.createObjectNode();
        node.put("symbol", position.symbol());
        node.put("direction", position.direction().name());
        node.put("entry_price", position.entryPrice());
        node.put("quantity", position.quantity());
        node.put("notional_usdt", position.notional());
        node.put("status", position.status().name());
        node.put("opened_at", iso(position.openedAt()));
        node.put("trailing_armed", position.trailingArmed());
        node.put("trailing_peak_pnl", position.trailingPeakPnl());
        node.put("open_trade_id", position.openTradeId());

        Optional<Double> price = lastPrices.apply(position.symbol());
        if (price.isPresent()) {
            node.put("current_price", price.get());
            node.put("unrealized_pnl", position.unrealizedPnl(price.get()));
            node.put("pnl_percent", position.pnlPercent(price.get()));
        } else {
            node.putNull("current_price");
            node.put("unrealized_pnl", 0.0);
            node.put("pnl_percent", 0.0);
        }
        return node;
    }

    public ArrayNode positions(Collection<Position> positions) {
        ArrayNode array = mapper.createArrayNode();
        positions.forEach(p -> array.add(position(p)));
        return array;
    }

    public ObjectNode trade(Trade trade) {
        ObjectNode node = mapper.createObjectNode();
        node.put("trade_id", trade.tradeId());
        node.put("symbol", trade.symbol());
        node.put("direction", trade.direction().name());
        node.put("intent", trade.intent().name());
        node.put("requested_price", trade.requestedPrice());
        node.put("executed_price", trade.executedPrice());
        node.put("quantity", trade.quantity());
        node.put("notional_usdt", trade.notional());
        node.put("mode", trade.mode().name());
        node.put("status", trade.status().name());
        node.put("timestamp", iso(trade.timestamp()));
        node.put("realized_pnl", trade.realizedPnl());
        node.put("detail", trade.detail());
        return node;
    }

    public ArrayNode trades(Collection<Trade> trades) {
        ArrayNode array = mapper.createArrayNode();
        trades.forEach(t -> array.add(trade(t)));
        return array;
    }

    public ObjectNode analysis(AnalysisResult result) {
        ObjectNode node = mapper.createObjectNode();
        node.put("symbol", result.symbol());
        node.put("final_action", result.finalAction().name());
        node.put("combined_confidence", result.combinedConfidence());
        node.put("timestamp", iso(result.timestamp()));
        ArrayNode signals = node.putArray("signals");
        for (SourceSignal signal : result.signals()) {
            ObjectNode s = signals.addObject();
            s.put("source", signal.sourceId());
            s.put("action", signal.action().name());
            s.put("confidence", signal.confidence());
        }
        return node;
    }

    public ArrayNode analyses(Collection<AnalysisResult> results) {
        ArrayNode array = mapper.createArrayNode();
        results.forEach(r -> array.add(analysis(r)));
        return array;
    }

    public ObjectNode pending(PendingTrade pending) {
        ObjectNode node = mapper.createObjectNode();
        node.put("trade_id", pending.tradeId());
        node.put("symbol", pending.symbol());
        node.put("direction", pending.direction().name());
        node.put("amount_usdt", pending.notionalUsdt());
        node.put("decision_price", pending.decisionPrice());
        node.put("confidence", pending.confidence());
        node.put("created_at", iso(pending.createdAt()));
        return node;
    }

    public ArrayNode pendingTrades(Collection<PendingTrade> pending) {
        ArrayNode array = mapper.createArrayNode();
        pending.forEach(p -> array.add(pending(p)));
        return array;
    }

    public ObjectNode decision(TradeDecision decision) {
        ObjectNode node = mapper.createObjectNode();
        node.put("symbol", decision.symbol());
        if (decision instanceof TradeDecision.Rejected rejected) {
            node.put("outcome", "rejected");
            node.put("reason", rejected.reason());
        } else if (decision instanceof TradeDecision.Aborted aborted) {
            node.put("outcome", "aborted");
            node.put("reason", aborted.reason());
        } else if (decision instanceof TradeDecision.AwaitingApproval awaiting) {
            node.put("outcome", "awaiting_approval");
            node.set("pending", pending(awaiting.pending()));
        } else if (decision instanceof TradeDecision.Executed executed) {
            node.put("outcome", "executed");
            node.set("trade", trade(executed.trade()));
        } else if (decision instanceof TradeDecision.Exited exited) {
            node.put("outcome", "exited");
            node.set("trade", trade(exited.trade()));
        }
        return node;
    }

    public ObjectNode balance(Balance balance) {
        ObjectNode node = mapper.createObjectNode();
        node.put("asset", balance.asset());
        node.put("free", balance.free());
        node.put("locked", balance.locked());
        node.put("total", balance.total());
        node.put("wallet_type", balance.walletType().name());
        return node;
    }

    public ArrayNode balances(Collection<Balance> balances) {
        ArrayNode array = mapper.createArrayNode();
        balances.forEach(b -> array.add(balance(b)));
        return array;
    }

    public ObjectNode wallets(Map<WalletType, WalletSummary> wallets) {
        ObjectNode node = mapper.createObjectNode();
        wallets.forEach((type, summary) -> {
            ObjectNode wallet = node.putObject(type.name());
            wallet.put("name", summary.name());
            wallet.set("balances", balances(summary.balances()));
            wallet.put("total_usdt", summary.totalUsdt());
        });
        return node;
    }

    public ObjectNode stats(TradeStats stats) {
        ObjectNode node = mapper.createObjectNode();
        node.put("trades_today", stats.tradesToday());
        node.put("total_trades", stats.totalTrades());
        node.put("winning_trades", stats.winningTrades());
        node.put("win_rate", stats.winRate());
        node.put("total_profit", stats.totalProfit());
        return node;
    }

    public ObjectNode status(BotStatus status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("enabled", status.enabled());
        node.put("state", status.state().name());
        node.put("mode", status.mode().name());
        node.set("config", configParser.toJson(status.config()));
        node.set("positions", positions(status.openPositions()));
        node.put("active_trades", status.openPositions().size());
        node.set("stats", stats(status.stats()));
        ObjectNode pairs = node.putObject("pair_status");
        for (Map.Entry<String, PairStatus> entry : status.pairStatus().entrySet()) {
            pairs.put(entry.getKey(), entry.getValue().name());
        }
        node.put("pending_approvals", status.pendingApprovals());
        node.put("start_time", status.startTime() == null ? null : iso(status.startTime()));
        node.put("running_duration_secs", status.runningDurationSecs());
        return node;
    }

    private static String iso(Instant instant) {
        return instant.toString();
    }
}
