package com.cryptobot.websocket;

import com.cryptobot.core.bot.BotStatus;
import com.cryptobot.core.decision.PendingTrade;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.Trade;
import com.cryptobot.protocol.ProtocolMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.websocket.WsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans bot events out to every connected dashboard. A session that fails a send is dropped.
 */
public final class WebSocketBroadcaster implements BotEventListener {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketBroadcaster.class);

    private final Map<String, WsContext> sessions = new ConcurrentHashMap<>();
    private final ReentrantLock broadcastLock = new ReentrantLock();
    private final ProtocolMapper json;

    public WebSocketBroadcaster(ProtocolMapper json) {
        this.json = json;
    }

    public void register(WsContext ctx) {
        sessions.put(ctx.sessionId(), ctx);
    }

    public void unregister(String sessionId) {
        sessions.remove(sessionId);
    }

    public int getConnectedClients() {
        return sessions.size();
    }

    @Override
    public void onAnalysis(AnalysisResult result) {
        broadcast(json.message("analysis_log", json.analysis(result)));
    }

    @Override
    public void onTradeExecuted(Trade trade) {
        ObjectNode data = json.createObject();
        data.put("success", trade.isFilled());
        data.set("trade", json.trade(trade));
        broadcast(json.message("trade_executed", data));
    }

    @Override
    public void onPositionClosed(Trade closeTrade) {
        ObjectNode data = json.createObject();
        data.put("symbol", closeTrade.symbol());
        data.put("reason", closeTrade.detail());
        data.put("realized_pnl", closeTrade.realizedPnl());
        data.set("trade", json.trade(closeTrade));
        broadcast(json.message("position_closed", data));
    }

    @Override
    public void onPendingTrade(PendingTrade pending) {
        broadcast(json.message("pending_trade", json.pending(pending)));
    }

    @Override
    public void onBotStatus(BotStatus status) {
        broadcast(json.message("bot_status_response", json.status(status)));
    }

    void broadcast(ObjectNode message) {
        String payload = message.toString();
        broadcastLock.lock();
        try {
            sessions.values().forEach(ctx -> send(ctx, payload));
        } finally {
            broadcastLock.unlock();
        }
    }

    void send(WsContext ctx, String payload) {
        try {
            ctx.send(payload);
        } catch (RuntimeException e) {
            logger.error("Failed to send message to session {}", ctx.sessionId(), e);
            sessions.remove(ctx.sessionId());
        }
    }
}
