package com.cryptobot.websocket;

import com.cryptobot.protocol.RequestDispatcher;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.websocket.WsCloseContext;
import io.javalin.websocket.WsConfig;
import io.javalin.websocket.WsConnectContext;
import io.javalin.websocket.WsErrorContext;
import io.javalin.websocket.WsMessageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request/response side of the dashboard socket. Each inbound frame gets exactly one reply
 * on the same session; events go out through the {@link WebSocketBroadcaster}.
 */
public final class BotWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(BotWebSocketHandler.class);

    private final RequestDispatcher dispatcher;
    private final WebSocketBroadcaster broadcaster;

    public BotWebSocketHandler(RequestDispatcher dispatcher, WebSocketBroadcaster broadcaster) {
        this.dispatcher = dispatcher;
        this.broadcaster = broadcaster;
    }

    public void configure(WsConfig ws) {
        ws.onConnect(this::onConnect);
        ws.onMessage(this::onMessage);
        ws.onClose(this::onClose);
        ws.onError(this::onError);
    }

    void onConnect(WsConnectContext ctx) {
        broadcaster.register(ctx);
        logger.info("WebSocket connected: {} (total: {})", ctx.sessionId(), broadcaster.getConnectedClients());
    }

    void onMessage(WsMessageContext ctx) {
        String message = ctx.message();
        logger.debug("Received message from {}: {}", ctx.sessionId(), message);
        ObjectNode response = dispatcher.handle(message);
        broadcaster.send(ctx, response.toString());
    }

    void onClose(WsCloseContext ctx) {
        broadcaster.unregister(ctx.sessionId());
        logger.info("WebSocket closed: {} (remaining: {})", ctx.sessionId(), broadcaster.getConnectedClients());
    }

    void onError(WsErrorContext ctx) {
        logger.error("WebSocket error for session {}", ctx.sessionId(), ctx.error());
        broadcaster.unregister(ctx.sessionId());
    }
}
