package com.cryptobot.server;

import com.cryptobot.core.bot.BotController;
import com.cryptobot.core.bot.BotStatus;
import com.cryptobot.metrics.MetricsService;
import com.cryptobot.websocket.BotWebSocketHandler;
import com.cryptobot.websocket.WebSocketBroadcaster;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hosts the dashboard WebSocket plus {@code /health} and {@code /metrics}.
 */
public final class BotServer {
    private static final Logger logger = LoggerFactory.getLogger(BotServer.class);
    public static final String WS_PATH = "/ws";

    private final Javalin app;
    private final int port;

    public BotServer(int port, BotWebSocketHandler handler, WebSocketBroadcaster broadcaster,
                     BotController controller, MetricsService metrics) {
        this.port = port;
        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;

            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));

            javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(it -> {
                it.reflectClientOrigin = true;
                it.allowCredentials = true;
            }));
        });

        app.ws(WS_PATH, handler::configure);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metrics.scrape());
        });

        app.get("/health", ctx -> {
            BotStatus status = controller.status();
            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("bot_state", status.state().name());
            health.put("mode", status.mode().name());
            health.put("open_positions", status.openPositions().size());
            health.put("connected_clients", broadcaster.getConnectedClients());
            ctx.json(health);
        });
    }

    public void start() {
        app.start(port);
        logger.info("🚀 Bot server started at http://localhost:{}", port);
        logger.info("   WebSocket: ws://localhost:{}{}", port, WS_PATH);
        logger.info("   Health: http://localhost:{}/health", port);
        logger.info("   Metrics: http://localhost:{}/metrics", port);
    }

    public void stop() {
        app.stop();
        logger.info("Bot server stopped");
    }
}
