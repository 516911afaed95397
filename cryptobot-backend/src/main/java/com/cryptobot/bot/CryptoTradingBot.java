package com.cryptobot.bot;

import com.cryptobot.config.TradingConfig;
import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.bot.BotController;
import com.cryptobot.core.decision.ApprovalQueue;
import com.cryptobot.core.decision.TradeDecisionEngine;
import com.cryptobot.core.error.ConfigException;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.exchange.ResilientExchangeClient;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.scheduler.AnalysisLog;
import com.cryptobot.core.signal.SignalAggregator;
import com.cryptobot.core.signal.SignalPoller;
import com.cryptobot.core.signal.SignalSource;
import com.cryptobot.core.signal.SymbolAnalyzer;
import com.cryptobot.core.signal.indicator.MacdSignalSource;
import com.cryptobot.core.signal.indicator.MomentumSignalSource;
import com.cryptobot.core.signal.indicator.TrendSignalSource;
import com.cryptobot.core.store.PositionStore;
import com.cryptobot.exchange.DisconnectedExchangeClient;
import com.cryptobot.market.BinanceMarketDataClient;
import com.cryptobot.metrics.MetricsService;
import com.cryptobot.persistence.SqliteTradeJournal;
import com.cryptobot.protocol.ProtocolMapper;
import com.cryptobot.protocol.RequestDispatcher;
import com.cryptobot.protocol.RequestParser;
import com.cryptobot.server.BotServer;
import com.cryptobot.websocket.BotWebSocketHandler;
import com.cryptobot.websocket.WebSocketBroadcaster;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Process entry point: wires the core, opens the journal and serves the dashboard socket.
 * The bot itself starts only when a client sends {@code start_bot}.
 */
public final class CryptoTradingBot {
    private static final Logger logger = LoggerFactory.getLogger(CryptoTradingBot.class);

    private CryptoTradingBot() {
    }

    public static void main(String[] args) {
        var config = TradingConfig.getInstance();
        var metrics = MetricsService.getInstance();
        MeterRegistry registry = metrics.getRegistry();
        Clock clock = Clock.systemUTC();

        var mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        MarketDataProvider marketData = new BinanceMarketDataClient(
            config.getMarketDataBaseUrl(), config.getKlineInterval());
        ExchangeClient exchange = new ResilientExchangeClient(new DisconnectedExchangeClient(), registry);
        var store = new PositionStore(clock);
        var journal = new SqliteTradeJournal(config.getTradeDbPath());

        var json = new ProtocolMapper(mapper, store::lastPrice, clock);
        var broadcaster = new WebSocketBroadcaster(json);

        var balances = new BalanceResolver(exchange, marketData, store,
            config.getPaperBalance(), config.getDefaultWalletType());
        var gateway = new ExecutionGateway(store, exchange, journal, broadcaster, registry, clock);

        List<SignalSource> sources = List.of(
            new TrendSignalSource(marketData),
            new MomentumSignalSource(marketData),
            new MacdSignalSource(marketData));
        var poller = new SignalPoller(sources, config.getSourceTimeout(), registry);
        var analyzer = new SymbolAnalyzer(poller, new SignalAggregator(), clock);

        var approvals = new ApprovalQueue();
        var analysisLog = new AnalysisLog();
        var engine = new TradeDecisionEngine(store, balances, gateway, marketData, approvals,
            broadcaster, registry, clock);
        var controller = new BotController(store, analyzer, engine, gateway, balances, marketData,
            analysisLog, approvals, broadcaster, registry, clock, config.getTradingMode(),
            config.getControllerSettings());

        try {
            controller.updateConfig(config.getDefaultBotConfig());
        } catch (ConfigException e) {
            logger.error("Invalid BOT_* settings in config.properties: {}", e.getMessage());
            poller.close();
            journal.close();
            System.exit(1);
        }

        var dispatcher = new RequestDispatcher(controller, balances, store, journal, analysisLog, approvals,
            analyzer, new RequestParser(mapper), json, metrics);
        var server = new BotServer(config.getServerPort(), new BotWebSocketHandler(dispatcher, broadcaster),
            broadcaster, controller, metrics);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping bot...");
            controller.stop();
            server.stop();
            poller.close();
            journal.close();
        }, "shutdown-hook"));

        server.start();
        logger.info("🤖 Crypto trading bot ready in {} mode; waiting for start_bot", controller.mode());
    }
}
