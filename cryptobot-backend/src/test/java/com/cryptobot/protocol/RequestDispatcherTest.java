package com.cryptobot.protocol;

import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.bot.BotController;
import com.cryptobot.core.decision.ApprovalQueue;
import com.cryptobot.core.decision.TradeDecisionEngine;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.journal.InMemoryTradeJournal;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletType;
import com.cryptobot.core.scheduler.AnalysisLog;
import com.cryptobot.core.signal.SignalAggregator;
import com.cryptobot.core.signal.SignalPoller;
import com.cryptobot.core.signal.SymbolAnalyzer;
import com.cryptobot.core.store.PositionStore;
import com.cryptobot.metrics.MetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RequestDispatcher Tests")
class RequestDispatcherTest {

    @Mock
    private MarketDataProvider marketData;

    @Mock
    private ExchangeClient exchange;

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private PositionStore store;
    private BotController controller;
    private SignalPoller poller;
    private RequestDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        var mapper = new ObjectMapper();
        var registry = new SimpleMeterRegistry();
        store = new PositionStore(clock);
        var journal = new InMemoryTradeJournal();
        var approvals = new ApprovalQueue();
        var analysisLog = new AnalysisLog();
        var balances = new BalanceResolver(exchange, marketData, store, 100_000.0, WalletType.FUTURES);
        var gateway = new ExecutionGateway(store, exchange, journal, BotEventListener.NOOP, registry, clock);
        var engine = new TradeDecisionEngine(store, balances, gateway, marketData, approvals,
            BotEventListener.NOOP, registry, clock);
        poller = new SignalPoller(List.of(), Duration.ofSeconds(1), registry);
        var analyzer = new SymbolAnalyzer(poller, new SignalAggregator(), clock);

        controller = new BotController(store, analyzer, engine, gateway, balances, marketData, analysisLog,
            approvals, BotEventListener.NOOP, registry, clock, TradingMode.MOCK,
            new BotController.Settings(Duration.ofMillis(50), Duration.ofMillis(10), Duration.ofSeconds(2)));

        dispatcher = new RequestDispatcher(controller, balances, store, journal, analysisLog, approvals, analyzer,
            new RequestParser(mapper, () -> "trade-1"), new ProtocolMapper(mapper, store::lastPrice, clock),
            MetricsService.getInstance());
    }

    @AfterEach
    void tearDown() {
        controller.stop();
        poller.close();
    }

    private static JsonNode data(ObjectNode response) {
        return response.get("data");
    }

    @Test
    @DisplayName("Should answer ping with a timestamped pong")
    void ping() {
        ObjectNode response = dispatcher.handle("{\"type\": \"ping\"}");

        assertThat(response.get("type").asText()).isEqualTo("pong");
        assertThat(response.get("timestamp").asLong()).isEqualTo(clock.millis());
    }

    @Test
    @DisplayName("Should answer an unknown type with an error frame")
    void unknownType() {
        ObjectNode response = dispatcher.handle("{\"type\": \"warp_drive\"}");

        assertThat(response.get("type").asText()).isEqualTo("error");
        assertThat(data(response).get("message").asText()).isEqualTo("Unknown message type: warp_drive");
    }

    @Test
    @DisplayName("Should turn a malformed frame into an error frame")
    void malformed() {
        assertThat(dispatcher.handle("{oops").get("type").asText()).isEqualTo("error");
    }

    @Nested
    @DisplayName("Bot lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should report a stopped bot")
        void status() {
            JsonNode status = data(dispatcher.handle("{\"type\": \"get_bot_status\"}"));

            assertThat(status.get("enabled").asBoolean()).isFalse();
            assertThat(status.get("state").asText()).isEqualTo("STOPPED");
            assertThat(status.get("mode").asText()).isEqualTo("MOCK");
            assertThat(status.get("config").get("max_concurrent_trades").asInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should start with overrides and then stop")
        void startStop() {
            ObjectNode started = dispatcher.handle(
                "{\"type\": \"start_bot\", \"config\": {\"allowed_pairs\": [\"BTCUSDT\"], \"trade_interval_secs\": 3600}}");

            assertThat(started.get("type").asText()).isEqualTo("bot_start_response");
            assertThat(data(started).get("success").asBoolean()).isTrue();
            assertThat(data(started).get("status").get("config").get("allowed_pairs"))
                .extracting(JsonNode::asText).containsExactly("BTCUSDT");

            ObjectNode stopped = dispatcher.handle("{\"type\": \"stop_bot\"}");
            assertThat(data(stopped).get("success").asBoolean()).isTrue();
            assertThat(data(stopped).get("status").get("enabled").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("Should list every violation of an invalid config")
        void invalidConfig() {
            ObjectNode response = dispatcher.handle(
                "{\"type\": \"start_bot\", \"config\": {\"ai_confidence_threshold\": 2.0, \"allowed_pairs\": []}}");

            assertThat(response.get("type").asText()).isEqualTo("error");
            assertThat(data(response).get("violations")).hasSize(2);
            assertThat(controller.isRunning()).isFalse();
        }

        @Test
        @DisplayName("Should refuse a mode switch while running")
        void modeWhileRunning() {
            dispatcher.handle("{\"type\": \"start_bot\", \"config\": {\"trade_interval_secs\": 3600}}");

            ObjectNode response = dispatcher.handle("{\"type\": \"set_trading_mode\", \"mode\": \"LIVE\"}");

            assertThat(response.get("type").asText()).isEqualTo("error");
            assertThat(controller.mode()).isEqualTo(TradingMode.MOCK);
        }

        @Test
        @DisplayName("Should switch mode while stopped")
        void modeWhileStopped() {
            ObjectNode response = dispatcher.handle("{\"type\": \"set_trading_mode\", \"mode\": \"live\"}");

            assertThat(response.get("type").asText()).isEqualTo("trading_mode_set");
            assertThat(data(response).get("mode").asText()).isEqualTo("LIVE");
        }
    }

    @Nested
    @DisplayName("Trading")
    class Trading {

        @Test
        @DisplayName("Should execute, list and close a manual trade")
        void roundTrip() {
            ObjectNode executed = dispatcher.handle("{\"type\": \"execute_trade\", \"trade_data\": "
                + "{\"symbol\": \"BTCUSDT\", \"side\": \"BUY\", \"amount_usdt\": 100, \"price\": 50000}}");

            assertThat(executed.get("type").asText()).isEqualTo("trade_executed");
            assertThat(data(executed).get("trade").get("quantity").asDouble()).isEqualTo(0.002);
            assertThat(data(dispatcher.handle("{\"type\": \"get_positions\"}")).get("positions")).hasSize(1);

            when(marketData.currentPrice("BTCUSDT")).thenReturn(51000.0);
            ObjectNode closed = dispatcher.handle("{\"type\": \"close_position\", \"symbol\": \"BTCUSDT\"}");

            assertThat(closed.get("type").asText()).isEqualTo("position_close_response");
            assertThat(data(closed).get("trade").get("realized_pnl").asDouble()).isCloseTo(2.0, within(1e-9));
            assertThat(data(dispatcher.handle("{\"type\": \"get_trade_history\"}")).get("trades")).hasSize(2);
        }

        @Test
        @DisplayName("Should report an error when closing a symbol with nothing open")
        void closeMissing() {
            ObjectNode response = dispatcher.handle("{\"type\": \"close_position\", \"symbol\": \"ETHUSDT\"}");

            assertThat(data(response).get("message").asText()).isEqualTo("No open position for ETHUSDT");
        }

        @Test
        @DisplayName("Should refuse a trade larger than the paper balance")
        void insufficientBalance() {
            ObjectNode response = dispatcher.handle("{\"type\": \"execute_trade\", \"symbol\": \"BTCUSDT\", "
                + "\"side\": \"BUY\", \"amount_usdt\": 500000, \"price\": 50000}");

            assertThat(response.get("type").asText()).isEqualTo("error");
            assertThat(store.activePositionCount()).isZero();
        }

        @Test
        @DisplayName("Rejecting an unknown pending trade should report no success")
        void rejectUnknown() {
            JsonNode data = data(dispatcher.handle("{\"type\": \"reject_trade\", \"trade_id\": \"nope\"}"));

            assertThat(data.get("success").asBoolean()).isFalse();
            assertThat(data(dispatcher.handle("{\"type\": \"get_pending_trades\"}")).get("pending_trades")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Balances")
    class Balances {

        @Test
        @DisplayName("Should report the paper balance in MOCK mode")
        void tradingBalance() {
            JsonNode data = data(dispatcher.handle("{\"type\": \"get_trading_balance\", \"wallet_type\": \"SPOT\"}"));

            assertThat(data.get("asset").asText()).isEqualTo("USDT");
            assertThat(data.get("free").asDouble()).isEqualTo(100_000.0);
            assertThat(data.get("wallet_type").asText()).isEqualTo("SPOT");
            assertThat(data.get("mode").asText()).isEqualTo("MOCK");
            verifyNoInteractions(exchange);
        }

        @Test
        @DisplayName("Should categorize the paper balance under every wallet")
        void categorized() {
            JsonNode wallets = data(dispatcher.handle("{\"type\": \"get_categorized_balances\"}")).get("wallets");

            assertThat(wallets.size()).isEqualTo(WalletType.values().length);
            assertThat(wallets.get("FUTURES").get("total_usdt").asDouble()).isEqualTo(100_000.0);
        }

        @Test
        @DisplayName("Should include open PnL in the portfolio summary")
        void portfolio() {
            dispatcher.handle("{\"type\": \"execute_trade\", \"symbol\": \"BTCUSDT\", "
                + "\"side\": \"BUY\", \"quantity\": 1, \"price\": 50000}");
            store.recordPrice("BTCUSDT", 50500.0);

            JsonNode data = data(dispatcher.handle("{\"type\": \"get_portfolio_summary\"}"));

            assertThat(data.get("initial_balance").asDouble()).isEqualTo(100_000.0);
            assertThat(data.get("unrealized_pnl").asDouble()).isEqualTo(500.0);
            assertThat(data.get("total_value_usdt").asDouble()).isEqualTo(100_500.0);
            assertThat(data.get("pnl_percentage").asDouble()).isCloseTo(0.5, within(1e-9));
            assertThat(data.get("open_positions").asInt()).isEqualTo(1);
        }
    }
}
