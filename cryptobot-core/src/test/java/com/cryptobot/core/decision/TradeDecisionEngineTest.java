package com.cryptobot.core.decision;

import com.cryptobot.core.MutableClock;
import com.cryptobot.core.balance.BalanceResolver;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.journal.InMemoryTradeJournal;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.AnalysisResult;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Position;
import com.cryptobot.core.model.SourceSignal;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradeAction;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletType;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.cryptobot.core.TestConfigs.config;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TradeDecisionEngine Tests")
class TradeDecisionEngineTest {

    @Mock
    private MarketDataProvider marketData;

    @Mock
    private ExchangeClient exchange;

    @Mock
    private BotEventListener listener;

    private MutableClock clock;
    private PositionStore store;
    private ApprovalQueue approvals;
    private ExecutionGateway gateway;
    private SimpleMeterRegistry registry;
    private TradeDecisionEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new PositionStore(clock);
        approvals = new ApprovalQueue();
        registry = new SimpleMeterRegistry();
        var balances = new BalanceResolver(exchange, marketData, store, 100_000.0, WalletType.FUTURES);
        gateway = new ExecutionGateway(store, exchange, new InMemoryTradeJournal(), listener, registry, clock);
        var ids = new AtomicInteger();
        engine = new TradeDecisionEngine(store, balances, gateway, marketData, approvals, listener, registry, clock,
            () -> "trade-" + ids.incrementAndGet());
    }

    private AnalysisResult result(String symbol, TradeAction action, double confidence) {
        return new AnalysisResult(symbol, List.of(new SourceSignal("trend", action, confidence)),
            confidence, action, clock.instant());
    }

    private void openPosition(String symbol) {
        gateway.open("seed-" + symbol, symbol, Direction.LONG, 1.0, 100.0, TradingMode.MOCK);
    }

    @Nested
    @DisplayName("Entry gates")
    class Gates {

        @Test
        @DisplayName("Should not trade a HOLD")
        void holdRejected() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.HOLD, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOf(TradeDecision.Rejected.class);
            assertThat(store.activePositionCount()).isZero();
        }

        @Test
        @DisplayName("Should reject a confidence below the threshold")
        void belowThreshold() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.55),
                config("{\"ai_confidence_threshold\": 0.6}"), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("below threshold"));
        }

        @Test
        @DisplayName("Should trade at exactly the threshold")
        void atThreshold() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.6),
                config("{\"ai_confidence_threshold\": 0.6}"), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOf(TradeDecision.Executed.class);
        }

        @Test
        @DisplayName("Should reject a fourth position when three are open and the cap is three")
        void maxConcurrent() {
            openPosition("ETHUSDT");
            openPosition("SOLUSDT");
            openPosition("BNBUSDT");

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).isEqualTo("max concurrent trades reached (3/3)"));
            assertThat(store.activePositionCount()).isEqualTo(3);
            assertThat(registry.counter("bot.decisions.rejected").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should stop at the daily trade limit")
        void dailyLimit() {
            BotConfig cfg = config("{\"max_trades_per_day\": 1}");
            openPosition("ETHUSDT");

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                cfg, TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("max trades per day"));
        }

        @Test
        @DisplayName("Should honor the post-close cooldown")
        void cooldown() {
            openPosition("BTCUSDT");
            Position position = store.findPosition("BTCUSDT").orElseThrow();
            gateway.close("close-1", position, 101.0, TradingMode.MOCK);

            TradeDecision blocked = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 45000.0);
            clock.advance(Duration.ofSeconds(301));
            TradeDecision allowed = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 45000.0);

            assertThat(blocked).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("cooldown"));
            assertThat(allowed).isInstanceOf(TradeDecision.Executed.class);
        }

        @Test
        @DisplayName("Should not open a second position in a symbol already held")
        void alreadyOpen() {
            openPosition("BTCUSDT");

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("already open"));
        }
    }

    @Nested
    @DisplayName("Sizing and execution")
    class Execution {

        @Test
        @DisplayName("Should size from trade_amount_usdt and open at the decision price")
        void fixedAmount() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.SELL, 0.8),
                BotConfig.defaults(), TradingMode.MOCK, 50_000.0);

            Trade trade = ((TradeDecision.Executed) decision).trade();
            assertThat(trade.direction()).isEqualTo(Direction.SHORT);
            assertThat(trade.executedPrice()).isEqualTo(50_000.0);
            assertThat(trade.quantity()).isCloseTo(0.001, within(1e-12));
            assertThat(trade.tradeId()).isEqualTo("trade-1");
        }

        @Test
        @DisplayName("Should size from risk_per_trade_percent of the free balance")
        void riskPercent() {
            double notional = engine.sizeNotional(config("{\"risk_per_trade_percent\": 1.0}"), TradingMode.MOCK);
            assertThat(notional).isEqualTo(1000.0);
        }

        @Test
        @DisplayName("Should reject an amount below the exchange minimum")
        void belowMinimum() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                config("{\"trade_amount_usdt\": 5.0}"), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("minimum"));
        }

        @Test
        @DisplayName("Should reject an amount above the free balance")
        void insufficientBalance() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                config("{\"trade_amount_usdt\": 200000.0}"), TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Rejected.class,
                r -> assertThat(r.reason()).contains("Insufficient balance"));
        }

        @Test
        @DisplayName("Should abort when the price moved beyond the slippage tolerance")
        void reconfirmAbort() {
            when(marketData.currentPrice("BTCUSDT")).thenReturn(45_100.0);

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                config("{\"reconfirm_before_entry\": true, \"slippage_tolerance_percent\": 0.1}"),
                TradingMode.MOCK, 45_000.0);

            assertThat(decision).isInstanceOf(TradeDecision.Aborted.class);
            assertThat(store.activePositionCount()).isZero();
            assertThat(registry.counter("bot.decisions.aborted").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should enter at the reconfirmed price when within tolerance")
        void reconfirmWithinTolerance() {
            when(marketData.currentPrice("BTCUSDT")).thenReturn(45_020.0);

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                config("{\"reconfirm_before_entry\": true, \"slippage_tolerance_percent\": 0.1}"),
                TradingMode.MOCK, 45_000.0);

            assertThat(((TradeDecision.Executed) decision).trade().executedPrice()).isEqualTo(45_020.0);
        }
    }

    @Nested
    @DisplayName("Manual approval")
    class Approval {

        private final BotConfig manual = config("{\"manual_approval_mode\": true}");

        @Test
        @DisplayName("Should park the trade and notify instead of executing")
        void parks() {
            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                manual, TradingMode.MOCK, 45000.0);

            assertThat(decision).isInstanceOf(TradeDecision.AwaitingApproval.class);
            assertThat(approvals.list()).hasSize(1);
            assertThat(store.activePositionCount()).isZero();
            verify(listener).onPendingTrade(any());
        }

        @Test
        @DisplayName("Approving should execute the parked trade")
        void approve() {
            var parked = (TradeDecision.AwaitingApproval) engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                manual, TradingMode.MOCK, 45000.0);

            TradeDecision decision = engine.approve(parked.pending().tradeId(), manual, TradingMode.MOCK);

            assertThat(decision).isInstanceOf(TradeDecision.Executed.class);
            assertThat(approvals.size()).isZero();
            assertThat(store.findPosition("BTCUSDT")).isPresent();
        }

        @Test
        @DisplayName("Rejecting should drop the parked trade")
        void reject() {
            var parked = (TradeDecision.AwaitingApproval) engine.process(result("BTCUSDT", TradeAction.BUY, 0.9),
                manual, TradingMode.MOCK, 45000.0);

            assertThat(engine.rejectPending(parked.pending().tradeId())).isTrue();
            assertThat(engine.rejectPending(parked.pending().tradeId())).isFalse();
            assertThat(approvals.list()).isEmpty();
        }

        @Test
        @DisplayName("Approving an unknown id should fail")
        void approveUnknown() {
            assertThatThrownBy(() -> engine.approve("nope", manual, TradingMode.MOCK))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Signal reversal")
    class Reversal {

        @Test
        @DisplayName("Should close a long when the signal flips to SELL and reversal exit is enabled")
        void closesOnReversal() {
            openPosition("BTCUSDT");

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.SELL, 0.9),
                config("{\"reversal_exit_enabled\": true}"), TradingMode.MOCK, 110.0);

            assertThat(decision).isInstanceOfSatisfying(TradeDecision.Exited.class,
                e -> assertThat(e.trade().realizedPnl()).isCloseTo(10.0, within(1e-9)));
            assertThat(store.findPosition("BTCUSDT")).isEmpty();
        }

        @Test
        @DisplayName("Should keep the position when reversal exit is disabled")
        void keepsWhenDisabled() {
            openPosition("BTCUSDT");

            TradeDecision decision = engine.process(result("BTCUSDT", TradeAction.SELL, 0.9),
                BotConfig.defaults(), TradingMode.MOCK, 110.0);

            assertThat(decision).isInstanceOf(TradeDecision.Rejected.class);
            assertThat(store.findPosition("BTCUSDT")).isPresent();
        }
    }

    @Nested
    @DisplayName("Concurrent entries")
    class Concurrency {

        /**
         * Enter BTCUSDT and ETHUSDT from two threads at once. Reconfirmation waits briefly for the other
         * entry so both are in flight together whenever the caps let them through.
         */
        private List<TradeDecision> raceEntries(BotConfig cfg) throws Exception {
            var barrier = new CyclicBarrier(2);
            when(marketData.currentPrice(anyString())).thenAnswer(invocation -> {
                try {
                    barrier.await(500, TimeUnit.MILLISECONDS);
                } catch (TimeoutException | BrokenBarrierException e) {
                    // the other entry was refused before reconfirming
                }
                return "BTCUSDT".equals(invocation.getArgument(0)) ? 45_000.0 : 3_000.0;
            });

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                var start = new CountDownLatch(1);
                Future<TradeDecision> btc = pool.submit(() -> {
                    start.await();
                    return engine.process(result("BTCUSDT", TradeAction.BUY, 0.9), cfg, TradingMode.MOCK, 45_000.0);
                });
                Future<TradeDecision> eth = pool.submit(() -> {
                    start.await();
                    return engine.process(result("ETHUSDT", TradeAction.BUY, 0.9), cfg, TradingMode.MOCK, 3_000.0);
                });
                start.countDown();
                return List.of(btc.get(5, TimeUnit.SECONDS), eth.get(5, TimeUnit.SECONDS));
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should open only one position when two symbols race for the last slot")
        void concurrentCapHolds() throws Exception {
            BotConfig cfg = config("{\"max_concurrent_trades\": 1, \"reconfirm_before_entry\": true}");

            List<TradeDecision> decisions = raceEntries(cfg);

            assertThat(decisions).filteredOn(d -> d instanceof TradeDecision.Executed).hasSize(1);
            assertThat(decisions).filteredOn(d -> d instanceof TradeDecision.Rejected)
                .singleElement()
                .satisfies(d -> assertThat(((TradeDecision.Rejected) d).reason())
                    .isEqualTo("max concurrent trades reached (1/1)"));
            assertThat(store.activePositionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not exceed the daily limit when two symbols race for the last trade")
        void dailyLimitHolds() throws Exception {
            BotConfig cfg = config("{\"max_trades_per_day\": 1, \"reconfirm_before_entry\": true}");

            List<TradeDecision> decisions = raceEntries(cfg);

            assertThat(decisions).filteredOn(d -> d instanceof TradeDecision.Executed).hasSize(1);
            assertThat(decisions).filteredOn(d -> d instanceof TradeDecision.Rejected)
                .singleElement()
                .satisfies(d -> assertThat(((TradeDecision.Rejected) d).reason())
                    .isEqualTo("max trades per day reached (1/1)"));
            assertThat(store.tradesToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should give the slot back when an entry is aborted")
        void abortReleasesSlot() {
            BotConfig cfg = config("{\"max_concurrent_trades\": 1, \"reconfirm_before_entry\": true}");
            when(marketData.currentPrice("BTCUSDT")).thenReturn(46_000.0);
            when(marketData.currentPrice("ETHUSDT")).thenReturn(3_000.0);

            TradeDecision aborted = engine.process(result("BTCUSDT", TradeAction.BUY, 0.9), cfg, TradingMode.MOCK, 45_000.0);
            TradeDecision next = engine.process(result("ETHUSDT", TradeAction.BUY, 0.9), cfg, TradingMode.MOCK, 3_000.0);

            assertThat(aborted).isInstanceOf(TradeDecision.Aborted.class);
            assertThat(next).isInstanceOf(TradeDecision.Executed.class);
        }
    }
}
