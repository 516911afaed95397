package com.cryptobot.core.monitor;

import com.cryptobot.core.MutableClock;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.event.BotEventListener;
import com.cryptobot.core.exchange.ExchangeClient;
import com.cryptobot.core.execution.ExecutionGateway;
import com.cryptobot.core.journal.InMemoryTradeJournal;
import com.cryptobot.core.market.MarketDataProvider;
import com.cryptobot.core.model.Direction;
import com.cryptobot.core.model.Trade;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.store.PositionStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static com.cryptobot.core.TestConfigs.config;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PositionMonitor Tests")
class PositionMonitorTest {

    @Mock
    private MarketDataProvider marketData;

    @Mock
    private ExchangeClient exchange;

    @Mock
    private BotEventListener listener;

    @Mock
    private ReanalysisRequester reanalysis;

    private PositionStore store;
    private ExecutionGateway gateway;
    private InMemoryTradeJournal journal;

    @BeforeEach
    void setUp() {
        var clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new PositionStore(clock);
        journal = new InMemoryTradeJournal();
        gateway = new ExecutionGateway(store, exchange, journal, listener, new SimpleMeterRegistry(), clock);
        gateway.open("open-1", "BTCUSDT", Direction.LONG, 1.0, 45000.0, TradingMode.MOCK);
    }

    private PositionMonitor monitor(BotConfig config) {
        return new PositionMonitor(config, TradingMode.MOCK, store, gateway, marketData, reanalysis,
            Duration.ofMillis(50), Duration.ofMillis(10));
    }

    @Test
    @DisplayName("Should persist the armed trailing state and then close on retracement")
    void trailingScenario() {
        PositionMonitor monitor = monitor(config("{\"profit_target_min\": 5.0}"));

        assertThat(monitor.onPriceUpdate("BTCUSDT", 45002.0)).isEmpty();
        assertThat(store.findPosition("BTCUSDT").orElseThrow().trailingArmed()).isTrue();

        Optional<Trade> closed = monitor.onPriceUpdate("BTCUSDT", 45001.4);

        assertThat(closed).isPresent();
        assertThat(closed.get().detail()).isEqualTo("TRAILING_STOP");
        assertThat(closed.get().realizedPnl()).isCloseTo(1.4, within(1e-6));
        assertThat(store.findPosition("BTCUSDT")).isEmpty();
        assertThat(store.stats().totalProfit()).isCloseTo(1.4, within(1e-6));
        verify(listener).onPositionClosed(closed.get());
    }

    @Test
    @DisplayName("Should close on stop loss during a polling pass")
    void stopLossOnPass() {
        when(marketData.currentPrice("BTCUSDT")).thenReturn(44000.0);

        monitor(BotConfig.defaults()).checkPositions();

        assertThat(store.findPosition("BTCUSDT")).isEmpty();
        assertThat(journal.recent(10)).extracting(Trade::detail).contains("STOP_LOSS");
    }

    @Test
    @DisplayName("Should switch to fast polling while a position is losing")
    void lossWatch() {
        when(marketData.currentPrice("BTCUSDT")).thenReturn(44500.0, 45000.0);
        PositionMonitor monitor = monitor(BotConfig.defaults());

        assertThat(monitor.checkPositions()).isTrue();
        assertThat(monitor.checkPositions()).isFalse();
        assertThat(store.findPosition("BTCUSDT")).isPresent();
    }

    @Test
    @DisplayName("Should request reanalysis of a losing symbol when reversal exit is on")
    void requestsReanalysis() {
        when(marketData.currentPrice("BTCUSDT")).thenReturn(44500.0);

        monitor(config("{\"reversal_exit_enabled\": true}")).checkPositions();

        verify(reanalysis).requestReanalysis("BTCUSDT");
    }

    @Test
    @DisplayName("Should keep going when a price is unavailable")
    void priceUnavailable() {
        when(marketData.currentPrice("BTCUSDT")).thenThrow(new ProviderConnectionException("down"));

        assertThat(monitor(BotConfig.defaults()).checkPositions()).isFalse();
        assertThat(store.findPosition("BTCUSDT")).isPresent();
    }

    @Test
    @DisplayName("Should leave positions alone when monitoring is disabled")
    void disabled() {
        PositionMonitor monitor = monitor(config("{\"monitor_open_trades\": false}"));

        assertThat(monitor.onPriceUpdate("BTCUSDT", 40000.0)).isEmpty();
        assertThat(store.findPosition("BTCUSDT")).isPresent();
        assertThat(store.lastPrice("BTCUSDT")).contains(40000.0);
        verifyNoInteractions(marketData);
    }

    @Test
    @DisplayName("Should exit the loop promptly when stopped")
    void stops() throws InterruptedException {
        PositionMonitor monitor = monitor(config("{\"monitor_open_trades\": false}"));
        Thread thread = new Thread(monitor, "position-monitor-test");
        thread.start();

        monitor.stop();
        thread.join(2000);

        assertThat(thread.isAlive()).isFalse();
        assertThat(monitor.isRunning()).isFalse();
    }
}
