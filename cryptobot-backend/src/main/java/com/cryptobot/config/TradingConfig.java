package com.cryptobot.config;

import com.cryptobot.core.bot.BotController;
import com.cryptobot.core.config.BotConfig;
import com.cryptobot.core.model.TradingMode;
import com.cryptobot.core.model.WalletType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Service configuration loaded from {@code config.properties}: the working directory first, then the classpath.
 * Bad values log a warning and fall back to the default.
 * <p>
 * {@code BOT_*} keys seed the default {@link BotConfig}; a {@code start_bot} request may override any of them.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);

    private static final AtomicReference<TradingConfig> instanceRef = new AtomicReference<>();
    private final Properties properties;

    private final int serverPort;
    private final double paperBalance;
    private final TradingMode tradingMode;
    private final WalletType defaultWalletType;
    private final long sourceTimeoutSecs;
    private final long monitorPollIntervalSecs;
    private final long monitorFastPollIntervalSecs;
    private final long shutdownTimeoutSecs;
    private final String tradeDbPath;
    private final String marketDataBaseUrl;
    private final String klineInterval;
    private final BotConfig defaultBotConfig;

    private TradingConfig(Properties props) {
        this.properties = props;

        this.serverPort = (int) parseLong("SERVER_PORT", 8765);
        this.paperBalance = parseDouble("PAPER_BALANCE_USDT", 100_000.0);
        this.tradingMode = parseEnum("TRADING_MODE", TradingMode.class, TradingMode.MOCK);
        this.defaultWalletType = parseEnum("DEFAULT_WALLET_TYPE", WalletType.class, WalletType.FUTURES);
        this.sourceTimeoutSecs = parseLong("SOURCE_TIMEOUT_SECS", 30);
        this.monitorPollIntervalSecs = parseLong("MONITOR_POLL_INTERVAL_SECS", 5);
        this.monitorFastPollIntervalSecs = parseLong("MONITOR_FAST_POLL_INTERVAL_SECS", 1);
        this.shutdownTimeoutSecs = parseLong("SHUTDOWN_TIMEOUT_SECS", 30);
        this.tradeDbPath = properties.getProperty("TRADE_DB_PATH", "trades.db").trim();
        this.marketDataBaseUrl = properties.getProperty("MARKET_DATA_BASE_URL", "https://api.binance.com").trim();
        this.klineInterval = properties.getProperty("MARKET_DATA_KLINE_INTERVAL", "15m").trim();

        BotConfig d = BotConfig.defaults();
        this.defaultBotConfig = new BotConfig(
            (int) parseLong("BOT_MAX_TRADES_PER_DAY", d.maxTradesPerDay()),
            (int) parseLong("BOT_MAX_CONCURRENT_TRADES", d.maxConcurrentTrades()),
            parseDouble("BOT_TRADE_AMOUNT_USDT", d.tradeAmountUsdt()),
            parseDouble("BOT_RISK_PER_TRADE_PERCENT", d.riskPerTradePercent()),
            parseDouble("BOT_PROFIT_TARGET_MIN", d.profitTargetMin()),
            parseDouble("BOT_PROFIT_TARGET_MAX", d.profitTargetMax()),
            parseDouble("BOT_STOP_LOSS_PERCENT", d.stopLossPercent()),
            parseBoolean("BOT_TRAILING_ENABLED", d.trailingEnabled()),
            parseDouble("BOT_TRAILING_TRIGGER_USD", d.trailingTriggerUsd()),
            parseDouble("BOT_TRAILING_DISTANCE_USD", d.trailingDistanceUsd()),
            parseDouble("BOT_AI_CONFIDENCE_THRESHOLD", d.aiConfidenceThreshold()),
            parseList("BOT_ALLOWED_PAIRS", d.allowedPairs()),
            parseLong("BOT_TRADE_INTERVAL_SECS", d.tradeIntervalSecs()),
            parseLong("BOT_ANALYSIS_INTERVAL_MINUTES", d.analysisIntervalMinutes()),
            parseLong("BOT_COOLDOWN_SECS", d.cooldownSecs()),
            parseLong("BOT_REANALYSIS_COOLDOWN_SECONDS", d.reanalysisCooldownSeconds()),
            parseBoolean("BOT_MANUAL_APPROVAL_MODE", d.manualApprovalMode()),
            parseBoolean("BOT_RECONFIRM_BEFORE_ENTRY", d.reconfirmBeforeEntry()),
            parseDouble("BOT_SLIPPAGE_TOLERANCE_PERCENT", d.slippageTolerancePercent()),
            parseList("BOT_SIGNAL_SOURCES", d.signalSources()),
            d.sourceWeights(),
            parseBoolean("BOT_MONITOR_OPEN_TRADES", d.monitorOpenTrades()),
            parseDouble("BOT_LOSS_CHECK_INTERVAL_PERCENT", d.lossCheckIntervalPercent()),
            parseBoolean("BOT_ROLLBACK_ENABLED", d.rollbackEnabled()),
            parseBoolean("BOT_REVERSAL_EXIT_ENABLED", d.reversalExitEnabled()));

        logger.info("📊 Trading Configuration Loaded:");
        logger.info("   Mode: {} (paper balance {} USDT, trading wallet {})",
            tradingMode, String.format("%.2f", paperBalance), defaultWalletType);
        logger.info("   Pairs: {}", defaultBotConfig.allowedPairs());
        logger.info("   Sources: {} (timeout {}s)", defaultBotConfig.signalSources(), sourceTimeoutSecs);
        logger.info("   Port: {}", serverPort);
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private <E extends Enum<E>> E parseEnum(String key, Class<E> type, E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private List<String> parseList(String key, List<String> defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public static TradingConfig getInstance() {
        return instanceRef.updateAndGet(existing ->
            existing != null ? existing : load()
        );
    }

    public static TradingConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of("config.properties");
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load config.properties from filesystem: {}", e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new TradingConfig(new Properties());
    }

    /**
     * Isolated instance for tests; does not touch the singleton.
     */
    public static TradingConfig forTest(Properties props) {
        return new TradingConfig(props);
    }

    public int getServerPort() {
        return serverPort;
    }

    public double getPaperBalance() {
        return paperBalance;
    }

    public TradingMode getTradingMode() {
        return tradingMode;
    }

    public WalletType getDefaultWalletType() {
        return defaultWalletType;
    }

    public Duration getSourceTimeout() {
        return Duration.ofSeconds(sourceTimeoutSecs);
    }

    public BotController.Settings getControllerSettings() {
        return new BotController.Settings(
            Duration.ofSeconds(monitorPollIntervalSecs),
            Duration.ofSeconds(monitorFastPollIntervalSecs),
            Duration.ofSeconds(shutdownTimeoutSecs));
    }

    public String getTradeDbPath() {
        return tradeDbPath;
    }

    public String getMarketDataBaseUrl() {
        return marketDataBaseUrl;
    }

    public String getKlineInterval() {
        return klineInterval;
    }

    public BotConfig getDefaultBotConfig() {
        return defaultBotConfig;
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }
}
