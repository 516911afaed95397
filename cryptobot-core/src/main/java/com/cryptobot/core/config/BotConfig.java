package com.cryptobot.core.config;

import com.cryptobot.core.error.ConfigException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable per-run bot configuration. Validated once when the bot starts and never mutated afterwards.
 * <p>
 * Monetary thresholds ({@code profit_target_*}, {@code trailing_*_usd}) are in USDT.
 * {@code profit_target_max = 0} means "no upper bound"; {@code risk_per_trade_percent = 0}
 * means "size from {@code trade_amount_usdt}".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BotConfig(
    @JsonProperty("max_trades_per_day") @Min(value = 1, message = "must allow at least one trade per day")
    int maxTradesPerDay,

    @JsonProperty("max_concurrent_trades") @Min(value = 1, message = "must allow at least one open trade")
    int maxConcurrentTrades,

    @JsonProperty("trade_amount_usdt") @Positive
    double tradeAmountUsdt,

    @JsonProperty("risk_per_trade_percent") @DecimalMin("0.0") @DecimalMax("100.0")
    double riskPerTradePercent,

    @JsonProperty("profit_target_min") @PositiveOrZero
    double profitTargetMin,

    @JsonProperty("profit_target_max") @PositiveOrZero
    double profitTargetMax,

    @JsonProperty("stop_loss_percent") @DecimalMin("0.0") @DecimalMax("100.0")
    double stopLossPercent,

    @JsonProperty("trailing_enabled")
    boolean trailingEnabled,

    @JsonProperty("trailing_trigger_usd") @PositiveOrZero
    double trailingTriggerUsd,

    @JsonProperty("trailing_distance_usd") @PositiveOrZero
    double trailingDistanceUsd,

    @JsonProperty("ai_confidence_threshold") @DecimalMin("0.0") @DecimalMax("1.0")
    double aiConfidenceThreshold,

    @JsonProperty("allowed_pairs") @NotEmpty(message = "at least one trading pair is required")
    List<@NotBlank String> allowedPairs,

    @JsonProperty("trade_interval_secs") @PositiveOrZero
    long tradeIntervalSecs,

    @JsonProperty("analysis_interval_minutes") @PositiveOrZero
    long analysisIntervalMinutes,

    @JsonProperty("cooldown_secs") @PositiveOrZero
    long cooldownSecs,

    @JsonProperty("reanalysis_cooldown_seconds") @PositiveOrZero
    long reanalysisCooldownSeconds,

    @JsonProperty("manual_approval_mode")
    boolean manualApprovalMode,

    @JsonProperty("reconfirm_before_entry")
    boolean reconfirmBeforeEntry,

    @JsonProperty("slippage_tolerance_percent") @PositiveOrZero
    double slippageTolerancePercent,

    @JsonProperty("signal_sources") @NotEmpty(message = "at least one signal source is required")
    List<@NotBlank String> signalSources,

    @JsonProperty("source_weights")
    Map<String, Double> sourceWeights,

    @JsonProperty("monitor_open_trades")
    boolean monitorOpenTrades,

    @JsonProperty("loss_check_interval_percent") @PositiveOrZero
    double lossCheckIntervalPercent,

    @JsonProperty("rollback_enabled")
    boolean rollbackEnabled,

    @JsonProperty("reversal_exit_enabled")
    boolean reversalExitEnabled
) {
    public static final List<String> DEFAULT_PAIRS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT");
    public static final List<String> DEFAULT_SOURCES = List.of("trend", "momentum", "macd");

    public BotConfig {
        allowedPairs = allowedPairs == null ? null : distinct(allowedPairs, true);
        signalSources = signalSources == null ? null : distinct(signalSources, false);
        sourceWeights = sourceWeights == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(sourceWeights));
    }

    public static BotConfig defaults() {
        return new BotConfig(
            10, 3, 50.0, 0.0,
            1.0, 0.0, 2.0,
            true, 1.0, 0.5,
            0.5, DEFAULT_PAIRS,
            60, 0, 300, 30,
            false, false, 0.1,
            DEFAULT_SOURCES, Map.of(),
            true, 1.0, true, false);
    }

    /**
     * Delay between analysis cycles. {@code trade_interval_secs} wins when set.
     */
    public Duration analysisInterval() {
        return tradeIntervalSecs > 0
            ? Duration.ofSeconds(tradeIntervalSecs)
            : Duration.ofMinutes(analysisIntervalMinutes);
    }

    public double weightFor(String sourceId) {
        return sourceWeights.getOrDefault(sourceId, 1.0);
    }

    public boolean hasProfitTarget() {
        return profitTargetMin > 0 || profitTargetMax > 0;
    }

    /**
     * Validate with Bean Validation plus the cross-field rules annotations cannot express.
     *
     * @throws ConfigException listing every violation
     */
    public BotConfig validate() {
        List<String> errors = new ArrayList<>();

        checkFinite(errors, "trade_amount_usdt", tradeAmountUsdt);
        checkFinite(errors, "risk_per_trade_percent", riskPerTradePercent);
        checkFinite(errors, "profit_target_min", profitTargetMin);
        checkFinite(errors, "profit_target_max", profitTargetMax);
        checkFinite(errors, "stop_loss_percent", stopLossPercent);
        checkFinite(errors, "trailing_trigger_usd", trailingTriggerUsd);
        checkFinite(errors, "trailing_distance_usd", trailingDistanceUsd);
        checkFinite(errors, "ai_confidence_threshold", aiConfidenceThreshold);
        checkFinite(errors, "slippage_tolerance_percent", slippageTolerancePercent);
        checkFinite(errors, "loss_check_interval_percent", lossCheckIntervalPercent);

        ValidatorHolder.VALIDATOR.validate(this).stream()
            .map(v -> toSnakeCase(v.getPropertyPath().toString()) + ": " + v.getMessage())
            .sorted()
            .forEach(errors::add);

        if (profitTargetMax > 0 && profitTargetMax < profitTargetMin) {
            errors.add("profit_target_max: must be >= profit_target_min when set");
        }
        if (analysisInterval().isZero()) {
            errors.add("trade_interval_secs: either trade_interval_secs or analysis_interval_minutes must be positive");
        }
        sourceWeights.forEach((source, weight) -> {
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                errors.add("source_weights." + source + ": must be a finite number >= 0");
            }
        });

        if (!errors.isEmpty()) {
            throw new ConfigException("Bot configuration invalid", errors);
        }
        return this;
    }

    private static void checkFinite(List<String> errors, String field, double value) {
        if (!Double.isFinite(value)) {
            errors.add(field + ": must be a finite number");
        }
    }

    private static List<String> distinct(List<String> values, boolean upperCase) {
        var normalized = new LinkedHashSet<String>();
        for (String value : values) {
            String trimmed = value == null ? "" : value.trim();
            normalized.add(upperCase ? trimmed.toUpperCase(Locale.ROOT) : trimmed);
        }
        return List.copyOf(normalized);
    }

    private static String toSnakeCase(String propertyPath) {
        return propertyPath.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }

    private static final class ValidatorHolder {
        private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();
    }
}
