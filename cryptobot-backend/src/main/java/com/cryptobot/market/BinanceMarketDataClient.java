package com.cryptobot.market;

import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.market.MarketDataProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Public market data from a Binance-compatible REST API. No credentials are needed.
 * Calls are rate limited and retried on I/O failure.
 */
public final class BinanceMarketDataClient implements MarketDataProvider {
    private static final Logger logger = LoggerFactory.getLogger(BinanceMarketDataClient.class);
    private static final int KLINE_CLOSE_INDEX = 4;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl baseUrl;
    private final String klineInterval;
    private final Retry retry;
    private final RateLimiter rateLimiter;

    public BinanceMarketDataClient(String baseUrl, String klineInterval) {
        this(new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build(),
            new ObjectMapper(), baseUrl, klineInterval);
    }

    public BinanceMarketDataClient(OkHttpClient httpClient, ObjectMapper objectMapper,
                                   String baseUrl, String klineInterval) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = HttpUrl.get(baseUrl);
        this.klineInterval = klineInterval;

        this.retry = Retry.of("market-data", RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(500))
            .retryExceptions(IOException.class, UncheckedIOException.class)
            .build());
        this.rateLimiter = RateLimiter.of("market-data", RateLimiterConfig.custom()
            .limitForPeriod(1200)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofSeconds(5))
            .build());

        retry.getEventPublisher().onRetry(event ->
            logger.warn("⚠️ Market data retry #{}: {}", event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));

        logger.info("📈 Market data client initialized: {} (klines {})", baseUrl, klineInterval);
    }

    @Override
    public double currentPrice(String symbol) {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("api/v3/ticker/price")
            .addQueryParameter("symbol", symbol)
            .build();
        return call("price " + symbol, () -> parsePrice(readTree(get(url))));
    }

    @Override
    public List<Double> recentCloses(String symbol, int limit) {
        HttpUrl url = baseUrl.newBuilder()
            .addPathSegments("api/v3/klines")
            .addQueryParameter("symbol", symbol)
            .addQueryParameter("interval", klineInterval)
            .addQueryParameter("limit", String.valueOf(limit))
            .build();
        return call("klines " + symbol, () -> parseCloses(readTree(get(url))));
    }

    private <T> T call(String operation, Supplier<T> supplier) {
        Supplier<T> decorated = RateLimiter.decorateSupplier(rateLimiter, Retry.decorateSupplier(retry, supplier));
        try {
            return decorated.get();
        } catch (RequestNotPermitted e) {
            throw new ProviderConnectionException("Market data rate limit exceeded for " + operation, e);
        } catch (UncheckedIOException e) {
            logger.error("❌ Market data {} failed: {}", operation, e.getCause().getMessage());
            throw new ProviderConnectionException("Market data " + operation + " failed: "
                + e.getCause().getMessage(), e);
        }
    }

    private String get(HttpUrl url) {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful()) {
                // 4xx is not retried
                String detail = body != null ? body.string() : response.message();
                if (response.code() >= 400 && response.code() < 500) {
                    throw new ProviderConnectionException("Market data request rejected ("
                        + response.code() + "): " + detail);
                }
                throw new IOException("Market data HTTP " + response.code() + ": " + detail);
            }
            return body != null ? body.string() : "";
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ProviderConnectionException("Malformed market data response", e);
        }
    }

    /**
     * Parse a {@code /ticker/price} body: {@code {"symbol":"BTCUSDT","price":"45000.10"}}.
     */
    static double parsePrice(JsonNode node) {
        JsonNode price = node.get("price");
        if (price == null || price.isNull()) {
            throw new ProviderConnectionException("Price missing from market data response");
        }
        double value = price.isTextual() ? Double.parseDouble(price.asText()) : price.asDouble();
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new ProviderConnectionException("Invalid price in market data response: " + price.asText());
        }
        return value;
    }

    /**
     * Parse a {@code /klines} body, an array of candle arrays whose fifth element is the close. Oldest first.
     */
    static List<Double> parseCloses(JsonNode node) {
        if (!node.isArray()) {
            throw new ProviderConnectionException("Kline response is not an array");
        }
        List<Double> closes = new ArrayList<>(node.size());
        for (JsonNode candle : node) {
            JsonNode close = candle.get(KLINE_CLOSE_INDEX);
            if (close == null) {
                throw new ProviderConnectionException("Kline entry without close price");
            }
            closes.add(close.isTextual() ? Double.parseDouble(close.asText()) : close.asDouble());
        }
        return closes;
    }
}
