package com.cryptobot.core.exchange;

import com.cryptobot.core.error.ExchangeException;
import com.cryptobot.core.error.ProviderConnectionException;
import com.cryptobot.core.model.Balance;
import com.cryptobot.core.model.WalletType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Decorates an {@link ExchangeClient} with a circuit breaker, a rate limiter and metrics.
 * <p>
 * Retries apply only to reads that are safe to repeat (order status by client id, balances).
 * Order submission goes through exactly once: a blind resubmit could fill twice.
 */
public final class ResilientExchangeClient implements ExchangeClient {
    private static final Logger logger = LoggerFactory.getLogger(ResilientExchangeClient.class);

    private final ExchangeClient delegate;
    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Retry readRetry;
    private final MeterRegistry meterRegistry;

    public ResilientExchangeClient(ExchangeClient delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofMillis(500))
            .retryExceptions(RuntimeException.class)
            .build());
    }

    public ResilientExchangeClient(ExchangeClient delegate, MeterRegistry meterRegistry, RetryConfig readRetryConfig) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;

        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
        this.circuitBreaker = CircuitBreaker.of("exchange", cbConfig);

        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(600)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofSeconds(5))
            .build();
        this.rateLimiter = RateLimiter.of("exchange", rlConfig);
        this.readRetry = Retry.of("exchange-read", readRetryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Exchange circuit breaker state changed: {}", event.getStateTransition()));
        readRetry.getEventPublisher()
            .onRetry(event -> logger.info("🔁 Retrying {} (attempt {}): {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    @Override
    public OrderFill placeMarketOrder(OrderRequest request) {
        try {
            return execute("placeMarketOrder", false, () -> delegate.placeMarketOrder(request));
        } catch (CallNotPermittedException | RequestNotPermitted e) {
            throw new ExchangeException("Order for " + request.symbol() + " not sent: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<OrderFill> findOrder(String symbol, String clientOrderId) {
        try {
            return execute("findOrder", true, () -> delegate.findOrder(symbol, clientOrderId));
        } catch (CallNotPermittedException | RequestNotPermitted e) {
            throw new ExchangeException("Order status for " + clientOrderId + " unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Balance> getBalances(WalletType walletType) {
        try {
            return execute("getBalances", true, () -> delegate.getBalances(walletType));
        } catch (CallNotPermittedException | RequestNotPermitted e) {
            throw new ProviderConnectionException("Balances for " + walletType + " unavailable: " + e.getMessage(), e);
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Rate limit -> (retry) -> circuit breaker -> metrics.
     */
    private <T> T execute(String operation, boolean idempotent, Supplier<T> supplier) {
        Timer timer = Timer.builder("exchange.api.call")
            .tag("operation", operation)
            .register(meterRegistry);

        return timer.record(() -> {
            Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, supplier);
            if (idempotent) {
                guarded = Retry.decorateSupplier(readRetry, guarded);
            }
            guarded = RateLimiter.decorateSupplier(rateLimiter, guarded);
            try {
                T result = guarded.get();
                meterRegistry.counter("exchange.api.success", "operation", operation).increment();
                return result;
            } catch (RuntimeException e) {
                meterRegistry.counter("exchange.api.failure",
                    "operation", operation,
                    "error", e.getClass().getSimpleName()).increment();
                logger.error("Exchange call failed: {} - {}", operation, e.getMessage());
                throw e;
            }
        });
    }
}
