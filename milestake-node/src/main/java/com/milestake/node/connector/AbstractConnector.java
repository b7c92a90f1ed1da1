package com.milestake.node.connector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for connectors with bounded timeouts and exponential backoff.
 *
 * Provides:
 * - A timeout on every attempt
 * - Retry with exponential backoff on transient failures
 * - Request and failure counters
 */
public abstract class AbstractConnector implements ActivityConnector {

    private static final Logger log = LoggerFactory.getLogger(AbstractConnector.class);

    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final long DEFAULT_BASE_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 60_000;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String id;
    private final int maxRetries;
    private final long baseBackoffMs;
    private final Duration timeout;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicLong lastRequestTime = new AtomicLong();

    protected AbstractConnector(String id) {
        this(id, DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF_MS, DEFAULT_TIMEOUT);
    }

    protected AbstractConnector(String id, int maxRetries, long baseBackoffMs, Duration timeout) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Connector ID cannot be null or blank");
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("At least one attempt is required");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.id = id;
        this.maxRetries = maxRetries;
        this.baseBackoffMs = baseBackoffMs;
        this.timeout = timeout;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public CompletableFuture<MileageReading> fetchMileage(String identity, String correlationId,
                                                          Instant windowStart, Instant windowEnd) {
        if (identity == null || identity.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Identity is required"));
        }
        if (windowStart == null || windowEnd == null || windowEnd.isBefore(windowStart)) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid mileage window"));
        }
        return executeWithBackoff(() -> doFetchMileage(identity, correlationId, windowStart, windowEnd), 1);
    }

    /**
     * Runs one attempt under the timeout and retries transient failures.
     */
    private CompletableFuture<MileageReading> executeWithBackoff(
            Supplier<CompletableFuture<MileageReading>> operation, int attempt) {

        CompletableFuture<MileageReading> current;
        try {
            current = operation.get();
        } catch (RuntimeException e) {
            current = CompletableFuture.failedFuture(e);
        }

        return current
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((reading, error) -> {
                    if (error == null) {
                        consecutiveFailures.set(0);
                        requestCount.incrementAndGet();
                        lastRequestTime.set(System.currentTimeMillis());
                        return CompletableFuture.completedFuture(reading);
                    }

                    ActivityServiceException failure = translate(error);
                    if (shouldRetry(failure, attempt)) {
                        long backoffMs = calculateBackoffMs(attempt);
                        log.warn("{} attempt {} failed ({}), retrying in {} ms",
                                id, attempt, failure.getErrorCode(), backoffMs);
                        return delay(backoffMs).thenCompose(v -> executeWithBackoff(operation, attempt + 1));
                    }

                    consecutiveFailures.incrementAndGet();
                    return CompletableFuture.<MileageReading>failedFuture(failure);
                })
                .thenCompose(Function.identity());
    }

    protected boolean shouldRetry(ActivityServiceException failure, int attempt) {
        return attempt < maxRetries && failure.isTransient();
    }

    protected long calculateBackoffMs(int attempt) {
        long backoff = (long) (baseBackoffMs * Math.pow(2, attempt - 1));
        // Add jitter (±10%)
        double jitter = 0.9 + (Math.random() * 0.2);
        backoff = (long) (backoff * jitter);
        return Math.min(backoff, MAX_BACKOFF_MS);
    }

    protected CompletableFuture<Void> delay(long millis) {
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
    }

    private ActivityServiceException translate(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ActivityServiceException serviceException) {
            return serviceException;
        }
        if (cause instanceof TimeoutException) {
            return new ActivityServiceException("TIMEOUT",
                    id + " did not answer within " + timeout.toMillis() + " ms", true, cause);
        }
        return new ActivityServiceException("CONNECTOR_ERROR",
                id + " failed: " + cause.getMessage(), false, cause);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public long getLastRequestTime() {
        return lastRequestTime.get();
    }

    // ==================== Abstract Methods ====================

    /**
     * Performs one fetch attempt against the activity service.
     */
    protected abstract CompletableFuture<MileageReading> doFetchMileage(
            String identity, String correlationId, Instant windowStart, Instant windowEnd);
}
