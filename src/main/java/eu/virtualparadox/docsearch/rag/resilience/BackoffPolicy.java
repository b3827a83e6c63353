package eu.virtualparadox.docsearch.rag.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter, shared by embedding and vector-store calls.
 * <p>
 * The n-th retry waits {@code min(initialInterval * multiplier^(n-1), maxInterval)},
 * randomized by {@code ±randomization}. {@code maxAttempts} counts the first call.
 *
 * @param maxAttempts     total attempts including the first call (≥ 1)
 * @param initialInterval wait before the first retry
 * @param multiplier      growth factor between consecutive waits (≥ 1)
 * @param maxInterval     cap applied before randomization
 * @param randomization   jitter factor in {@code [0, 1)}
 */
public record BackoffPolicy(int maxAttempts,
                            Duration initialInterval,
                            double multiplier,
                            Duration maxInterval,
                            double randomization) {

    public BackoffPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("initialInterval must be positive");
        }
        if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must not be shorter than initialInterval");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (randomization < 0.0 || randomization >= 1.0) {
            throw new IllegalArgumentException("randomization must be within [0, 1)");
        }
    }

    /**
     * Three attempts, 200ms base, doubling, capped at 5s, 20% jitter.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5), 0.2);
    }

    /**
     * @return wait function indexed by attempt number (1 = wait after the first failure)
     */
    public IntervalFunction intervalFunction() {
        if (randomization == 0.0) {
            return IntervalFunction.ofExponentialBackoff(initialInterval.toMillis(), multiplier, maxInterval.toMillis());
        }
        return IntervalFunction.ofExponentialRandomBackoff(
                initialInterval.toMillis(), multiplier, randomization, maxInterval.toMillis());
    }

    /**
     * Builds a resilience4j retry configuration retrying only failures accepted by {@code isTransient}.
     *
     * @param isTransient classifier of retryable failures
     * @return retry configuration
     */
    public RetryConfig retryConfig(final Predicate<Throwable> isTransient) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction())
                .retryOnException(isTransient)
                .build();
    }
}
