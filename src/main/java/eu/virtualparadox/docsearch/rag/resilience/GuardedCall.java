package eu.virtualparadox.docsearch.rag.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Runs a blocking call on a dedicated executor under a timeout, retrying transient failures
 * with the configured {@link BackoffPolicy}.
 * <p>
 * A timeout counts as a transient failure. By default the running call is interrupted; callers
 * whose work must not see interrupts (Lucene index I/O) opt out and let the attempt finish in
 * the background.
 * Failures rejected by the classifier are rethrown immediately without retry; after the
 * last attempt the last failure is rethrown unchanged.
 */
@Slf4j
public final class GuardedCall {

    private final String name;
    private final Retry retry;
    private final TimeLimiter timeLimiter;
    private final AsyncTaskExecutor executor;

    /**
     * @param name        identifier used in logs
     * @param policy      retry budget and backoff
     * @param timeout     limit of a single attempt
     * @param executor    executor running the attempts
     * @param isTransient classifier of retryable failures (timeouts are always retryable)
     */
    public GuardedCall(final String name,
                       final BackoffPolicy policy,
                       final Duration timeout,
                       final AsyncTaskExecutor executor,
                       final Predicate<Throwable> isTransient) {
        this(name, policy, timeout, executor, isTransient, true);
    }

    /**
     * @param interruptOnTimeout whether a timed-out attempt is interrupted
     */
    public GuardedCall(final String name,
                       final BackoffPolicy policy,
                       final Duration timeout,
                       final AsyncTaskExecutor executor,
                       final Predicate<Throwable> isTransient,
                       final boolean interruptOnTimeout) {
        this.name = name;
        this.executor = executor;
        this.retry = Retry.of(name, policy.retryConfig(t -> t instanceof TimeoutException || isTransient.test(t)));
        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(interruptOnTimeout)
                .build());

        this.retry.getEventPublisher().onRetry(event -> log.debug("{}: attempt {} failed, retrying in {}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval(), event.getLastThrowable()));
    }

    /**
     * Executes {@code callable} under timeout and retry.
     *
     * @param callable the blocking call
     * @param <T>      result type
     * @return the call result
     * @throws Exception the last failure once retries are exhausted, or the first non-transient one
     */
    public <T> T call(final Callable<T> callable) throws Exception {
        return retry.executeCallable(() -> attempt(callable));
    }

    private <T> T attempt(final Callable<T> callable) throws Exception {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(callable));
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (final TimeoutException e) {
            log.debug("{}: call exceeded its time limit", name);
            throw e;
        }
    }

    public String getName() {
        return name;
    }
}
