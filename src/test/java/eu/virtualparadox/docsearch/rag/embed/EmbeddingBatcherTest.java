package eu.virtualparadox.docsearch.rag.embed;

import eu.virtualparadox.docsearch.exception.EmbeddingFatalException;
import eu.virtualparadox.docsearch.exception.EmbeddingTransientException;
import eu.virtualparadox.docsearch.rag.resilience.BackoffPolicy;
import eu.virtualparadox.docsearch.rag.resilience.GuardedCall;
import eu.virtualparadox.docsearch.util.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingBatcherTest {

    private ThreadPoolTaskExecutor callExecutor;
    private FakeProvider provider;
    private EmbeddingBatcher batcher;

    /**
     * Encodes the text length into the vector. Texts starting with "fatal" are rejected,
     * texts starting with "flaky" fail transiently on their first call, texts starting with
     * "down" fail transiently on every call.
     */
    private static final class FakeProvider implements EmbeddingProvider {

        final List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        final AtomicInteger inFlight = new AtomicInteger();
        final AtomicInteger maxInFlight = new AtomicInteger();
        final Set<String> failedOnce = ConcurrentHashMap.newKeySet();
        final AtomicInteger downCalls = new AtomicInteger();
        volatile long delayMillis;
        volatile Runnable onCall = () -> { };

        @Override
        public List<float[]> embedBatch(final List<String> texts) {
            batchSizes.add(texts.size());
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                onCall.run();
                if (delayMillis > 0) {
                    Thread.sleep(delayMillis);
                }
                final List<float[]> vectors = new ArrayList<>();
                for (final String text : texts) {
                    if (text.startsWith("fatal")) {
                        throw new EmbeddingFatalException("rejected " + text);
                    }
                    if (text.startsWith("down")) {
                        downCalls.incrementAndGet();
                        throw new EmbeddingTransientException("service unavailable");
                    }
                    if (text.startsWith("flaky") && failedOnce.add(text)) {
                        throw new EmbeddingTransientException("busy");
                    }
                    vectors.add(new float[]{text.length(), 1f});
                }
                return vectors;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingTransientException("interrupted", e);
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public String modelId() {
            return "fake";
        }
    }

    @BeforeEach
    void setUp() {
        callExecutor = new ThreadPoolTaskExecutor();
        callExecutor.setCorePoolSize(4);
        callExecutor.setMaxPoolSize(Integer.MAX_VALUE);
        callExecutor.setQueueCapacity(0);
        callExecutor.initialize();

        provider = new FakeProvider();
        final GuardedCall guardedCall = new GuardedCall("embedding",
                new BackoffPolicy(3, Duration.ofMillis(5), 2.0, Duration.ofMillis(20), 0.0),
                Duration.ofSeconds(5), callExecutor, EmbeddingBatcher::isTransient);
        batcher = new EmbeddingBatcher(provider, guardedCall, 4, 2);
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdown();
    }

    private static List<String> texts(final int n) {
        return IntStream.range(0, n).mapToObj(i -> "x".repeat(i + 1)).toList();
    }

    @Test
    void testOutcomesAreAlignedWithInput() {
        final List<EmbeddingOutcome> outcomes = batcher.embed(texts(10));

        assertThat(outcomes).hasSize(10);
        for (int i = 0; i < 10; i++) {
            assertThat(outcomes.get(i).isSuccess()).isTrue();
            assertThat(outcomes.get(i).vector()[0]).isEqualTo(i + 1f);
        }
        assertThat(provider.batchSizes).containsExactlyInAnyOrder(4, 4, 2);
    }

    @Test
    void testEmptyInputMakesNoCalls() {
        assertThat(batcher.embed(List.of())).isEmpty();
        assertThat(provider.batchSizes).isEmpty();
    }

    @Test
    void testConcurrencyIsBounded() {
        provider.delayMillis = 30;

        final List<EmbeddingOutcome> outcomes = batcher.embed(texts(20), 1, 3, CancellationSignal.create(), null);

        assertThat(outcomes).allMatch(EmbeddingOutcome::isSuccess);
        assertThat(provider.maxInFlight.get()).isBetween(1, 3);
        assertThat(provider.batchSizes).hasSize(20);
    }

    @Test
    void testTransientFailureIsRetried() {
        final List<EmbeddingOutcome> outcomes = batcher.embed(List.of("a", "flaky", "b"));

        assertThat(outcomes).allMatch(EmbeddingOutcome::isSuccess);
        assertThat(provider.batchSizes).containsExactly(3, 3);
    }

    @Test
    void testExhaustedRetriesFailOnlyTheirBatch() {
        final List<EmbeddingOutcome> outcomes = batcher.embed(
                List.of("down", "a", "b", "c"), 2, 2, CancellationSignal.create(), null);

        assertThat(provider.downCalls).hasValue(3);
        assertThat(outcomes.subList(0, 2)).allMatch(o -> o.failure() == EEmbeddingFailure.TRANSIENT_EXHAUSTED);
        assertThat(outcomes.subList(2, 4)).allMatch(EmbeddingOutcome::isSuccess);
    }

    @Test
    void testFastProviderNeverOverflowsTheDispatchQueue() {
        for (int run = 0; run < 5; run++) {
            final List<EmbeddingOutcome> outcomes = batcher.embed(texts(2000), 1, 1, CancellationSignal.create(), null);

            assertThat(outcomes).hasSize(2000).allMatch(EmbeddingOutcome::isSuccess);
        }
        assertThat(provider.batchSizes).hasSize(10_000);
    }

    @Test
    void testDispatchBlocksAtThreeTimesConcurrency() throws InterruptedException {
        final CountDownLatch gate = new CountDownLatch(1);
        provider.onCall = () -> awaitQuietly(gate);
        final CancellationSignal signal = CancellationSignal.create();
        final AtomicReference<List<EmbeddingOutcome>> result = new AtomicReference<>();

        final Thread dispatcher = new Thread(() -> result.set(batcher.embed(texts(20), 1, 2, signal, null)));
        dispatcher.start();
        Thread.sleep(300);
        signal.cancel();
        gate.countDown();
        dispatcher.join(10_000);

        // two running plus four queued
        assertThat(result.get().stream().filter(EmbeddingOutcome::isSuccess).count()).isEqualTo(6);
        assertThat(provider.maxInFlight.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void testInterruptedDispatchLetsDispatchedBatchesFinish() throws InterruptedException {
        final CountDownLatch started = new CountDownLatch(1);
        provider.onCall = started::countDown;
        provider.delayMillis = 300;
        final AtomicReference<List<EmbeddingOutcome>> result = new AtomicReference<>();
        final AtomicBoolean interruptRestored = new AtomicBoolean();

        final Thread dispatcher = new Thread(() -> {
            result.set(batcher.embed(texts(10), 1, 1, CancellationSignal.create(), null));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        });
        dispatcher.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        dispatcher.interrupt();
        dispatcher.join(10_000);

        final List<EmbeddingOutcome> outcomes = result.get();
        assertThat(outcomes).hasSize(10);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        assertThat(outcomes).allMatch(o -> o.isSuccess() || o.failure() == EEmbeddingFailure.CANCELLED);
        assertThat(outcomes.stream().filter(EmbeddingOutcome::isSuccess).count()).isLessThanOrEqualTo(3);
        assertThat(interruptRestored).isTrue();
    }

    private static void awaitQuietly(final CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void testFatalBatchDoesNotAffectOtherBatches() {
        final List<EmbeddingOutcome> outcomes = batcher.embed(
                List.of("a", "b", "fatal", "c", "d", "e"), 3, 2, CancellationSignal.create(), null);

        assertThat(outcomes.subList(0, 3)).allMatch(o -> o.failure() == EEmbeddingFailure.FATAL);
        assertThat(outcomes.subList(3, 6)).allMatch(EmbeddingOutcome::isSuccess);
    }

    @Test
    void testListenerReceivesEveryBatchOnce() {
        final List<Integer> offsets = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger items = new AtomicInteger();

        batcher.embed(texts(9), 4, 2, CancellationSignal.create(), (offset, outcomes) -> {
            offsets.add(offset);
            items.addAndGet(outcomes.size());
        });

        assertThat(offsets).containsExactlyInAnyOrder(0, 4, 8);
        assertThat(items).hasValue(9);
    }

    @Test
    void testFailingListenerDoesNotBreakTheRun() {
        final List<EmbeddingOutcome> outcomes = batcher.embed(texts(8), 4, 2, CancellationSignal.create(),
                (offset, batch) -> {
                    throw new IllegalStateException("listener bug");
                });

        assertThat(outcomes).allMatch(EmbeddingOutcome::isSuccess);
    }

    @Test
    void testCancelledBeforeStartEmbedsNothing() {
        final CancellationSignal signal = CancellationSignal.create();
        signal.cancel();

        final List<EmbeddingOutcome> outcomes = batcher.embed(texts(5), 2, 2, signal, null);

        assertThat(outcomes).hasSize(5).allMatch(o -> o.failure() == EEmbeddingFailure.CANCELLED);
        assertThat(provider.batchSizes).isEmpty();
    }

    @Test
    void testCancellationStopsDispatch() {
        final CancellationSignal signal = CancellationSignal.create();
        provider.onCall = signal::cancel;
        provider.delayMillis = 20;

        final List<EmbeddingOutcome> outcomes = batcher.embed(texts(20), 1, 1, signal, null);

        assertThat(outcomes).hasSize(20);
        assertThat(outcomes.get(0).isSuccess()).isTrue();
        // one running plus at most two queued batches
        assertThat(outcomes.stream().filter(EmbeddingOutcome::isSuccess).count()).isLessThanOrEqualTo(3);
        assertThat(outcomes.get(19).failure()).isEqualTo(EEmbeddingFailure.CANCELLED);
    }

    @Test
    void testEmbedOneReturnsVector() {
        assertThat(batcher.embedOne("hello")).containsExactly(5f, 1f);
    }

    @Test
    void testEmbedOneSurfacesFatalFailure() {
        assertThatThrownBy(() -> batcher.embedOne("fatal query"))
                .isInstanceOf(EmbeddingFatalException.class);
    }

    @Test
    void testRejectsInvalidGeometry() {
        assertThatThrownBy(() -> batcher.embed(texts(2), 0, 1, CancellationSignal.create(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> batcher.embed(texts(2), 1, 0, CancellationSignal.create(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
