package eu.virtualparadox.docsearch.rag.store;

import eu.virtualparadox.docsearch.exception.VectorStoreException;
import eu.virtualparadox.docsearch.rag.resilience.GuardedCall;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Decorates a {@link VectorStore} with a per-call timeout and retries of transient failures.
 * Every failure leaves as a {@link VectorStoreException}.
 */
public final class ResilientVectorStore implements VectorStore {

    private final VectorStore delegate;
    private final GuardedCall guardedCall;

    public ResilientVectorStore(final VectorStore delegate, final GuardedCall guardedCall) {
        this.delegate = delegate;
        this.guardedCall = guardedCall;
    }

    public static boolean isTransient(final Throwable t) {
        return t instanceof VectorStoreException e && e.isTransient();
    }

    @Override
    public void upsert(final String id, final float[] vector, final ChunkMetadata metadata) {
        guarded("upsert " + id, () -> {
            delegate.upsert(id, vector, metadata);
            return null;
        });
    }

    @Override
    public void commit() {
        guarded("commit", () -> {
            delegate.commit();
            return null;
        });
    }

    @Override
    public boolean reassign(final String id, final ChunkMetadata metadata) {
        return guarded("reassign " + id, () -> delegate.reassign(id, metadata));
    }

    @Override
    public List<VectorStoreCandidate> search(final float[] vector, final int topK, final Set<String> fileTypes) {
        return guarded("search", () -> delegate.search(vector, topK, fileTypes));
    }

    @Override
    public void delete(final Collection<String> ids) {
        guarded("delete", () -> {
            delegate.delete(ids);
            return null;
        });
    }

    @Override
    public long count() {
        return guarded("count", delegate::count);
    }

    private <T> T guarded(final String operation, final Callable<T> call) {
        try {
            return guardedCall.call(call);
        } catch (VectorStoreException | IllegalArgumentException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new VectorStoreException("Vector store " + operation + " timed out on every attempt", e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VectorStoreException("Interrupted during vector store " + operation, e, true);
        } catch (Exception e) {
            throw new VectorStoreException("Vector store " + operation + " failed", e, false);
        }
    }
}
