package eu.virtualparadox.docsearch.rag.store;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Abstraction over the vector store used for approximate nearest neighbor (ANN) search.
 * <p>
 * Entries are keyed by an id chosen by the caller; upserting an existing id replaces it.
 * Writes become durable and visible to {@link #search} after {@link #commit()}.
 * <p>
 * All vectors MUST have the same dimension for the lifetime of the store.
 * Failures surface as {@link eu.virtualparadox.docsearch.exception.VectorStoreException}.
 */
public interface VectorStore {

    /**
     * Adds or replaces the entry with the given id.
     *
     * @param id       entry identifier (non-blank)
     * @param vector   dense vector
     * @param metadata payload returned with search hits
     */
    void upsert(final String id, final float[] vector, final ChunkMetadata metadata);

    /**
     * Makes previous writes durable and visible to search.
     */
    void commit();

    /**
     * Moves an existing entry to another owner. The vector and the chunk text are kept, every
     * other metadata field is taken from {@code metadata}. Visible after {@link #commit()}.
     *
     * @param id       entry identifier
     * @param metadata new owner of the entry; its text is ignored
     * @return {@code false} if no committed entry has this id
     */
    boolean reassign(final String id, final ChunkMetadata metadata);

    /**
     * Finds the {@code topK} entries closest to {@code vector}.
     *
     * @param vector    query vector
     * @param topK      maximum number of candidates
     * @param fileTypes restricts candidates to these file types; {@code null} or empty means no filter
     * @return candidates ordered by descending score
     */
    List<VectorStoreCandidate> search(final float[] vector, final int topK, final Set<String> fileTypes);

    /**
     * Removes the entries with the given ids and commits. Unknown ids are ignored.
     */
    void delete(final Collection<String> ids);

    /**
     * @return number of live entries
     */
    long count();
}
