package eu.virtualparadox.docsearch.rag.store;

import eu.virtualparadox.docsearch.exception.VectorStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.FloatVectorValues;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.ReaderUtil;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static eu.virtualparadox.docsearch.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorStore} using the HNSW k-NN graph.
 * <p>
 * Each entry is stored as one Lucene {@link Document} keyed by {@code id}; upserts use
 * {@link IndexWriter#updateDocument} so an id never appears twice.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code id} – {@link StringField}: entry identifier (chunk fingerprint)</li>
 *   <li>{@code docId}, {@code sourceFile} – {@link StringField}: owning document</li>
 *   <li>{@code fileType} – {@link StringField}: indexed for filtered k-NN search</li>
 *   <li>{@code text}, {@code sequence}, {@code startOffset}, {@code endOffset} – stored only</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <h3>Scores</h3>
 * Lucene reports cosine hits as {@code (1 + cos) / 2}; candidates carry the plain cosine
 * similarity so score thresholds mean the same as for any other cosine store.
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an
 * index. Changing the embedding model requires a fresh index directory.</p>
 */
@Slf4j
@RequiredArgsConstructor
public final class LuceneVectorStore implements VectorStore {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen vector dimension, validated on every upsert.
     */
    private volatile Integer vectorDim;

    @Override
    public void upsert(final String id, final float[] vector, final ChunkMetadata metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata must not be null");
        }
        ensureConsistentDimension(vector);

        try {
            writer.updateDocument(new Term(FIELD_ID, id), buildLuceneDocument(id, vector, metadata));
        } catch (IOException e) {
            throw new VectorStoreException("Failed to upsert " + id, e, true);
        } catch (AlreadyClosedException | IllegalArgumentException e) {
            throw new VectorStoreException("Failed to upsert " + id, e, false);
        }
    }

    @Override
    public void commit() {
        try {
            writer.commit();
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new VectorStoreException("Failed to commit vector index", e, true);
        } catch (AlreadyClosedException e) {
            throw new VectorStoreException("Vector index is closed", e, false);
        }
    }

    @Override
    public boolean reassign(final String id, final ChunkMetadata metadata) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata must not be null");
        }

        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            final TopDocs hits = searcher.search(new TermQuery(new Term(FIELD_ID, id)), 1);
            if (hits.scoreDocs.length == 0) {
                return false;
            }
            final int doc = hits.scoreDocs[0].doc;
            final float[] vector = readVector(searcher, doc);
            final String text = searcher.storedFields().document(doc).get(FIELD_TEXT);

            final ChunkMetadata moved = new ChunkMetadata(metadata.documentId(), metadata.sourceFile(),
                    metadata.fileType(), metadata.sequenceIndex(), metadata.startOffset(), metadata.endOffset(), text);
            writer.updateDocument(new Term(FIELD_ID, id), buildLuceneDocument(id, vector, moved));
            return true;
        } catch (IOException e) {
            throw new VectorStoreException("Failed to reassign " + id, e, true);
        } catch (AlreadyClosedException | IllegalArgumentException e) {
            throw new VectorStoreException("Failed to reassign " + id, e, false);
        } finally {
            release(searcher);
        }
    }

    @Override
    public List<VectorStoreCandidate> search(final float[] vector, final int topK, final Set<String> fileTypes) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("query vector must not be empty");
        }
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }

        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            if (searcher.getIndexReader().numDocs() == 0) {
                return List.of();
            }

            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, topK, fileTypeFilter(fileTypes));
            final TopDocs topDocs = searcher.search(knn, topK);
            final StoredFields storedFields = searcher.storedFields();

            final List<VectorStoreCandidate> results = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                results.add(new VectorStoreCandidate(doc.get(FIELD_ID), 2f * sd.score - 1f, toMetadata(doc)));
            }
            return results;
        } catch (IOException e) {
            throw new VectorStoreException("Vector search failed", e, true);
        } catch (AlreadyClosedException | IllegalArgumentException e) {
            throw new VectorStoreException("Vector search failed", e, false);
        } finally {
            release(searcher);
        }
    }

    @Override
    public void delete(final Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        final Term[] terms = ids.stream().map(id -> new Term(FIELD_ID, id)).toArray(Term[]::new);
        try {
            writer.deleteDocuments(terms);
            commit();
            log.debug("Deleted {} vectors", terms.length);
        } catch (IOException e) {
            throw new VectorStoreException("Failed to delete " + terms.length + " vectors", e, true);
        } catch (AlreadyClosedException e) {
            throw new VectorStoreException("Vector index is closed", e, false);
        }
    }

    @Override
    public long count() {
        IndexSearcher searcher = null;
        try {
            searcher = searcherManager.acquire();
            return searcher.getIndexReader().numDocs();
        } catch (IOException e) {
            throw new VectorStoreException("Failed to count vectors", e, true);
        } catch (AlreadyClosedException e) {
            throw new VectorStoreException("Vector index is closed", e, false);
        } finally {
            release(searcher);
        }
    }

    private void ensureConsistentDimension(final float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        final Integer current = vectorDim;
        if (current == null) {
            vectorDim = vector.length;
        } else if (current != vector.length) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + current + ", new=" + vector.length +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private static float[] readVector(final IndexSearcher searcher, final int doc) throws IOException {
        final List<LeafReaderContext> leaves = searcher.getIndexReader().leaves();
        final LeafReaderContext leaf = leaves.get(ReaderUtil.subIndex(doc, leaves));
        final FloatVectorValues values = leaf.reader().getFloatVectorValues(FIELD_VECTOR);
        final int target = doc - leaf.docBase;
        if (values == null || values.advance(target) != target) {
            throw new VectorStoreException("No vector stored for document " + doc, null, false);
        }
        return values.vectorValue().clone();
    }

    private static Query fileTypeFilter(final Set<String> fileTypes) {
        if (fileTypes == null || fileTypes.isEmpty()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        for (final String type : fileTypes) {
            builder.add(new TermQuery(new Term(FIELD_FILE_TYPE, type)), BooleanClause.Occur.SHOULD);
        }
        return builder.build();
    }

    private static Document buildLuceneDocument(final String id, final float[] vec, final ChunkMetadata m) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_ID, id, Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, m.documentId(), Field.Store.YES));
        d.add(new StringField(FIELD_SOURCE_FILE, m.sourceFile(), Field.Store.YES));
        d.add(new StringField(FIELD_FILE_TYPE, m.fileType(), Field.Store.YES));

        // Payload (stored only)
        d.add(new StoredField(FIELD_TEXT, m.text()));
        d.add(new StoredField(FIELD_SEQUENCE, m.sequenceIndex()));
        d.add(new StoredField(FIELD_START_OFFSET, m.startOffset()));
        d.add(new StoredField(FIELD_END_OFFSET, m.endOffset()));

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));
        return d;
    }

    private static ChunkMetadata toMetadata(final Document doc) {
        return new ChunkMetadata(
                doc.get(FIELD_DOC_ID),
                doc.get(FIELD_SOURCE_FILE),
                doc.get(FIELD_FILE_TYPE),
                doc.getField(FIELD_SEQUENCE).numericValue().intValue(),
                doc.getField(FIELD_START_OFFSET).numericValue().intValue(),
                doc.getField(FIELD_END_OFFSET).numericValue().intValue(),
                doc.get(FIELD_TEXT));
    }

    private void release(final IndexSearcher searcher) {
        if (searcher == null) {
            return;
        }
        try {
            searcherManager.release(searcher);
        } catch (IOException e) {
            log.error("Unable to release IndexSearcher", e);
        }
    }
}
