package eu.virtualparadox.lexqa.rag.index;

import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.lexqa.util.LuceneConstants.COMMIT_DIMENSION;
import static eu.virtualparadox.lexqa.util.LuceneConstants.COMMIT_MODEL_VERSION;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_DOC_ID;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_VECTOR;

/**
 * Lucene HNSW implementation of {@link DenseIndex}.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunkId} – {@link StringField}, stored: unique key</li>
 *   <li>{@code docId} – {@link StringField}, stored: parent document</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <p>The embedding model version and the vector dimension are kept in the commit user data.
 * Opening a non-empty index built with another model version fails with
 * {@link IndexIntegrityException}: mixing vectors of two models degrades search silently.</p>
 */
public final class LuceneDenseIndex extends AbstractLuceneIndex implements DenseIndex {

    private final String modelVersion;

    /**
     * Lucene enforces a single dimension per vector field across the index; it is learned from
     * the commit data or from the first vector added.
     */
    private volatile int dimension;

    public LuceneDenseIndex(final Directory directory, final String modelVersion, final boolean wipe) throws IOException {
        super("dense", directory, new StandardAnalyzer(), wipe);
        this.modelVersion = modelVersion;

        final Map<String, String> commitData = commitData();
        final String storedVersion = commitData.get(COMMIT_MODEL_VERSION);
        if (storedVersion != null && !storedVersion.equals(modelVersion) && writer.getDocStats().numDocs > 0) {
            close();
            throw new IndexIntegrityException("Dense index was built with embedding model " + storedVersion
                    + " but the configured model is " + modelVersion);
        }
        final String storedDimension = commitData.get(COMMIT_DIMENSION);
        this.dimension = storedDimension == null || writer.getDocStats().numDocs == 0 ? 0 : Integer.parseInt(storedDimension);
    }

    @Override
    public void add(final String chunkId, final String docId, final float[] vector) throws IOException {
        requireNonBlank(chunkId, "chunkId");
        requireNonBlank(docId, "docId");
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
        ensureConsistentDimension(vector.length);

        final Document d = new Document();
        d.add(new StringField(FIELD_CHUNK_ID, chunkId, Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, docId, Field.Store.YES));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vector, VectorSimilarityFunction.COSINE));
        put(chunkId, d);
    }

    @Override
    public void commit() throws IOException {
        final Map<String, String> data = new HashMap<>();
        data.put(COMMIT_MODEL_VERSION, modelVersion);
        if (dimension > 0) {
            data.put(COMMIT_DIMENSION, Integer.toString(dimension));
        }
        writer.setLiveCommitData(data.entrySet());
        super.commit();
    }

    @Override
    public List<ScoredChunk> search(final float[] query, final int k) throws IOException {
        if (k <= 0) {
            return List.of();
        }
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            if (searcher.getIndexReader().numDocs() == 0) {
                return List.of();
            }
            if (dimension > 0 && query.length != dimension) {
                throw new IllegalArgumentException("Query dimension " + query.length + " != index dimension " + dimension);
            }
            final TopDocs topDocs = searcher.search(new KnnFloatVectorQuery(FIELD_VECTOR, query, k), k);
            return toScoredChunks(searcher, topDocs);
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public void clear() throws IOException {
        dimension = 0;
        super.clear();
    }

    public String modelVersion() {
        return modelVersion;
    }

    private synchronized void ensureConsistentDimension(final int dim) {
        if (dimension == 0) {
            dimension = dim;
        } else if (dimension != dim) {
            throw new IllegalArgumentException("Vector dimension mismatch. Existing=" + dimension + ", new=" + dim);
        }
    }

    private Map<String, String> commitData() {
        final Map<String, String> data = new HashMap<>();
        final Iterable<Map.Entry<String, String>> live = writer.getLiveCommitData();
        if (live != null) {
            for (final Map.Entry<String, String> entry : live) {
                data.put(entry.getKey(), entry.getValue());
            }
        }
        return data;
    }
}
