package eu.virtualparadox.lexqa.rag.index;

import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.index.IndexFormatTooNewException;
import org.apache.lucene.index.IndexFormatTooOldException;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_DOC_ID;

/**
 * Writer and near-real-time searcher over one Lucene directory.
 * <p>
 * One Lucene document per chunk, keyed by the {@code chunkId} field so that re-adding a chunk
 * replaces it. The {@code docId} field groups the chunks of a document for deletion.
 */
@Slf4j
public abstract class AbstractLuceneIndex implements Closeable {

    private final String name;
    private final Directory directory;
    private final AtomicBoolean closed = new AtomicBoolean();
    protected final IndexWriter writer;
    protected final SearcherManager searcherManager;

    /**
     * Opens (or creates) the index.
     *
     * @param name      index name for logging
     * @param directory Lucene directory, owned by this index from now on
     * @param analyzer  analyzer for tokenized fields
     * @param wipe      discard any existing content
     * @throws IndexIntegrityException if the existing index cannot be read
     * @throws IOException             on other I/O failures
     */
    protected AbstractLuceneIndex(final String name,
                                  final Directory directory,
                                  final Analyzer analyzer,
                                  final boolean wipe) throws IOException {
        this.name = name;
        this.directory = directory;

        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(wipe ? IndexWriterConfig.OpenMode.CREATE : IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        try {
            this.writer = new IndexWriter(directory, cfg);
        } catch (CorruptIndexException | IndexFormatTooOldException | IndexFormatTooNewException | EOFException e) {
            closeQuietly(directory);
            throw new IndexIntegrityException("The " + name + " index is unreadable: " + e.getMessage(), e);
        }
        this.searcherManager = new SearcherManager(writer, null);
        log.info("Opened {} index with {} chunks", name, writer.getDocStats().numDocs);
    }

    public void commit() throws IOException {
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    public void deleteByDocId(final String docId) throws IOException {
        requireNonBlank(docId, "docId");
        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        commit();
    }

    public int size() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    public void clear() throws IOException {
        writer.deleteAll();
        commit();
        log.info("Cleared {} index", name);
    }

    protected void put(final String chunkId, final Document document) throws IOException {
        writer.updateDocument(new Term(FIELD_CHUNK_ID, chunkId), document);
    }

    /**
     * Resolves hits to chunk ids.
     */
    protected static List<ScoredChunk> toScoredChunks(final IndexSearcher searcher, final TopDocs topDocs) throws IOException {
        final StoredFields storedFields = searcher.storedFields();
        final List<ScoredChunk> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc sd : topDocs.scoreDocs) {
            final Document doc = storedFields.document(sd.doc);
            hits.add(new ScoredChunk(doc.get(FIELD_CHUNK_ID), doc.get(FIELD_DOC_ID), sd.score));
        }
        return hits;
    }

    protected static void requireNonBlank(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try { searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager of {} index", name, e);
        }

        try { writer.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter of {} index", name, e);
        }

        closeQuietly(directory);
    }

    private static void closeQuietly(final Directory directory) {
        try { directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory", e);
        }
    }
}
