package eu.virtualparadox.lexqa.rag.index;

import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_DOC_ID;
import static eu.virtualparadox.lexqa.util.LuceneConstants.FIELD_TOKENS;

/**
 * Lucene BM25 implementation of {@link SparseIndex}.
 * <p>
 * Chunk tokens are indexed space-joined with a {@link WhitespaceAnalyzer}, so the terms in the
 * postings are exactly the tokens produced upstream. Queries are built term by term; a token
 * repeated in the query is boosted by its count.
 */
public final class LuceneSparseIndex extends AbstractLuceneIndex implements SparseIndex {

    public LuceneSparseIndex(final Directory directory, final boolean wipe) throws IOException {
        super("sparse", directory, new WhitespaceAnalyzer(), wipe);
    }

    @Override
    public void add(final String chunkId, final String docId, final List<String> tokens) throws IOException {
        requireNonBlank(chunkId, "chunkId");
        requireNonBlank(docId, "docId");

        final Document d = new Document();
        d.add(new StringField(FIELD_CHUNK_ID, chunkId, Field.Store.YES));
        d.add(new StringField(FIELD_DOC_ID, docId, Field.Store.YES));
        d.add(new TextField(FIELD_TOKENS, String.join(" ", tokens), Field.Store.NO));
        put(chunkId, d);
    }

    @Override
    public List<ScoredChunk> search(final List<String> queryTokens, final int k) throws IOException {
        if (k <= 0 || queryTokens == null || queryTokens.isEmpty()) {
            return List.of();
        }

        final Map<String, Integer> termCounts = new LinkedHashMap<>();
        for (final String token : queryTokens) {
            if (!token.isBlank()) {
                termCounts.merge(token, 1, Integer::sum);
            }
        }
        if (termCounts.isEmpty()) {
            return List.of();
        }

        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        int clauses = 0;
        for (final Map.Entry<String, Integer> entry : termCounts.entrySet()) {
            if (clauses++ >= IndexSearcher.getMaxClauseCount()) {
                break;
            }
            Query term = new TermQuery(new Term(FIELD_TOKENS, entry.getKey()));
            if (entry.getValue() > 1) {
                term = new BoostQuery(term, entry.getValue());
            }
            builder.add(term, BooleanClause.Occur.SHOULD);
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            if (searcher.getIndexReader().numDocs() == 0) {
                return List.of();
            }
            final TopDocs topDocs = searcher.search(builder.build(), k);
            return toScoredChunks(searcher, topDocs);
        } finally {
            searcherManager.release(searcher);
        }
    }
}
