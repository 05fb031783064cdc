package eu.virtualparadox.lexqa.rag.retriever.service;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.ingest.normalize.LegalTokenizer;
import eu.virtualparadox.lexqa.ingest.normalize.MixedScriptText;
import eu.virtualparadox.lexqa.ingest.normalize.TextNormalizer;
import eu.virtualparadox.lexqa.rag.embed.EmbeddingException;
import eu.virtualparadox.lexqa.rag.embed.EmbeddingService;
import eu.virtualparadox.lexqa.rag.index.DenseIndex;
import eu.virtualparadox.lexqa.rag.index.ScoredChunk;
import eu.virtualparadox.lexqa.rag.index.SparseIndex;
import eu.virtualparadox.lexqa.rag.retriever.fusion.ScoreFusion;
import eu.virtualparadox.lexqa.rag.retriever.model.ERetrievalOutcome;
import eu.virtualparadox.lexqa.rag.retriever.model.FusedHit;
import eu.virtualparadox.lexqa.rag.retriever.model.RetrievalResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Hybrid retriever: combines ANN semantic search (dense) with lexical BM25 keyword search (sparse).
 * <p>
 * Steps:
 * <ol>
 *   <li>Normalize the query the same way document text is normalized</li>
 *   <li>Embed it and fetch {@code k * candidateMultiplier} dense candidates, at most
 *       {@value #MAX_CANDIDATES}</li>
 *   <li>Tokenize it and fetch as many sparse candidates</li>
 *   <li>Fuse both lists with {@link ScoreFusion} and keep the top {@code k}</li>
 * </ol>
 * A failing side does not fail the query: the other side is used alone and the result is marked
 * degraded. The service holds no per-query state and may be called concurrently.
 */
@Service
@Slf4j
public final class HybridRetrieverService {

    static final int MAX_CANDIDATES = 10_000;

    private final TextNormalizer normalizer;
    private final LegalTokenizer tokenizer;
    private final EmbeddingService embeddingService;
    private final DenseIndex denseIndex;
    private final SparseIndex sparseIndex;
    private final ScoreFusion fusion;
    private final int candidateMultiplier;

    @Autowired
    public HybridRetrieverService(final TextNormalizer normalizer,
                                  final LegalTokenizer tokenizer,
                                  final EmbeddingService embeddingService,
                                  final DenseIndex denseIndex,
                                  final SparseIndex sparseIndex,
                                  final ApplicationConfig config) {
        this(normalizer, tokenizer, embeddingService, denseIndex, sparseIndex,
                new ScoreFusion(config.getRetrieval().getDenseWeight(), config.getRetrieval().getSparseWeight()),
                config.getRetrieval().getCandidateMultiplier());
    }

    public HybridRetrieverService(final TextNormalizer normalizer,
                                  final LegalTokenizer tokenizer,
                                  final EmbeddingService embeddingService,
                                  final DenseIndex denseIndex,
                                  final SparseIndex sparseIndex,
                                  final ScoreFusion fusion,
                                  final int candidateMultiplier) {
        if (candidateMultiplier < 1) {
            throw new IllegalArgumentException("candidateMultiplier must be >= 1");
        }
        this.normalizer = normalizer;
        this.tokenizer = tokenizer;
        this.embeddingService = embeddingService;
        this.denseIndex = denseIndex;
        this.sparseIndex = sparseIndex;
        this.fusion = fusion;
        this.candidateMultiplier = candidateMultiplier;
    }

    /**
     * Executes hybrid semantic + keyword search.
     *
     * @param query user query string
     * @param k     maximum number of results, {@code > 0}
     * @return fused top-k hits and how they were obtained
     */
    public RetrievalResult retrieve(final String query, final int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be > 0");
        }
        if (isEmpty(denseIndex::size, "dense") && isEmpty(sparseIndex::size, "sparse")) {
            return RetrievalResult.noSources();
        }

        final String normalized = normalizer.normalize(query);
        if (normalized.isEmpty()) {
            return new RetrievalResult(List.of(), ERetrievalOutcome.OK);
        }
        if (log.isDebugEnabled()) {
            final MixedScriptText scripts = normalizer.splitMixedScript(normalized);
            if (scripts.isMixed()) {
                log.debug("Mixed-script query, devanagari='{}' other='{}'", scripts.devanagari(), scripts.other());
            }
        }

        final int candidates = (int) Math.min((long) k * candidateMultiplier, MAX_CANDIDATES);
        List<ScoredChunk> dense = List.of();
        List<ScoredChunk> sparse = List.of();
        boolean denseFailed = false;
        boolean sparseFailed = false;

        try {
            dense = denseIndex.search(embeddingService.embed(normalized), candidates);
        } catch (EmbeddingException | IOException | RuntimeException e) {
            denseFailed = true;
            log.warn("Dense retrieval failed, falling back to sparse only: {}", e.getMessage());
        }

        try {
            sparse = sparseIndex.search(tokenizer.tokenize(normalized), candidates);
        } catch (IOException | RuntimeException e) {
            sparseFailed = true;
            log.warn("Sparse retrieval failed, falling back to dense only: {}", e.getMessage());
        }

        final ERetrievalOutcome outcome;
        if (denseFailed && sparseFailed) {
            log.error("Both retrieval paths failed for query '{}'", normalized);
            return new RetrievalResult(List.of(), ERetrievalOutcome.UNAVAILABLE);
        } else if (denseFailed) {
            outcome = ERetrievalOutcome.DEGRADED_SPARSE_ONLY;
        } else if (sparseFailed) {
            outcome = ERetrievalOutcome.DEGRADED_DENSE_ONLY;
        } else {
            outcome = ERetrievalOutcome.OK;
        }

        final List<FusedHit> hits = fusion.fuse(dense, sparse, k);
        log.debug("Query '{}': {} dense, {} sparse candidates, {} fused hits ({})",
                normalized, dense.size(), sparse.size(), hits.size(), outcome);
        return new RetrievalResult(hits, outcome);
    }

    private static boolean isEmpty(final IndexSize size, final String name) {
        try {
            return size.get() == 0;
        } catch (IOException | RuntimeException e) {
            log.warn("Unable to read size of the {} index: {}", name, e.getMessage());
            return false;
        }
    }

    @FunctionalInterface
    private interface IndexSize {
        int get() throws IOException;
    }
}
