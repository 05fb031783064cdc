package eu.virtualparadox.lexqa.query;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.service.DocumentCatalogService;
import eu.virtualparadox.lexqa.ingest.model.Chunk;
import eu.virtualparadox.lexqa.query.citation.PageRangeMerger;
import eu.virtualparadox.lexqa.query.model.AnswerContext;
import eu.virtualparadox.lexqa.query.model.PageRange;
import eu.virtualparadox.lexqa.query.model.Passage;
import eu.virtualparadox.lexqa.query.model.SourceCitation;
import eu.virtualparadox.lexqa.rag.retriever.model.FusedHit;
import eu.virtualparadox.lexqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.lexqa.rag.retriever.service.HybridRetrieverService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a query into the context handed to an answer generator.
 * <p>
 * Hits of the hybrid retriever are hydrated from the chunk store; a hit whose chunk is no longer
 * stored (index ahead of a deletion) is dropped. Passages keep the retrieval order and are
 * numbered from 1. Sources list every cited document once, in first-cited order, with its page
 * ranges merged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnswerContextService {

    private final HybridRetrieverService retriever;
    private final DocumentCatalogService catalogService;
    private final PageRangeMerger pageRangeMerger;
    private final ApplicationConfig config;

    public AnswerContext answerContext(final String query) {
        return answerContext(query, config.getRetrieval().getDefaultTopK());
    }

    /**
     * @param query      natural-language question, Hindi, English or both
     * @param maxResults maximum number of passages
     */
    public AnswerContext answerContext(final String query, final int maxResults) {
        final RetrievalResult result = retriever.retrieve(query, maxResults);
        if (result.degraded()) {
            log.warn("Answer context for '{}' built from degraded retrieval: {}", query, result.outcome());
        }

        final Map<String, Chunk> chunksById = catalogService
                .findChunksByIds(result.hits().stream().map(FusedHit::chunkId).toList())
                .stream()
                .collect(Collectors.toMap(Chunk::chunkId, Function.identity()));

        final Map<String, Optional<DocumentEntity>> documents = new HashMap<>();
        final List<Passage> passages = new ArrayList<>();
        final Map<String, List<PageRange>> rangesByDoc = new LinkedHashMap<>();
        final Map<String, String> titles = new HashMap<>();

        for (final FusedHit hit : result.hits()) {
            final Chunk chunk = chunksById.get(hit.chunkId());
            final Optional<DocumentEntity> document = documents.computeIfAbsent(hit.docId(), catalogService::findById);
            if (chunk == null || document.isEmpty()) {
                log.warn("Retrieved chunk {} is not in the chunk store, skipped", hit.chunkId());
                continue;
            }

            final String title = document.get().getTitle();
            final PageRange pages = new PageRange(chunk.pageStart(), chunk.pageEnd());
            passages.add(new Passage(passages.size() + 1, chunk.chunkId(), chunk.docId(), title,
                    pages, chunk.text(), hit.combinedScore()));

            titles.putIfAbsent(chunk.docId(), title);
            rangesByDoc.computeIfAbsent(chunk.docId(), k -> new ArrayList<>()).add(pages);
        }

        final List<SourceCitation> sources = new ArrayList<>(rangesByDoc.size());
        for (final Map.Entry<String, List<PageRange>> entry : rangesByDoc.entrySet()) {
            sources.add(new SourceCitation(entry.getKey(), titles.get(entry.getKey()), pageRangeMerger.merge(entry.getValue())));
        }

        if (log.isDebugEnabled()) {
            passages.forEach(p -> log.debug(" - {} [{}] {}", p.label(), p.combinedScore(), p.chunkId()));
        }
        return new AnswerContext(query, passages, sources, result.outcome());
    }
}
