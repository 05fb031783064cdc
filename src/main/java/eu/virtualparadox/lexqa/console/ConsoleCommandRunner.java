package eu.virtualparadox.lexqa.console;

import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.entity.PageRecord;
import eu.virtualparadox.lexqa.catalog.model.ChunkStatistics;
import eu.virtualparadox.lexqa.ingest.extractor.ExtractionOrchestrator;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractorBackend;
import eu.virtualparadox.lexqa.ingest.lifecycle.IngestionOutcome;
import eu.virtualparadox.lexqa.ingest.lifecycle.IngestionService;
import eu.virtualparadox.lexqa.query.AnswerContextService;
import eu.virtualparadox.lexqa.query.model.AnswerContext;
import eu.virtualparadox.lexqa.query.model.SourceCitation;
import eu.virtualparadox.lexqa.rag.index.DenseIndex;
import eu.virtualparadox.lexqa.rag.index.IndexRebuildService;
import eu.virtualparadox.lexqa.rag.index.SparseIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Console entry point.
 * <pre>
 *   ingest &lt;file.pdf&gt;...       ingest PDFs one after another
 *   ask [-k n] &lt;question&gt;      print the answer context of a question, n in 1..{@value #MAX_RESULTS}
 *   list                      list documents
 *   stats &lt;docId&gt;             chunk statistics of a document
 *   delete &lt;docId&gt;            delete a document
 *   rebuild                   rebuild both indexes from the chunk store
 *   health                    backend readiness and index sizes
 * </pre>
 * Without arguments nothing runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConsoleCommandRunner implements CommandLineRunner {

    static final int MAX_RESULTS = 100;

    private static final String ASK_USAGE = "Usage: ask [-k <1.." + MAX_RESULTS + ">] <question>";

    private final IngestionService ingestionService;
    private final AnswerContextService answerContextService;
    private final IndexRebuildService rebuildService;
    private final ExtractionOrchestrator orchestrator;
    private final DenseIndex denseIndex;
    private final SparseIndex sparseIndex;

    @Override
    public void run(final String... args) throws IOException {
        if (args.length == 0) {
            return;
        }
        final List<String> rest = Arrays.asList(args).subList(1, args.length);

        switch (args[0].toLowerCase(Locale.ROOT)) {
            case "ingest" -> ingest(rest);
            case "ask" -> ask(rest);
            case "list" -> list();
            case "stats" -> stats(rest);
            case "delete" -> delete(rest);
            case "rebuild" -> rebuildService.rebuild();
            case "health" -> health();
            default -> log.error("Unknown command '{}', expected one of ingest, ask, list, stats, delete, rebuild, health", args[0]);
        }
    }

    private void ingest(final List<String> files) {
        if (files.isEmpty()) {
            log.error("Usage: ingest <file.pdf>...");
            return;
        }
        final List<IngestionOutcome> outcomes = ingestionService.ingestAll(files.stream().map(Path::of).toList());
        for (final IngestionOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                log.info("{} -> {} ({} pages, {} chunks)", outcome.filename(), outcome.document().docId(),
                        outcome.document().pageCount(), outcome.document().chunkCount());
            } else {
                log.info("{} -> failed: {}", outcome.filename(), outcome.failureCode());
            }
        }
    }

    private void ask(final List<String> words) {
        List<String> questionWords = words;
        int maxResults = 0;
        if (!words.isEmpty() && "-k".equals(words.get(0))) {
            maxResults = words.size() > 1 && NumberUtils.isDigits(words.get(1)) ? NumberUtils.toInt(words.get(1), -1) : -1;
            if (maxResults < 1 || maxResults > MAX_RESULTS) {
                log.error("Invalid result count '{}'. {}", words.size() > 1 ? words.get(1) : "", ASK_USAGE);
                return;
            }
            questionWords = words.subList(2, words.size());
        }
        if (questionWords.isEmpty()) {
            log.error(ASK_USAGE);
            return;
        }

        final String question = StringUtils.join(questionWords, ' ');
        final AnswerContext context = maxResults > 0
                ? answerContextService.answerContext(question, maxResults)
                : answerContextService.answerContext(question);

        log.info("Retrieval: {}", context.outcome());
        if (context.isEmpty()) {
            log.info("No relevant passage found.");
            return;
        }
        log.info("\n{}", context.asPromptContext());
        for (final SourceCitation source : context.sources()) {
            log.info("Source: {}", source.asString());
        }
    }

    private void list() {
        for (final DocumentEntity doc : ingestionService.listAll()) {
            log.info("{}  {}  {}  pages={} chunks={} confidence={} model={}", doc.getId(), doc.getStatus(), doc.getTitle(),
                    doc.getPageCount(), doc.getChunks(),
                    String.format(Locale.ROOT, "%.2f", averageConfidence(doc.getPages())), doc.getEmbedModel());
        }
    }

    /**
     * Mean page confidence, pages without text included; 0 for a document without page records.
     */
    static double averageConfidence(final List<PageRecord> pages) {
        return pages == null ? 0.0 : pages.stream().mapToDouble(PageRecord::getConfidence).average().orElse(0.0);
    }

    private void stats(final List<String> ids) {
        for (final String id : ids) {
            final ChunkStatistics stats = ingestionService.chunkStatistics(id);
            log.info("{}: {} chunks, avg {} tokens (min {}, max {})", id, stats.chunkCount(),
                    String.format(Locale.ROOT, "%.1f", stats.averageTokens()), stats.minTokens(), stats.maxTokens());
        }
    }

    private void delete(final List<String> ids) {
        if (ids.isEmpty()) {
            log.error("Usage: delete <docId>...");
            return;
        }
        for (final String id : ids) {
            try {
                ingestionService.deleteDocument(id);
                log.info("Deleted {}", id);
            } catch (IllegalArgumentException | IOException e) {
                log.error("Cannot delete {}: {}", id, e.getMessage());
            }
        }
    }

    private void health() throws IOException {
        for (final ExtractorBackend backend : orchestrator.backends()) {
            log.info("Backend {} ({}): {}", backend.name(), backend.kind(), backend.isReady() ? "ready" : "not ready");
        }
        log.info("Dense index: {} chunks, sparse index: {} chunks", denseIndex.size(), sparseIndex.size());
    }
}
