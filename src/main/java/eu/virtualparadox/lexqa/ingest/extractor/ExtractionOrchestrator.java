package eu.virtualparadox.lexqa.ingest.extractor;

import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractedText;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractionException;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractorBackend;
import eu.virtualparadox.lexqa.ingest.extractor.model.EPageOutcome;
import eu.virtualparadox.lexqa.ingest.extractor.model.PageExtraction;
import eu.virtualparadox.lexqa.ingest.render.RenderException;
import eu.virtualparadox.lexqa.ingest.render.RenderedPdf;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Drives the backend chain over every page of a document.
 * <p>
 * Per page, ready backends are tried one after another in priority order. The first result
 * whose confidence is strictly above the acceptance threshold is kept; when no backend reaches
 * it, the highest-confidence result seen is kept instead. A page where every backend fails or
 * reports zero confidence ends as {@link EPageOutcome#NO_TEXT}.
 * <p>
 * Pages run concurrently on the page executor, each backend call runs on the inference
 * executor under its own timeout. Cancellation is checked before each page starts.
 */
@Slf4j
public class ExtractionOrchestrator {

    private final List<ExtractorBackend> backends;
    private final double acceptanceThreshold;
    private final int dpi;
    private final Duration backendTimeout;
    private final Executor pageExecutor;
    private final AsyncTaskExecutor inferenceExecutor;

    public ExtractionOrchestrator(final List<ExtractorBackend> backends,
                                  final double acceptanceThreshold,
                                  final int dpi,
                                  final Duration backendTimeout,
                                  final Executor pageExecutor,
                                  final AsyncTaskExecutor inferenceExecutor) {
        if (acceptanceThreshold < 0.0 || acceptanceThreshold > 1.0) {
            throw new IllegalArgumentException("acceptanceThreshold must be within [0, 1]");
        }
        this.backends = List.copyOf(backends);
        this.acceptanceThreshold = acceptanceThreshold;
        this.dpi = dpi;
        this.backendTimeout = backendTimeout;
        this.pageExecutor = pageExecutor;
        this.inferenceExecutor = inferenceExecutor;
    }

    /**
     * Orders the available backends by configured name. Unknown names are logged and skipped,
     * unlisted backends are not used.
     *
     * @param available all backend beans
     * @param order     configured names, highest priority first
     * @return backends in priority order
     */
    public static List<ExtractorBackend> prioritize(final List<ExtractorBackend> available, final List<String> order) {
        final Map<String, ExtractorBackend> byName = new LinkedHashMap<>();
        for (final ExtractorBackend backend : available) {
            byName.put(backend.name(), backend);
        }

        final List<ExtractorBackend> ordered = new ArrayList<>();
        for (final String name : order) {
            final ExtractorBackend backend = byName.get(name.trim());
            if (backend == null) {
                log.warn("Unknown extractor backend '{}' ignored, known: {}", name, byName.keySet());
            } else if (!ordered.contains(backend)) {
                ordered.add(backend);
            }
        }
        return ordered;
    }

    public List<ExtractorBackend> backends() {
        return backends;
    }

    /**
     * Extracts every page of the document.
     *
     * @param pdf        opened document
     * @param cancelled  cooperative cancellation flag, polled before each page
     * @param onPageDone invoked once per page as soon as it finishes, from a worker thread
     * @return one entry per page, sorted by page index
     */
    public List<PageExtraction> extract(final RenderedPdf pdf,
                                        final BooleanSupplier cancelled,
                                        final Consumer<PageExtraction> onPageDone) {
        final int pageCount = pdf.pageCount();
        final List<CompletableFuture<PageExtraction>> futures = new ArrayList<>(pageCount);

        for (int i = 0; i < pageCount; i++) {
            final int pageIndex = i;
            futures.add(CompletableFuture.supplyAsync(() -> {
                final PageExtraction page = extractPage(pdf, pageIndex, cancelled);
                onPageDone.accept(page);
                return page;
            }, pageExecutor));
        }

        final List<PageExtraction> pages = new ArrayList<>(pageCount);
        for (final CompletableFuture<PageExtraction> future : futures) {
            pages.add(future.join());
        }
        // workers finish in any order
        pages.sort(Comparator.comparingInt(PageExtraction::pageIndex));
        return pages;
    }

    private PageExtraction extractPage(final RenderedPdf pdf, final int pageIndex, final BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            return PageExtraction.failed(pageIndex, EPageOutcome.NOT_ATTEMPTED);
        }

        final BufferedImage image;
        try {
            image = pdf.render(pageIndex, dpi);
        } catch (RenderException e) {
            log.warn("Page {} could not be rendered: {}", pageIndex, e.getMessage());
            return PageExtraction.failed(pageIndex, EPageOutcome.RENDER_FAILED);
        }

        return extractImage(image, pageIndex);
    }

    /**
     * Runs the backend chain on one page image.
     *
     * @param image     rendered page
     * @param pageIndex zero-based page index
     * @return the kept result
     */
    public PageExtraction extractImage(final BufferedImage image, final int pageIndex) {
        ExtractedText best = null;
        String bestBackend = null;

        for (final ExtractorBackend backend : backends) {
            if (!backend.isReady()) {
                log.debug("Backend {} not ready, skipped for page {}", backend.name(), pageIndex);
                continue;
            }

            final ExtractedText result;
            try {
                result = callWithTimeout(backend, image, pageIndex);
            } catch (ExtractionException e) {
                log.warn("Backend {} failed on page {}: {}", backend.name(), pageIndex, e.getMessage());
                continue;
            }

            if (result.isBlank()) {
                log.debug("Backend {} returned no text for page {}", backend.name(), pageIndex);
                continue;
            }
            if (best == null || result.confidence() > best.confidence()) {
                best = result;
                bestBackend = backend.name();
            }
            if (result.confidence() > acceptanceThreshold) {
                log.debug("Page {} accepted from {} with confidence {}", pageIndex, backend.name(), result.confidence());
                return PageExtraction.extracted(pageIndex, result.text(), result.confidence(), backend.name());
            }
        }

        if (best == null || best.confidence() <= 0.0) {
            log.warn("No backend produced text for page {}", pageIndex);
            return PageExtraction.failed(pageIndex, EPageOutcome.NO_TEXT);
        }
        log.debug("Page {} kept best-of result from {} with confidence {}", pageIndex, bestBackend, best.confidence());
        return PageExtraction.extracted(pageIndex, best.text(), best.confidence(), bestBackend);
    }

    private ExtractedText callWithTimeout(final ExtractorBackend backend,
                                          final BufferedImage image,
                                          final int pageIndex) throws ExtractionException {
        final Future<ExtractedText> future;
        try {
            future = inferenceExecutor.submit(() -> backend.extract(image, pageIndex));
        } catch (TaskRejectedException e) {
            throw new ExtractionException(backend.name(), "Inference executor rejected the call", e);
        }

        try {
            return future.get(backendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExtractionException(backend.name(), "Timed out after " + backendTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException(backend.name(), "Interrupted", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extractionException) {
                throw extractionException;
            }
            throw new ExtractionException(backend.name(), "Unexpected failure: " + cause, cause);
        }
    }
}
