package eu.virtualparadox.lexqa.ingest.extractor;

import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractedText;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractorBackend;
import eu.virtualparadox.lexqa.ingest.extractor.model.EPageOutcome;
import eu.virtualparadox.lexqa.ingest.extractor.model.PageExtraction;
import eu.virtualparadox.lexqa.testsupport.FakeRenderedPdf;
import eu.virtualparadox.lexqa.testsupport.StubBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtractionOrchestratorTest {

    private static final BufferedImage PAGE = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);

    private final ExecutorService pagePool = Executors.newFixedThreadPool(4);
    private final ExecutorService inferencePool = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        pagePool.shutdownNow();
        inferencePool.shutdownNow();
    }

    private ExtractionOrchestrator orchestrator(final double threshold, final Duration timeout, final ExtractorBackend... backends) {
        return new ExtractionOrchestrator(List.of(backends), threshold, 300, timeout,
                pagePool, new ConcurrentTaskExecutor(inferencePool));
    }

    private ExtractionOrchestrator orchestrator(final double threshold, final ExtractorBackend... backends) {
        return orchestrator(threshold, Duration.ofSeconds(10), backends);
    }

    @Test
    @DisplayName("the first backend above the threshold wins and later backends are not called")
    void extractImage_secondAboveThreshold_secondWins() {
        final StubBackend a = StubBackend.returning("a", "low quality", 0.1);
        final StubBackend b = StubBackend.returning("b", "good text", 0.9);
        final StubBackend c = StubBackend.returning("c", "other text", 0.4);

        final PageExtraction page = orchestrator(0.8, a, b, c).extractImage(PAGE, 0);

        assertEquals("good text", page.text());
        assertEquals(0.9, page.confidence(), 1e-9);
        assertEquals("b", page.backend());
        assertEquals(EPageOutcome.EXTRACTED, page.outcome());
        assertEquals(0, c.calls());
    }

    @Test
    @DisplayName("when nothing reaches the threshold the best result is kept")
    void extractImage_noneAboveThreshold_bestOf() {
        final StubBackend a = StubBackend.returning("a", "low quality", 0.1);
        final StubBackend b = StubBackend.returning("b", "good text", 0.9);
        final StubBackend c = StubBackend.returning("c", "other text", 0.4);

        final PageExtraction page = orchestrator(0.95, a, b, c).extractImage(PAGE, 0);

        assertEquals("b", page.backend());
        assertEquals(1, c.calls());
    }

    @Test
    @DisplayName("with the default threshold the first non-zero success wins")
    void extractImage_defaultThreshold_firstNonZeroWins() {
        final StubBackend a = StubBackend.returning("a", "", 0.7);
        final StubBackend b = StubBackend.returning("b", "some text", 0.2);
        final StubBackend c = StubBackend.returning("c", "better text", 0.9);

        final PageExtraction page = orchestrator(0.0, a, b, c).extractImage(PAGE, 0);

        assertEquals("b", page.backend());
        assertEquals(0, c.calls());
    }

    @Test
    @DisplayName("all backends failing yields NO_TEXT with empty text and zero confidence")
    void extractImage_allFail_noText() {
        final PageExtraction page = orchestrator(0.0,
                StubBackend.failing("a"),
                StubBackend.returning("b", "   ", 0.8),
                StubBackend.returning("c", "text", 0.0)).extractImage(PAGE, 3);

        assertEquals(3, page.pageIndex());
        assertEquals("", page.text());
        assertEquals(0.0, page.confidence());
        assertNull(page.backend());
        assertEquals(EPageOutcome.NO_TEXT, page.outcome());
    }

    @Test
    @DisplayName("unready backends are skipped")
    void extractImage_unreadyBackend_skipped() {
        final StubBackend unready = new StubBackend("a", false, p -> new ExtractedText("never", 1.0));
        final StubBackend ready = StubBackend.returning("b", "text", 0.5);

        final PageExtraction page = orchestrator(0.0, unready, ready).extractImage(PAGE, 0);

        assertEquals("b", page.backend());
        assertEquals(0, unready.calls());
    }

    @Test
    @DisplayName("a backend exceeding its timeout counts as failed")
    void extractImage_timeout_nextBackend() {
        final StubBackend slow = new StubBackend("slow", true, p -> {
            Thread.sleep(5_000);
            return new ExtractedText("too late", 1.0);
        });
        final StubBackend fast = StubBackend.returning("fast", "in time", 0.6);

        final PageExtraction page = orchestrator(0.0, Duration.ofMillis(100), slow, fast).extractImage(PAGE, 0);

        assertEquals("fast", page.backend());
        assertEquals("in time", page.text());
    }

    @Test
    @DisplayName("pages finish in any order but come back sorted, render failures are marked")
    void extract_concurrentPages_sortedByIndex() {
        final StubBackend jittery = new StubBackend("ocr", true, p -> {
            Thread.sleep((7 - p) * 10L);
            return new ExtractedText("page " + p, 0.5);
        });
        final AtomicInteger callbacks = new AtomicInteger();

        final List<PageExtraction> pages = orchestrator(0.0, jittery)
                .extract(new FakeRenderedPdf(8, Set.of(5)), () -> false, p -> callbacks.incrementAndGet());

        assertThat(pages).extracting(PageExtraction::pageIndex).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
        assertEquals("page 2", pages.get(2).text());
        assertEquals(EPageOutcome.RENDER_FAILED, pages.get(5).outcome());
        assertEquals(8, callbacks.get());
    }

    @Test
    @DisplayName("a cancelled job attempts no page")
    void extract_cancelled_notAttempted() {
        final StubBackend backend = StubBackend.returning("ocr", "text", 0.5);

        final List<PageExtraction> pages = orchestrator(0.0, backend)
                .extract(new FakeRenderedPdf(3), () -> true, p -> { });

        assertThat(pages).extracting(PageExtraction::outcome).containsOnly(EPageOutcome.NOT_ATTEMPTED);
        assertEquals(0, backend.calls());
    }

    @Test
    @DisplayName("backends are ordered by configured name, unknown names are ignored")
    void prioritize_configuredOrder() {
        final StubBackend donut = StubBackend.returning("donut", "", 0);
        final StubBackend tesseract = StubBackend.returning("tesseract", "", 0);
        final StubBackend remote = StubBackend.returning("remote-vision", "", 0);

        final List<ExtractorBackend> ordered = ExtractionOrchestrator.prioritize(
                List.of(donut, tesseract, remote), List.of("tesseract", "nonexistent", " donut "));

        assertThat(ordered).containsExactly(tesseract, donut);
    }

    @Test
    @DisplayName("threshold outside [0, 1] is rejected")
    void constructor_invalidThreshold_rejected() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator(1.5));
    }
}
