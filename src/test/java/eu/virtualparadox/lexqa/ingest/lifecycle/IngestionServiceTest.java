package eu.virtualparadox.lexqa.ingest.lifecycle;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.application.executor.IngestionExecutor;
import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.entity.PageRecord;
import eu.virtualparadox.lexqa.catalog.service.DocumentCatalogService;
import eu.virtualparadox.lexqa.ingest.assembler.DocumentTextAssembler;
import eu.virtualparadox.lexqa.ingest.chunker.Chunker;
import eu.virtualparadox.lexqa.ingest.extractor.ExtractionOrchestrator;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractedText;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractionException;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractorBackend;
import eu.virtualparadox.lexqa.ingest.extractor.model.EPageOutcome;
import eu.virtualparadox.lexqa.ingest.normalize.LegalTokenizer;
import eu.virtualparadox.lexqa.ingest.normalize.TextNormalizer;
import eu.virtualparadox.lexqa.ingest.render.PdfBoxPageRenderer;
import eu.virtualparadox.lexqa.rag.index.ChunkIndexer;
import eu.virtualparadox.lexqa.rag.index.LuceneDenseIndex;
import eu.virtualparadox.lexqa.rag.index.LuceneSparseIndex;
import eu.virtualparadox.lexqa.testsupport.HashingEmbeddingService;
import eu.virtualparadox.lexqa.testsupport.StubBackend;
import eu.virtualparadox.lexqa.testsupport.TestPdfs;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private static final List<String> PAGES = List.of(
            "Section 302 IPC punishment for murder",
            "unreadable scan",
            "Section 304 IPC culpable homicide");

    @TempDir
    Path tmp;

    private final ExecutorService pagePool = Executors.newFixedThreadPool(2);
    private final ExecutorService inferencePool = Executors.newCachedThreadPool();
    private final IngestionExecutor ingestionExecutor = new IngestionExecutor();
    private final IngestionRegistry registry = new IngestionRegistry();
    private final TextNormalizer normalizer = new TextNormalizer();
    private final LegalTokenizer tokenizer = new LegalTokenizer();

    private DocumentCatalogService catalog;
    private LuceneDenseIndex dense;
    private LuceneSparseIndex sparse;

    @BeforeEach
    void setUp() throws Exception {
        ingestionExecutor.setCorePoolSize(1);
        ingestionExecutor.setMaxPoolSize(1);
        ingestionExecutor.initialize();

        dense = new LuceneDenseIndex(new ByteBuffersDirectory(), new HashingEmbeddingService().modelVersion(), false);
        sparse = new LuceneSparseIndex(new ByteBuffersDirectory(), false);

        catalog = mock(DocumentCatalogService.class);
        when(catalog.save(anyString(), any(byte[].class), eq(EDocumentStatus.PROCESSING)))
                .thenAnswer(inv -> DocumentEntity.builder()
                        .id("doc1")
                        .title(inv.getArgument(0))
                        .blobPath(tmp.resolve("doc1.pdf").toString())
                        .status(EDocumentStatus.PROCESSING)
                        .build());
        when(catalog.update(any(DocumentEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        ingestionExecutor.shutdown();
        pagePool.shutdownNow();
        inferencePool.shutdownNow();
        dense.close();
        sparse.close();
    }

    private IngestionService service(final ExtractorBackend... backends) {
        return service(new HashingEmbeddingService(), backends);
    }

    private IngestionService service(final HashingEmbeddingService embedder, final ExtractorBackend... backends) {
        final ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(backends), 0.0, 72,
                Duration.ofSeconds(10), pagePool, new ConcurrentTaskExecutor(inferencePool));
        final ApplicationConfig config = new ApplicationConfig();
        config.setBlob(tmp);
        final ChunkIndexer indexer = new ChunkIndexer(embedder, dense, sparse, tokenizer, config);
        return new IngestionService(new PdfBoxPageRenderer(), orchestrator, new DocumentTextAssembler(normalizer),
                new Chunker(4, 1), indexer, catalog, ingestionExecutor, registry);
    }

    /** Reads pages 1 and 3 and fails on page 2. */
    private static StubBackend primary() {
        return new StubBackend("primary", true, page -> {
            switch (page) {
                case 0:
                    return new ExtractedText(PAGES.get(0), 0.9);
                case 2:
                    return new ExtractedText(PAGES.get(2), 0.85);
                default:
                    throw new ExtractionException("primary", "decoder crashed");
            }
        });
    }

    @Test
    @DisplayName("a three-page PDF with one unreadable page is indexed with its page records")
    void ingest_threePages_indexed() throws Exception {
        final StubBackend fallback = StubBackend.returning("fallback", "", 0.0);

        final IngestedDocument doc = service(primary(), fallback).ingest(TestPdfs.withPages(PAGES), "ipc.pdf");

        assertEquals("doc1", doc.docId());
        assertEquals(3, doc.pageCount());
        assertTrue(doc.chunkCount() > 0);
        assertEquals(0, doc.skippedEmbeddings());
        assertThat(doc.pages()).extracting(PageRecord::getConfidence).containsExactly(0.9, 0.0, 0.85);
        assertThat(doc.pages()).extracting(PageRecord::getOutcome)
                .containsExactly(EPageOutcome.EXTRACTED, EPageOutcome.NO_TEXT, EPageOutcome.EXTRACTED);
        assertEquals(1, fallback.calls());

        assertEquals(doc.chunkCount(), sparse.size());
        assertEquals(doc.chunkCount(), dense.size());
        assertEquals("doc1_00000_p1-1", sparse.search(List.of("302"), 1).get(0).chunkId());

        verify(catalog).saveChunks(anyList());
        final ArgumentCaptor<DocumentEntity> stored = ArgumentCaptor.forClass(DocumentEntity.class);
        verify(catalog).update(stored.capture());
        verify(catalog, never()).delete(anyString());

        final DocumentEntity entity = stored.getValue();
        final String first = PAGES.get(0);
        final String third = PAGES.get(2);
        assertEquals(EDocumentStatus.INDEXED, entity.getStatus());
        assertEquals(first + " " + third, entity.getText());

        final PageRecord page1 = doc.pages().get(0);
        final PageRecord page2 = doc.pages().get(1);
        final PageRecord page3 = doc.pages().get(2);
        assertEquals(first, entity.getText().substring(page1.getStartOffset(), page1.getEndOffset()));
        assertEquals(page2.getStartOffset(), page2.getEndOffset());
        assertEquals(third, entity.getText().substring(page3.getStartOffset(), page3.getEndOffset()));
        assertThat(doc.pages()).extracting(PageRecord::getPageNumber).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("a chunk that cannot be embedded is kept out of the dense index but stays searchable by keyword")
    void ingest_embeddingFailure_sparseOnlyChunk() throws Exception {
        final HashingEmbeddingService embedder = new HashingEmbeddingService(Set.of("murder"));

        final IngestedDocument doc = service(embedder, primary()).ingest(TestPdfs.withPages(PAGES), "ipc.pdf");

        assertEquals(1, doc.skippedEmbeddings());
        assertEquals(doc.chunkCount(), sparse.size());
        assertEquals(doc.chunkCount() - 1, dense.size());
        assertThat(dense.size()).isLessThan(sparse.size());
        assertEquals("doc1_00001_p1-3", sparse.search(List.of("murder"), 1).get(0).chunkId());
        verify(catalog, never()).delete(anyString());
    }

    @Test
    @DisplayName("bytes that are not a PDF are rejected before anything is stored")
    void ingest_garbage_unreadable() throws Exception {
        final IngestionService service = service(primary());

        final IngestionException e = assertThrows(IngestionException.class,
                () -> service.ingest("not a pdf".getBytes(StandardCharsets.UTF_8), "junk.pdf"));
        assertEquals("unreadable_pdf", e.code());

        final IngestionException empty = assertThrows(IngestionException.class, () -> service.ingest(new byte[0], "empty.pdf"));
        assertEquals("unreadable_pdf", empty.code());
        verify(catalog, never()).save(anyString(), any(byte[].class), any());
    }

    @Test
    @DisplayName("a document where no page yields text is rejected")
    void ingest_noText_rejected() throws Exception {
        final IngestionException e = assertThrows(IngestionException.class,
                () -> service(StubBackend.failing("primary")).ingest(TestPdfs.withPages(PAGES), "scan.pdf"));

        assertEquals("no_text_extracted", e.code());
        verify(catalog, never()).save(anyString(), any(byte[].class), any());
    }

    @Test
    @DisplayName("a storage failure after saving removes the blob, catalog rows and index entries")
    void ingest_storageFailure_cleansUp() throws Exception {
        doThrow(new IllegalStateException("disk full")).when(catalog).update(any(DocumentEntity.class));

        final IngestionException e = assertThrows(IngestionException.class,
                () -> service(primary()).ingest(TestPdfs.withPages(PAGES), "ipc.pdf"));

        assertEquals("storage_failure", e.code());
        verify(catalog).delete("doc1");
        assertEquals(0, sparse.size());
        assertEquals(0, dense.size());
    }

    @Test
    @DisplayName("one bad file in a batch does not stop the others")
    void ingestAll_isolatesFailures() throws Exception {
        final Path good = Files.write(tmp.resolve("good.pdf"), TestPdfs.withPages(PAGES));
        final Path bad = Files.write(tmp.resolve("bad.pdf"), "garbage".getBytes(StandardCharsets.UTF_8));
        final Path missing = tmp.resolve("missing.pdf");

        final List<IngestionOutcome> outcomes = service(primary()).ingestAll(List.of(bad, good, missing));

        assertEquals(3, outcomes.size());
        assertFalse(outcomes.get(0).succeeded());
        assertEquals("unreadable_pdf", outcomes.get(0).failureCode());
        assertTrue(outcomes.get(1).succeeded());
        assertEquals("good.pdf", outcomes.get(1).filename());
        assertEquals("unreadable_pdf", outcomes.get(2).failureCode());
    }

    @Test
    @DisplayName("a queued job completes and is tracked by the registry")
    void submit_completes() throws Exception {
        final IngestionJob job = service(primary()).submit(TestPdfs.withPages(PAGES), "ipc.pdf");

        final IngestedDocument doc = job.completion().get(30, TimeUnit.SECONDS);

        assertEquals("doc1", doc.docId());
        assertEquals(EIngestionStatus.COMPLETED, job.getStatus());
        assertEquals(100, job.percent());
        assertThat(registry.listJobs()).containsExactly(job);
        assertEquals(1, registry.purgeFinished());
    }

    @Test
    @DisplayName("a job cancelled during extraction is never indexed")
    void submit_cancelled() throws Exception {
        final StubBackend cancelling = new StubBackend("primary", true, page -> {
            registry.listJobs().forEach(IngestionJob::cancel);
            return new ExtractedText(PAGES.get(0), 0.9);
        });

        final IngestionJob job = service(cancelling).submit(TestPdfs.withPages(PAGES), "ipc.pdf");

        final ExecutionException e = assertThrows(ExecutionException.class, () -> job.completion().get(30, TimeUnit.SECONDS));
        final IngestionException cause = assertInstanceOf(IngestionException.class, e.getCause());
        assertEquals("cancelled", cause.code());
        assertEquals(EIngestionStatus.CANCELLED, job.getStatus());
        assertEquals("cancelled", job.getFailureCode());
        verify(catalog, never()).save(anyString(), any(byte[].class), any());
        assertEquals(0, sparse.size());
    }
}
