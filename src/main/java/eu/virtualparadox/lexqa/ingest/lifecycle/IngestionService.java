package eu.virtualparadox.lexqa.ingest.lifecycle;

import eu.virtualparadox.lexqa.application.executor.IngestionExecutor;
import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.entity.PageRecord;
import eu.virtualparadox.lexqa.catalog.model.ChunkStatistics;
import eu.virtualparadox.lexqa.catalog.service.DocumentCatalogService;
import eu.virtualparadox.lexqa.ingest.assembler.DocumentTextAssembler;
import eu.virtualparadox.lexqa.ingest.chunker.Chunker;
import eu.virtualparadox.lexqa.ingest.extractor.ExtractionOrchestrator;
import eu.virtualparadox.lexqa.ingest.extractor.model.PageExtraction;
import eu.virtualparadox.lexqa.ingest.model.Chunk;
import eu.virtualparadox.lexqa.ingest.model.DocumentText;
import eu.virtualparadox.lexqa.ingest.model.PageSpan;
import eu.virtualparadox.lexqa.ingest.render.PageRenderer;
import eu.virtualparadox.lexqa.ingest.render.RenderException;
import eu.virtualparadox.lexqa.ingest.render.RenderedPdf;
import eu.virtualparadox.lexqa.rag.index.ChunkIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Manages the full lifecycle of documents:
 * <ul>
 *   <li>Extraction (render, backend chain, normalization, chunking)</li>
 *   <li>Catalog and chunk store (database) plus blob storage (filesystem)</li>
 *   <li>Dense and sparse indexes (Lucene)</li>
 * </ul>
 * Supports both synchronous and queued ingestion.
 * <p>
 * A document either ends {@link EDocumentStatus#INDEXED} or leaves nothing behind: any failure
 * after the blob was written removes the blob, the catalog rows and the index entries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private static final String ERROR_NOT_FOUND = "Document not found: ";

    private final PageRenderer pageRenderer;
    private final ExtractionOrchestrator orchestrator;
    private final DocumentTextAssembler assembler;
    private final Chunker chunker;
    private final ChunkIndexer chunkIndexer;
    private final DocumentCatalogService catalogService;
    private final IngestionExecutor ingestionExecutor;
    private final IngestionRegistry registry;

    /**
     * Ingests one PDF on the calling thread.
     *
     * @param pdfBytes PDF content
     * @param filename original file name, kept as the document title
     * @return summary of the indexed document
     * @throws IngestionException with reason {@code unreadable_pdf}, {@code no_text_extracted} or
     *                            {@code storage_failure}
     */
    public IngestedDocument ingest(final byte[] pdfBytes, final String filename) throws IngestionException {
        return process(pdfBytes, filename, new IngestionJob(0, filename));
    }

    /**
     * Queues one PDF on the ingestion executor.
     *
     * @return the job, registered in {@link IngestionRegistry}
     */
    public IngestionJob submit(final byte[] pdfBytes, final String filename) {
        final IngestionJob job = registry.createJob(filename);
        ingestionExecutor.execute(() -> {
            try {
                process(pdfBytes, filename, job);
            } catch (IngestionException e) {
                log.debug("Job {} ended with {}", job.getId(), e.code());
            }
        });
        return job;
    }

    /**
     * Ingests several PDF files one after another. A failing file does not stop the batch.
     *
     * @param files PDF files
     * @return one outcome per file, same order
     */
    public List<IngestionOutcome> ingestAll(final List<Path> files) {
        final List<IngestionOutcome> outcomes = new ArrayList<>(files.size());
        for (final Path file : files) {
            final String filename = file.getFileName() == null ? file.toString() : file.getFileName().toString();
            final byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException e) {
                log.error("Unable to read {}", file, e);
                outcomes.add(IngestionOutcome.failure(filename, IngestionException.Reason.UNREADABLE_PDF.code()));
                continue;
            }

            try {
                outcomes.add(IngestionOutcome.success(ingest(bytes, filename)));
            } catch (IngestionException e) {
                outcomes.add(IngestionOutcome.failure(filename, e.code()));
            }
        }
        final long ok = outcomes.stream().filter(IngestionOutcome::succeeded).count();
        log.info("Batch ingestion finished: {} of {} documents indexed", ok, outcomes.size());
        return outcomes;
    }

    /**
     * Deletes a document and all associated artifacts.
     */
    public void deleteDocument(final String id) throws IOException {
        if (catalogService.findById(id).isEmpty()) {
            throw new IllegalArgumentException(ERROR_NOT_FOUND + id);
        }

        chunkIndexer.removeDocument(id);
        catalogService.delete(id);

        log.info("Deleted document {} from catalog, blob storage, and indexes", id);
    }

    /**
     * List all documents in catalog.
     */
    public List<DocumentEntity> listAll() {
        return catalogService.listAll();
    }

    public Optional<DocumentEntity> findById(final String id) {
        return catalogService.findById(id);
    }

    public ChunkStatistics chunkStatistics(final String id) {
        return catalogService.chunkStatistics(id);
    }

    private IngestedDocument process(final byte[] pdfBytes,
                                     final String filename,
                                     final IngestionJob job) throws IngestionException {
        try {
            final IngestedDocument document = doProcess(pdfBytes, filename, job);
            job.complete(document);
            return document;
        } catch (IngestionException e) {
            log.error("Ingestion of {} failed: {} ({})", filename, e.code(), e.getMessage());
            job.fail(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Ingestion of {} failed unexpectedly", filename, e);
            final IngestionException wrapped = new IngestionException(IngestionException.Reason.STORAGE_FAILURE,
                    "Unexpected failure: " + e.getMessage(), e);
            job.fail(wrapped);
            throw wrapped;
        }
    }

    private IngestedDocument doProcess(final byte[] pdfBytes,
                                       final String filename,
                                       final IngestionJob job) throws IngestionException {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new IngestionException(IngestionException.Reason.UNREADABLE_PDF, "Empty input");
        }
        checkCancelled(job);

        // 1. Render + extract
        final List<PageExtraction> pages;
        try (RenderedPdf pdf = pageRenderer.open(pdfBytes, null)) {
            job.extractionStarted(pdf.pageCount());
            log.info("Extracting {} ({} pages)", filename, pdf.pageCount());
            pages = orchestrator.extract(pdf, job::isCancelled, page -> job.pageDone());
        } catch (RenderException e) {
            throw new IngestionException(IngestionException.Reason.UNREADABLE_PDF, e.getMessage(), e);
        }
        checkCancelled(job);

        // 2. Normalize + assemble
        final DocumentText text = assembler.assemble(pages);
        if (text.text().isBlank()) {
            throw new IngestionException(IngestionException.Reason.NO_TEXT_EXTRACTED,
                    "No page of " + filename + " produced text");
        }

        // 3. Store, chunk, index
        final DocumentEntity saved;
        try {
            saved = catalogService.save(filename, pdfBytes, EDocumentStatus.PROCESSING);
        } catch (IOException | RuntimeException e) {
            throw new IngestionException(IngestionException.Reason.STORAGE_FAILURE, "Unable to store " + filename, e);
        }

        try {
            job.indexingStarted();
            final List<Chunk> chunks = chunker.chunk(saved.getId(), text);
            catalogService.saveChunks(chunks);

            checkCancelled(job);
            final int skipped = chunkIndexer.add(chunks);
            chunkIndexer.commit();

            final List<PageRecord> pageRecords = pageRecords(pages, text);
            saved.setPageCount(pages.size());
            saved.setChunks(chunks.size());
            saved.setEmbedModel(chunkIndexer.modelVersion());
            saved.setText(text.text());
            saved.setPages(new ArrayList<>(pageRecords));
            saved.setLastIndexedAt(Instant.now());
            saved.setStatus(EDocumentStatus.INDEXED);
            catalogService.update(saved);

            log.info("Indexed {} as {}: {} pages, {} chunks, {} without embedding",
                    filename, saved.getId(), pages.size(), chunks.size(), skipped);
            return new IngestedDocument(saved.getId(), filename, pages.size(), chunks.size(), skipped, pageRecords);

        } catch (IngestionException e) {
            cleanup(saved.getId());
            throw e;
        } catch (IOException | RuntimeException e) {
            cleanup(saved.getId());
            throw new IngestionException(IngestionException.Reason.STORAGE_FAILURE,
                    "Indexing of " + filename + " failed: " + e.getMessage(), e);
        }
    }

    private static List<PageRecord> pageRecords(final List<PageExtraction> pages, final DocumentText text) {
        final List<PageRecord> records = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            final PageExtraction page = pages.get(i);
            final PageSpan span = text.pages().get(i);
            records.add(PageRecord.builder()
                    .pageNumber(span.pageNumber())
                    .startOffset(span.start())
                    .endOffset(span.end())
                    .confidence(page.confidence())
                    .backend(page.backend())
                    .outcome(page.outcome())
                    .build());
        }
        return records;
    }

    private static void checkCancelled(final IngestionJob job) throws IngestionException {
        if (job.isCancelled()) {
            throw new IngestionException(IngestionException.Reason.CANCELLED, "Job " + job.getId() + " was cancelled");
        }
    }

    private void cleanup(final String docId) {
        try {
            chunkIndexer.removeDocument(docId);
        } catch (IOException | RuntimeException e) {
            log.error("Cleanup of index entries failed for {}", docId, e);
        }
        try {
            catalogService.delete(docId);
        } catch (IOException | RuntimeException e) {
            log.error("Cleanup of catalog entry failed for {}", docId, e);
        }
        log.info("Removed partial state of {}", docId);
    }
}
