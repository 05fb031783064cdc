package eu.virtualparadox.lexqa.ingest.lifecycle;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle on one queued or running ingestion.
 * <p>
 * {@link #cancel()} is cooperative: pages not yet started are skipped and the document is never
 * indexed. A job that already reached the indexes finishes normally.
 */
public class IngestionJob {

    private final long id;
    private final String filename;
    private final Instant createdAt;
    private final AtomicInteger pagesDone = new AtomicInteger();
    private final CompletableFuture<IngestedDocument> completion = new CompletableFuture<>();

    private volatile EIngestionStatus status;
    private volatile int pageCount;
    private volatile boolean cancelled;
    private volatile String failureCode;

    public IngestionJob(final long id, final String filename) {
        this.id = id;
        this.filename = filename;
        this.status = EIngestionStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public String getFilename() { return filename; }
    public Instant getCreatedAt() { return createdAt; }
    public EIngestionStatus getStatus() { return status; }
    public int getPageCount() { return pageCount; }
    public int getPagesDone() { return pagesDone.get(); }

    /**
     * @return reason code of a failed or cancelled job, {@code null} otherwise
     */
    public String getFailureCode() { return failureCode; }

    /**
     * Completes with the ingested document, or exceptionally with {@link IngestionException}.
     */
    public CompletableFuture<IngestedDocument> completion() {
        return completion;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return 0-100 over the pages of this document; 100 once indexing starts
     */
    public int percent() {
        if (status == EIngestionStatus.INDEXING || status == EIngestionStatus.COMPLETED) {
            return 100;
        }
        final int total = pageCount;
        return total == 0 ? 0 : (int) ((pagesDone.get() * 100L) / total);
    }

    void extractionStarted(final int pages) {
        this.pageCount = pages;
        this.status = EIngestionStatus.EXTRACTING;
    }

    void pageDone() {
        pagesDone.incrementAndGet();
    }

    void indexingStarted() {
        this.status = EIngestionStatus.INDEXING;
    }

    void complete(final IngestedDocument document) {
        this.status = EIngestionStatus.COMPLETED;
        completion.complete(document);
    }

    void fail(final IngestionException e) {
        this.failureCode = e.code();
        this.status = e.getReason() == IngestionException.Reason.CANCELLED
                ? EIngestionStatus.CANCELLED
                : EIngestionStatus.FAILED;
        completion.completeExceptionally(e);
    }
}
