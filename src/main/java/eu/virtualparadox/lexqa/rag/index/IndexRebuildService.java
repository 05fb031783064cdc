package eu.virtualparadox.lexqa.rag.index;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.catalog.service.DocumentCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Re-derives both indexes from the chunk store.
 * <p>
 * Runs once after startup when {@code lexqa.index-settings.rebuild-on-startup} is set, which is
 * the way out of an {@link IndexIntegrityException} or an embedding model change.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexRebuildService {

    private final DocumentCatalogService catalogService;
    private final ChunkIndexer chunkIndexer;
    private final ApplicationConfig config;

    @EventListener(ApplicationReadyEvent.class)
    public void rebuildIfRequested() throws IOException {
        if (config.getIndexSettings().isRebuildOnStartup()) {
            rebuild();
        }
    }

    /**
     * Clears both indexes and adds every stored chunk again.
     *
     * @return number of chunks re-indexed
     * @throws IOException if an index write fails
     */
    public synchronized long rebuild() throws IOException {
        log.info("Rebuilding dense and sparse indexes from the chunk store");
        chunkIndexer.clear();

        final AtomicInteger skipped = new AtomicInteger();
        final long chunks;
        try {
            chunks = catalogService.forEachChunkBatch(batch -> {
                try {
                    skipped.addAndGet(chunkIndexer.add(batch));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        chunkIndexer.commit();

        log.info("Rebuilt indexes from {} chunks, {} without embedding", chunks, skipped.get());
        return chunks;
    }
}
