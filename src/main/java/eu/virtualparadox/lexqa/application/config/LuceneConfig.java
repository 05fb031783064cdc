package eu.virtualparadox.lexqa.application.config;

import eu.virtualparadox.lexqa.rag.embed.EmbeddingService;
import eu.virtualparadox.lexqa.rag.index.LuceneDenseIndex;
import eu.virtualparadox.lexqa.rag.index.LuceneSparseIndex;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the dense and sparse Lucene indexes under {@code lexqa.index} and closes them on shutdown.
 * <p>With {@code lexqa.index-settings.rebuild-on-startup} both indexes are opened empty; the
 * rebuild service then refills them from the chunk store.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private LuceneDenseIndex denseIndex;
    private LuceneSparseIndex sparseIndex;

    /**
     * Provides the dense index bound to the configured embedding model version.
     *
     * @param props            application properties
     * @param embeddingService embedder whose version the index must match
     * @return opened {@link LuceneDenseIndex}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public LuceneDenseIndex denseIndex(final ApplicationConfig props,
                                       final EmbeddingService embeddingService) throws IOException {
        final Path path = props.getIndex().resolve("dense");
        Files.createDirectories(path);
        this.denseIndex = new LuceneDenseIndex(FSDirectory.open(path),
                embeddingService.modelVersion(),
                props.getIndexSettings().isRebuildOnStartup());
        return this.denseIndex;
    }

    /**
     * Provides the BM25 index.
     *
     * @param props application properties
     * @return opened {@link LuceneSparseIndex}
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public LuceneSparseIndex sparseIndex(final ApplicationConfig props) throws IOException {
        final Path path = props.getIndex().resolve("sparse");
        Files.createDirectories(path);
        this.sparseIndex = new LuceneSparseIndex(FSDirectory.open(path), props.getIndexSettings().isRebuildOnStartup());
        return this.sparseIndex;
    }

    /**
     * Ensures Lucene resources are closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        if (denseIndex != null) {
            denseIndex.close();
        }
        if (sparseIndex != null) {
            sparseIndex.close();
        }
        log.info("Lucene indexes closed");
    }
}
