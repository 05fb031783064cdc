package eu.virtualparadox.lexqa.rag.index;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.ingest.model.Chunk;
import eu.virtualparadox.lexqa.ingest.normalize.LegalTokenizer;
import eu.virtualparadox.lexqa.rag.embed.EmbeddingException;
import eu.virtualparadox.lexqa.rag.embed.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Feeds chunks to both indexes.
 * <p>
 * Chunks are embedded in batches; a failed batch is retried chunk by chunk and a chunk that
 * still fails is left out of the dense index only. Every chunk goes to the sparse index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChunkIndexer {

    private final EmbeddingService embeddingService;
    private final DenseIndex denseIndex;
    private final SparseIndex sparseIndex;
    private final LegalTokenizer tokenizer;
    private final ApplicationConfig config;

    /**
     * Adds the chunks without committing.
     *
     * @return number of chunks that could not be embedded
     * @throws IOException if an index write fails
     */
    public int add(final List<Chunk> chunks) throws IOException {
        final int batchSize = Math.max(1, config.getEmbedding().getBatchSize());
        int skipped = 0;

        for (int from = 0; from < chunks.size(); from += batchSize) {
            final List<Chunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            final List<float[]> vectors = embed(batch);
            for (int i = 0; i < batch.size(); i++) {
                final Chunk chunk = batch.get(i);
                final float[] vector = vectors.get(i);
                if (vector == null) {
                    skipped++;
                } else {
                    denseIndex.add(chunk.chunkId(), chunk.docId(), vector);
                }
                sparseIndex.add(chunk.chunkId(), chunk.docId(), tokenizer.tokenize(chunk.text()));
            }
        }
        return skipped;
    }

    public void commit() throws IOException {
        denseIndex.commit();
        sparseIndex.commit();
    }

    /**
     * Removes and commits every chunk of a document from both indexes.
     */
    public void removeDocument(final String docId) throws IOException {
        denseIndex.deleteByDocId(docId);
        sparseIndex.deleteByDocId(docId);
    }

    /**
     * Empties both indexes.
     */
    public void clear() throws IOException {
        denseIndex.clear();
        sparseIndex.clear();
    }

    public String modelVersion() {
        return embeddingService.modelVersion();
    }

    /**
     * @return one vector per chunk, {@code null} where embedding failed
     */
    private List<float[]> embed(final List<Chunk> batch) {
        final List<String> texts = batch.stream().map(Chunk::text).toList();
        try {
            final List<float[]> vectors = embeddingService.embedBatch(texts);
            if (vectors.size() == batch.size()) {
                return vectors;
            }
            log.warn("Embedding batch returned {} vectors for {} chunks, retrying one by one", vectors.size(), batch.size());
        } catch (EmbeddingException e) {
            log.warn("Embedding batch of {} chunks failed, retrying one by one: {}", batch.size(), e.getMessage());
        }

        final List<float[]> vectors = new ArrayList<>(batch.size());
        for (final Chunk chunk : batch) {
            try {
                vectors.add(embeddingService.embed(chunk.text()));
            } catch (EmbeddingException e) {
                log.warn("Chunk {} left out of the dense index: {}", chunk.chunkId(), e.getMessage());
                vectors.add(null);
            }
        }
        return vectors;
    }
}
