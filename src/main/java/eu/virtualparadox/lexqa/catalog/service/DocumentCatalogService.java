package eu.virtualparadox.lexqa.catalog.service;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import eu.virtualparadox.lexqa.catalog.entity.ChunkEntity;
import eu.virtualparadox.lexqa.catalog.entity.DocumentEntity;
import eu.virtualparadox.lexqa.catalog.model.ChunkStatistics;
import eu.virtualparadox.lexqa.catalog.repo.ChunkRepository;
import eu.virtualparadox.lexqa.catalog.repo.DocumentRepository;
import eu.virtualparadox.lexqa.ingest.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collection;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Service layer responsible for managing the document catalog and the chunk store.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Persisting uploaded PDFs to the blob folder, atomically</li>
 *     <li>Maintaining document and chunk records in the relational catalog (H2)</li>
 *     <li>Providing access to catalog records for listing, lookup, statistics and deletion</li>
 * </ul>
 *
 * <p>The Lucene indexes are not touched here; the {@code docId} and {@code chunkId} link the
 * catalog to them.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentCatalogService {

    /** Temporary file prefix for atomic uploads. */
    private static final String TEMP_FILE_PREFIX = "up-";

    /** Temporary file suffix for atomic uploads. */
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    private static final String DEFAULT_EXTENSION = ".pdf";

    private static final int REBUILD_PAGE_SIZE = 256;

    private final DocumentRepository documentRepository;
    private final ChunkRepository chunkRepository;
    private final ApplicationConfig props;

    /**
     * Stores the PDF bytes under a fresh id and records the document.
     *
     * @param originalFilename file name given by the caller, kept as title
     * @param content          PDF bytes
     * @param status           initial status
     * @return the persisted {@link DocumentEntity}
     * @throws IOException if writing to the filesystem fails
     */
    @Transactional
    public DocumentEntity save(final String originalFilename,
                               final byte[] content,
                               final EDocumentStatus status) throws IOException {

        final String id = generateId();
        final Path blobsDir = props.getBlob();
        Files.createDirectories(blobsDir);

        final Path target = blobsDir.resolve(id + fileExtension(originalFilename));
        final Path temp = Files.createTempFile(blobsDir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }

        final DocumentEntity entity = DocumentEntity.builder()
                .id(id)
                .title(originalFilename == null || originalFilename.isBlank() ? id : originalFilename)
                .sizeBytes(content.length)
                .pageCount(0)
                .chunks(0)
                .addedAt(Instant.now())
                .blobPath(target.toString())
                .status(status)
                .build();

        return documentRepository.save(entity);
    }

    @Transactional
    public DocumentEntity update(final DocumentEntity document) {
        return documentRepository.save(document);
    }

    @Transactional
    public void updateStatus(final String id, final EDocumentStatus status) {
        documentRepository.updateStatus(id, status);
    }

    @Transactional
    public void saveChunks(final List<Chunk> chunks) {
        chunkRepository.saveAll(chunks.stream().map(ChunkEntity::of).toList());
    }

    /**
     * Lists all documents currently in the catalog, oldest first.
     */
    @Transactional(readOnly = true)
    public List<DocumentEntity> listAll() {
        return documentRepository.findAllByOrderByAddedAtAsc();
    }

    @Transactional(readOnly = true)
    public Optional<DocumentEntity> findById(final String id) {
        return documentRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Chunk> findChunks(final String docId) {
        return chunkRepository.findByDocIdOrderBySequence(docId).stream()
                .map(ChunkEntity::toChunk)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Chunk> findChunksByIds(final Collection<String> chunkIds) {
        if (chunkIds.isEmpty()) {
            return List.of();
        }
        return chunkRepository.findByChunkIdIn(chunkIds).stream()
                .map(ChunkEntity::toChunk)
                .toList();
    }

    /**
     * Streams the whole chunk store in (docId, sequence) order, one page of rows at a time.
     *
     * @param batchConsumer receives each batch
     * @return number of chunks visited
     */
    @Transactional(readOnly = true)
    public long forEachChunkBatch(final Consumer<List<Chunk>> batchConsumer) {
        final Sort order = Sort.by("docId").and(Sort.by("sequence"));
        long visited = 0;
        Page<ChunkEntity> page = chunkRepository.findAll(PageRequest.of(0, REBUILD_PAGE_SIZE, order));
        while (true) {
            final List<Chunk> batch = page.getContent().stream().map(ChunkEntity::toChunk).toList();
            if (!batch.isEmpty()) {
                batchConsumer.accept(batch);
                visited += batch.size();
            }
            if (!page.hasNext()) {
                return visited;
            }
            page = chunkRepository.findAll(page.nextPageable());
        }
    }

    @Transactional(readOnly = true)
    public ChunkStatistics chunkStatistics(final String docId) {
        final IntSummaryStatistics stats = chunkRepository.findByDocIdOrderBySequence(docId).stream()
                .mapToInt(ChunkEntity::getTokenCount)
                .summaryStatistics();
        if (stats.getCount() == 0) {
            return new ChunkStatistics(docId, 0, 0.0, 0, 0);
        }
        return new ChunkStatistics(docId, (int) stats.getCount(), stats.getAverage(), stats.getMin(), stats.getMax());
    }

    /**
     * Deletes a document, its chunks and its blob.
     *
     * <p>Note: index deletion is performed by the caller.</p>
     *
     * @param id the document identifier
     * @return {@code true} if the document existed
     * @throws IOException if deleting the blob file fails
     */
    @Transactional
    public boolean delete(final String id) throws IOException {
        final Optional<DocumentEntity> entityOpt = documentRepository.findById(id);
        chunkRepository.deleteByDocId(id);
        if (entityOpt.isEmpty()) {
            return false;
        }

        final DocumentEntity doc = entityOpt.get();
        if (doc.getBlobPath() != null) {
            Files.deleteIfExists(Path.of(doc.getBlobPath()));
        }
        documentRepository.deleteById(id);
        log.debug("Removed catalog entry, chunks and blob of {}", id);
        return true;
    }

    /**
     * UUID with the dashes removed.
     */
    private String generateId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * @return the lower-cased extension including the dot, {@code .pdf} when missing or unusual
     */
    private String fileExtension(final String name) {
        if (name == null) {
            return DEFAULT_EXTENSION;
        }
        final int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_EXTENSION;
        }
        final String ext = name.substring(dot).trim().toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,8}") ? ext : DEFAULT_EXTENSION;
    }
}
