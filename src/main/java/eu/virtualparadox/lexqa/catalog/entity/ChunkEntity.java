package eu.virtualparadox.lexqa.catalog.entity;

import eu.virtualparadox.lexqa.ingest.model.Chunk;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored chunk. The chunk store is the source both indexes are rebuilt from.
 */
@Entity
@Table(name = "chunks", indexes = @Index(name = "idx_chunks_doc", columnList = "doc_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChunkEntity {

    @Id
    @Column(name = "chunk_id", length = 128, nullable = false)
    private String chunkId;

    @Column(name = "doc_id", length = 64, nullable = false)
    private String docId;

    @Column(nullable = false)
    private int sequence;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    @Column(name = "page_start", nullable = false)
    private int pageStart;

    @Column(name = "page_end", nullable = false)
    private int pageEnd;

    @Column(name = "token_count", nullable = false)
    private int tokenCount;

    @Lob
    @Column(nullable = false)
    private String text;

    public static ChunkEntity of(final Chunk chunk) {
        return ChunkEntity.builder()
                .chunkId(chunk.chunkId())
                .docId(chunk.docId())
                .sequence(chunk.sequence())
                .startOffset(chunk.start())
                .endOffset(chunk.end())
                .pageStart(chunk.pageStart())
                .pageEnd(chunk.pageEnd())
                .tokenCount(chunk.tokenCount())
                .text(chunk.text())
                .build();
    }

    public Chunk toChunk() {
        return new Chunk(docId, chunkId, sequence, startOffset, endOffset, pageStart, pageEnd, text, tokenCount);
    }
}
