package eu.virtualparadox.lexqa.catalog.entity;

import eu.virtualparadox.lexqa.catalog.EDocumentStatus;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Lob;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "documents")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    /** Original file name. */
    @Column(length = 512, nullable = false)
    private String title;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "page_count", nullable = false)
    private int pageCount;

    @Column(nullable = false)
    private int chunks;

    @Column(name = "embed_model", length = 128, nullable = false)
    private String embedModel;

    @Column(name = "added_at", nullable = false)
    private Instant addedAt;

    @Column(name = "last_indexed_at")
    private Instant lastIndexedAt;

    @Column(name = "blob_path", length = 1024, nullable = false)
    private String blobPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private EDocumentStatus status;

    /** Normalized document text; chunk and page offsets point into it. */
    @Lob
    @Column(name = "text")
    private String text;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "document_pages", joinColumns = @JoinColumn(name = "document_id"))
    @OrderBy("pageNumber")
    @Builder.Default
    private List<PageRecord> pages = new ArrayList<>();

    @PrePersist
    void prePersist() {
        if (addedAt == null) {
            addedAt = Instant.now();
        }

        if (embedModel == null) {
            embedModel = "unknown";
        }

        if (status == null) {
            status = EDocumentStatus.QUEUED;
        }
    }
}
