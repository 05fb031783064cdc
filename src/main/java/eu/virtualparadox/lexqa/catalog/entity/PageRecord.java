package eu.virtualparadox.lexqa.catalog.entity;

import eu.virtualparadox.lexqa.ingest.extractor.model.EPageOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Extraction record of one page: where its text sits in the document text and which backend
 * produced it.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PageRecord {

    /** 1-based. */
    @Column(name = "page_number", nullable = false)
    private int pageNumber;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    @Column(nullable = false)
    private double confidence;

    @Column(length = 64)
    private String backend;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private EPageOutcome outcome;
}
