package eu.virtualparadox.lexqa.ingest.lifecycle;

import eu.virtualparadox.lexqa.catalog.entity.PageRecord;

import java.util.List;

/**
 * Summary of a successfully ingested document.
 *
 * @param docId             new document id
 * @param filename          name given at ingestion
 * @param pageCount         pages in the PDF
 * @param chunkCount        chunks stored and added to the sparse index
 * @param skippedEmbeddings chunks left out of the dense index because embedding failed
 * @param pages             extraction record of every page
 */
public record IngestedDocument(String docId,
                               String filename,
                               int pageCount,
                               int chunkCount,
                               int skippedEmbeddings,
                               List<PageRecord> pages) {

    public IngestedDocument {
        pages = List.copyOf(pages);
    }
}
