package eu.virtualparadox.lexqa.ingest.lifecycle;

/**
 * Progress status of the ingestion queue.
 *
 * @param totalPercent    progress over the pages of all unfinished jobs (0-100)
 * @param documentPercent progress of the document being extracted (0-100)
 */
public record ProgressStatus(int totalPercent, int documentPercent) {

}
