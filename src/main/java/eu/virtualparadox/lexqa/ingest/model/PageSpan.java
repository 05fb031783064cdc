package eu.virtualparadox.lexqa.ingest.model;

/**
 * Character range of one page inside the normalized document text.
 *
 * @param pageNumber one-based page number
 * @param start      inclusive start offset
 * @param end        exclusive end offset; equal to {@code start} for a page without text
 */
public record PageSpan(int pageNumber, int start, int end) {

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(final int offset) {
        return offset >= start && offset < end;
    }
}
