package eu.virtualparadox.lexqa.query.model;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * One cited document with the merged pages its passages come from.
 */
public record SourceCitation(String docId, String title, List<PageRange> pages) {

    public SourceCitation {
        pages = List.copyOf(pages);
    }

    /**
     * @return e.g. {@code "ipc.pdf p. 3-4, 9"}
     */
    public String asString() {
        if (pages.isEmpty()) {
            return title;
        }
        return title + " p. " + StringUtils.join(pages.stream().map(PageRange::asString).toList(), ", ");
    }
}
