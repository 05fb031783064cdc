package eu.virtualparadox.lexqa.query.citation;

import eu.virtualparadox.lexqa.query.model.PageRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges overlapping or adjacent page ranges.
 *
 * <h2>Example</h2>
 * <pre>
 *   [1..3], [2..5], [7..7], [8..10]  →  [1..5], [7..10]
 * </pre>
 */
@Component
public class PageRangeMerger {

    /**
     * @param ranges ranges in any order; may be {@code null}
     * @return sorted, disjoint, non-adjacent ranges; never {@code null}
     */
    public List<PageRange> merge(final List<PageRange> ranges) {
        final List<PageRange> merged = new ArrayList<>();
        if (ranges == null || ranges.isEmpty()) {
            return merged;
        }

        final List<PageRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt(PageRange::fromPage).thenComparingInt(PageRange::toPage));

        int from = sorted.get(0).fromPage();
        int to = sorted.get(0).toPage();
        for (final PageRange range : sorted.subList(1, sorted.size())) {
            if (range.fromPage() <= to + 1) {
                to = Math.max(to, range.toPage());
            } else {
                merged.add(new PageRange(from, to));
                from = range.fromPage();
                to = range.toPage();
            }
        }
        merged.add(new PageRange(from, to));
        return merged;
    }
}
