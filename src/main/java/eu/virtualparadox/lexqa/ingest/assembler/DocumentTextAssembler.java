package eu.virtualparadox.lexqa.ingest.assembler;

import eu.virtualparadox.lexqa.ingest.extractor.model.PageExtraction;
import eu.virtualparadox.lexqa.ingest.model.DocumentText;
import eu.virtualparadox.lexqa.ingest.model.PageSpan;
import eu.virtualparadox.lexqa.ingest.normalize.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Normalizes page texts and concatenates them in page order, recording the span of each page.
 * Pages without text keep an empty span at the position they would occupy.
 */
@Component
@RequiredArgsConstructor
public class DocumentTextAssembler {

    private final TextNormalizer normalizer;

    public DocumentText assemble(final List<PageExtraction> pages) {
        final List<PageExtraction> ordered = new ArrayList<>(pages);
        ordered.sort(Comparator.comparingInt(PageExtraction::pageIndex));

        final StringBuilder text = new StringBuilder();
        final List<PageSpan> spans = new ArrayList<>(ordered.size());

        for (final PageExtraction page : ordered) {
            final String normalized = normalizer.normalize(page.text());
            if (normalized.isEmpty()) {
                spans.add(new PageSpan(page.pageIndex() + 1, text.length(), text.length()));
                continue;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            final int start = text.length();
            text.append(normalized);
            spans.add(new PageSpan(page.pageIndex() + 1, start, text.length()));
        }
        return new DocumentText(text.toString(), spans);
    }
}
