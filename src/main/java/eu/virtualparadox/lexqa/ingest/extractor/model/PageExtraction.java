package eu.virtualparadox.lexqa.ingest.extractor.model;

/**
 * Outcome of extracting one page.
 *
 * @param pageIndex  zero-based page index
 * @param text       extracted text, empty unless {@code outcome} is {@link EPageOutcome#EXTRACTED}
 * @param confidence confidence of the kept result, 0 when nothing was kept
 * @param backend    name of the backend whose result was kept, {@code null} when none
 * @param outcome    how the page ended
 */
public record PageExtraction(int pageIndex, String text, double confidence, String backend, EPageOutcome outcome) {

    public static PageExtraction extracted(final int pageIndex, final String text, final double confidence, final String backend) {
        return new PageExtraction(pageIndex, text, confidence, backend, EPageOutcome.EXTRACTED);
    }

    public static PageExtraction failed(final int pageIndex, final EPageOutcome outcome) {
        return new PageExtraction(pageIndex, "", 0.0, null, outcome);
    }

    public boolean hasText() {
        return outcome == EPageOutcome.EXTRACTED && !text.isBlank();
    }
}
