package eu.virtualparadox.lexqa.ingest.extractor.backend;

/**
 * Text produced by a backend for one page image.
 *
 * @param text       extracted text, never {@code null}
 * @param confidence backend confidence in {@code [0, 1]}
 */
public record ExtractedText(String text, double confidence) {

    public ExtractedText {
        text = text == null ? "" : text;
        if (Double.isNaN(confidence) || confidence < 0.0) {
            confidence = 0.0;
        } else if (confidence > 1.0) {
            confidence = 1.0;
        }
    }

    public static ExtractedText empty() {
        return new ExtractedText("", 0.0);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
