package eu.virtualparadox.lexqa.ingest.normalize;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes extracted page text and user queries into one canonical form so that the same
 * legal term yields the same tokens whatever its source.
 * <p>
 * Devanagari code points pass through untouched; only invisible characters and whitespace
 * variants are rewritten. The function is pure and idempotent.
 */
@Component
public class TextNormalizer {

    /** Every whitespace flavour, typographic spaces and line/paragraph separators included. */
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}\\u0085]+");

    /** Zero-width characters, joiners, BOM, soft hyphen and the remaining format/control characters. */
    private static final Pattern INVISIBLE = Pattern.compile("[\\p{Cf}\\p{Cc}]");

    private static final Pattern SPACES = Pattern.compile(" {2,}");

    /**
     * Normalizes the given text.
     *
     * @param input raw text, may be {@code null}
     * @return normalized text, never {@code null}
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }

        // whitespace first, so that line breaks survive the control-character sweep as spaces
        String text = WHITESPACE.matcher(input).replaceAll(" ");
        text = INVISIBLE.matcher(text).replaceAll("");
        text = Normalizer.normalize(text, Normalizer.Form.NFC);
        text = SPACES.matcher(text).replaceAll(" ");
        return text.trim();
    }

    /**
     * Splits a normalized query into its Devanagari and non-Devanagari words.
     * Words that mix both scripts are assigned to the Devanagari side.
     *
     * @param normalized normalized text
     * @return the two script-specific parts, each space-joined
     */
    public MixedScriptText splitMixedScript(final String normalized) {
        final String text = normalize(normalized);
        if (text.isEmpty()) {
            return new MixedScriptText("", "");
        }

        final List<String> devanagari = new ArrayList<>();
        final List<String> other = new ArrayList<>();
        for (final String word : text.split(" ")) {
            if (containsDevanagari(word)) {
                devanagari.add(word);
            } else {
                other.add(word);
            }
        }
        return new MixedScriptText(String.join(" ", devanagari), String.join(" ", other));
    }

    /**
     * @param text any text
     * @return {@code true} if at least one code point lies in a Devanagari block
     */
    public boolean containsDevanagari(final String text) {
        if (text == null) {
            return false;
        }
        return text.codePoints().anyMatch(TextNormalizer::isDevanagari);
    }

    static boolean isDevanagari(final int codePoint) {
        return (codePoint >= 0x0900 && codePoint <= 0x097F)
                || (codePoint >= 0xA8E0 && codePoint <= 0xA8FF);
    }
}
