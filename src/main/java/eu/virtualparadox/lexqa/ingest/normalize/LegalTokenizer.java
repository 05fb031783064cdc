package eu.virtualparadox.lexqa.ingest.normalize;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Script-aware tokenizer for the sparse index.
 * <p>
 * A token is a maximal run of letters, digits and combining marks that does not cross a
 * boundary between Devanagari and other scripts. Tokens are lower-cased with the root locale;
 * nothing is stemmed, so statute numbers and terms of art stay intact ("Section 302(1)" gives
 * {@code section}, {@code 302}, {@code 1}).
 */
@Component
public class LegalTokenizer {

    /**
     * @param normalized text already passed through {@link TextNormalizer}
     * @return tokens in text order, possibly empty
     */
    public List<String> tokenize(final String normalized) {
        final List<String> tokens = new ArrayList<>();
        if (normalized == null || normalized.isEmpty()) {
            return tokens;
        }

        final StringBuilder current = new StringBuilder();
        boolean currentDevanagari = false;

        int i = 0;
        while (i < normalized.length()) {
            final int cp = normalized.codePointAt(i);
            i += Character.charCount(cp);

            if (!isTokenPart(cp)) {
                flush(current, tokens);
                continue;
            }

            // a combining mark always belongs to the token it follows
            final boolean mark = isMark(cp);
            final boolean devanagari = TextNormalizer.isDevanagari(cp);
            if (current.length() > 0 && !mark && devanagari != currentDevanagari) {
                flush(current, tokens);
            }
            if (current.length() == 0 && mark) {
                // a stray mark cannot start a token
                continue;
            }
            if (current.length() == 0) {
                currentDevanagari = devanagari;
            }
            current.appendCodePoint(cp);
        }
        flush(current, tokens);
        return tokens;
    }

    private static void flush(final StringBuilder current, final List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString().toLowerCase(Locale.ROOT));
            current.setLength(0);
        }
    }

    private static boolean isTokenPart(final int cp) {
        return Character.isLetterOrDigit(cp) || isMark(cp);
    }

    private static boolean isMark(final int cp) {
        final int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK;
    }
}
