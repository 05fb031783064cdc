package eu.virtualparadox.lexqa.ingest.extractor.backend;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Heuristic plausibility score of extracted text in {@code [0, 1]}.
 * <p>
 * Weighted blend of length (saturating at 100 characters), character diversity (saturating at
 * 20 distinct characters) and the share of letters and digits, Devanagari included.
 */
@Component
public class TextQualityScorer {

    private static final double LENGTH_WEIGHT = 0.3;
    private static final double DIVERSITY_WEIGHT = 0.3;
    private static final double ALNUM_WEIGHT = 0.4;

    public double score(final String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        final String trimmed = text.strip();

        final double length = Math.min(1.0, trimmed.length() / 100.0);

        final Set<Integer> distinct = new HashSet<>();
        trimmed.codePoints().forEach(distinct::add);
        final double diversity = Math.min(1.0, distinct.size() / 20.0);

        final long alnum = trimmed.codePoints()
                .filter(cp -> Character.isLetterOrDigit(cp) || isDevanagari(cp))
                .count();
        final double alnumRatio = (double) alnum / trimmed.codePointCount(0, trimmed.length());

        return LENGTH_WEIGHT * length + DIVERSITY_WEIGHT * diversity + ALNUM_WEIGHT * alnumRatio;
    }

    private static boolean isDevanagari(final int cp) {
        return cp >= 0x0900 && cp <= 0x097F;
    }
}
