package eu.virtualparadox.lexqa.ingest.extractor.backend;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextQualityScorerTest {

    private final TextQualityScorer scorer = new TextQualityScorer();

    @Test
    @DisplayName("blank text scores zero")
    void score_blank() {
        assertEquals(0.0, scorer.score(null));
        assertEquals(0.0, scorer.score("   \n"));
    }

    @Test
    @DisplayName("a full legal sentence outscores symbol noise")
    void score_prose_beatsNoise() {
        final double prose = scorer.score("Whoever commits murder shall be punished with death, or imprisonment for life, "
                + "and shall also be liable to fine.");
        final double noise = scorer.score("|| -- ~~ ## !!");

        assertTrue(prose > noise);
        assertTrue(prose > 0.8 && prose <= 1.0);
    }

    @Test
    @DisplayName("Devanagari signs count as letters")
    void score_devanagari() {
        final double score = scorer.score("हत्या के लिए दंड");

        assertTrue(score > 0.5, "score " + score);
    }
}
