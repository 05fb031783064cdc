package eu.virtualparadox.lexqa.ingest.normalize;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LegalTokenizerTest {

    private final LegalTokenizer tokenizer = new LegalTokenizer();

    @Test
    @DisplayName("statute references split on punctuation and keep their numbers")
    void tokenize_sectionReference_keepsNumbers() {
        assertThat(tokenizer.tokenize("Section 302(1)")).containsExactly("section", "302", "1");
    }

    @Test
    @DisplayName("tokens are lower-cased and never stemmed")
    void tokenize_englishText_lowerCasedNotStemmed() {
        assertThat(tokenizer.tokenize("Punishments for Murder, under I.P.C."))
                .containsExactly("punishments", "for", "murder", "under", "i", "p", "c");
    }

    @Test
    @DisplayName("Devanagari words keep their vowel signs and viramas")
    void tokenize_devanagari_marksStayAttached() {
        final List<String> tokens = tokenizer.tokenize("भारतीय दंड संहिता, धारा ३०२।");

        assertThat(tokens).containsExactly("भारतीय", "दंड", "संहिता", "धारा", "३०२");
    }

    @Test
    @DisplayName("a run switching between Devanagari and Latin is split at the switch")
    void tokenize_scriptSwitch_splits() {
        assertThat(tokenizer.tokenize("IPCधारा")).containsExactly("ipc", "धारा");
    }

    @Test
    @DisplayName("empty and punctuation-only input yields no token")
    void tokenize_noTokenCharacters_empty() {
        assertThat(tokenizer.tokenize("")).isEmpty();
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.tokenize("-- , ; ()")).isEmpty();
    }
}
