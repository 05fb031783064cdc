package eu.virtualparadox.lexqa.ingest.normalize;

/**
 * A text split by script.
 *
 * @param devanagari words written (at least partly) in Devanagari
 * @param other      all remaining words, typically Latin
 */
public record MixedScriptText(String devanagari, String other) {

    public boolean isMixed() {
        return !devanagari.isEmpty() && !other.isEmpty();
    }
}
