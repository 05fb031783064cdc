package eu.virtualparadox.lexqa.ingest.chunker;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import eu.virtualparadox.lexqa.ingest.model.Chunk;
import eu.virtualparadox.lexqa.ingest.model.DocumentText;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Splits normalized document text into overlapping windows of whitespace tokens.
 *
 * <h2>Windows</h2>
 * A window holds {@code windowTokens} tokens and the next one starts
 * {@code windowTokens - overlapTokens} tokens later, so consecutive chunks share exactly
 * {@code overlapTokens} tokens. The last window ends at the last token and may be shorter; a
 * text with fewer tokens than a window yields a single chunk.
 *
 * <h2>Spans</h2>
 * Every chunk records a character span {@code [start, end)} in the document text. The first
 * span starts at offset 0, every non-final span ends where the first token after its window
 * starts, and the final span ends at the end of the text. The spans therefore cover the whole
 * text without gaps.
 *
 * <h2>Identifiers</h2>
 * The chunk id is {@code <docId>_<sequence, 5 digits>_p<firstPage>-<lastPage>}. It depends only
 * on the document id, the text and the page spans, so chunking the same input twice yields the
 * same ids and boundaries.
 */
@Component
public class Chunker {

    private final int windowTokens;
    private final int overlapTokens;

    @Autowired
    public Chunker(final ApplicationConfig config) {
        this(config.getChunking().getWindowTokens(), config.getChunking().getOverlapTokens());
    }

    public Chunker(final int windowTokens, final int overlapTokens) {
        if (windowTokens <= 0) {
            throw new IllegalArgumentException("windowTokens must be > 0");
        }
        if (overlapTokens < 0 || overlapTokens >= windowTokens) {
            throw new IllegalArgumentException("overlapTokens must be within [0, windowTokens)");
        }
        this.windowTokens = windowTokens;
        this.overlapTokens = overlapTokens;
    }

    /**
     * Chunks one document.
     *
     * @param docId    document id, used as chunk id prefix
     * @param document normalized text and page spans
     * @return chunks in document order; empty if the text holds no token
     * @throws IllegalArgumentException if {@code docId} is blank
     */
    public List<Chunk> chunk(final String docId, final DocumentText document) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId must not be blank");
        }
        Objects.requireNonNull(document, "document must not be null");

        final String text = document.text();
        final TokenOffsets tokens = TokenOffsets.of(text);
        final int n = tokens.count();
        if (n == 0) {
            return List.of();
        }

        final int step = windowTokens - overlapTokens;
        final List<Chunk> chunks = new ArrayList<>();

        int first = 0;
        int sequence = 0;
        while (true) {
            final int last = Math.min(first + windowTokens, n) - 1;
            final boolean finalWindow = last == n - 1;

            final int start = sequence == 0 ? 0 : tokens.start(first);
            final int end = finalWindow ? text.length() : tokens.start(last + 1);

            final int pageStart = document.pageAt(tokens.start(first));
            final int pageEnd = document.pageAt(tokens.end(last) - 1);

            chunks.add(new Chunk(
                    docId,
                    chunkId(docId, sequence, pageStart, pageEnd),
                    sequence,
                    start,
                    end,
                    pageStart,
                    pageEnd,
                    text.substring(start, end).strip(),
                    last - first + 1));

            if (finalWindow) {
                break;
            }
            first += step;
            sequence++;
        }
        return chunks;
    }

    private static String chunkId(final String docId, final int sequence, final int pageStart, final int pageEnd) {
        return String.format("%s_%05d_p%d-%d", docId, sequence, pageStart, pageEnd);
    }

    /**
     * Start and end offsets of the whitespace-separated tokens of a text.
     */
    private static final class TokenOffsets {

        private final int[] starts;
        private final int[] ends;
        private final int count;

        private TokenOffsets(final int[] starts, final int[] ends, final int count) {
            this.starts = starts;
            this.ends = ends;
            this.count = count;
        }

        static TokenOffsets of(final String text) {
            int[] starts = new int[16];
            int[] ends = new int[16];
            int count = 0;

            int i = 0;
            final int len = text.length();
            while (i < len) {
                while (i < len && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (i == len) {
                    break;
                }
                final int tokenStart = i;
                while (i < len && !Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                    ends = Arrays.copyOf(ends, count * 2);
                }
                starts[count] = tokenStart;
                ends[count] = i;
                count++;
            }
            return new TokenOffsets(starts, ends, count);
        }

        int count() {
            return count;
        }

        int start(final int token) {
            return starts[token];
        }

        int end(final int token) {
            return ends[token];
        }
    }
}
