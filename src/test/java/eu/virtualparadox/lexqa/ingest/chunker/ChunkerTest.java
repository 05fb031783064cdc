package eu.virtualparadox.lexqa.ingest.chunker;

import eu.virtualparadox.lexqa.ingest.model.Chunk;
import eu.virtualparadox.lexqa.ingest.model.DocumentText;
import eu.virtualparadox.lexqa.ingest.model.PageSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkerTest {

    private static final int WINDOW = 10;
    private static final int OVERLAP = 3;

    private final Chunker chunker = new Chunker(WINDOW, OVERLAP);

    // ---------- Helpers ----------

    /**
     * "w0 w1 ... w(n-1)" on a single page.
     */
    private static DocumentText singlePage(final int tokens) {
        final String text = IntStream.range(0, tokens).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));
        return new DocumentText(text, List.of(new PageSpan(1, 0, text.length())));
    }

    private static List<String> words(final Chunk chunk) {
        return Arrays.asList(chunk.text().split(" "));
    }

    // ---------- Tests ----------

    @Test
    @DisplayName("windows advance by window - overlap tokens and the last one is shorter")
    void chunk_25tokens_fourWindows() {
        final List<Chunk> chunks = chunker.chunk("doc", singlePage(25));

        assertEquals(4, chunks.size());
        assertEquals(List.of(10, 10, 10, 4), chunks.stream().map(Chunk::tokenCount).toList());
        assertEquals("w21", words(chunks.get(3)).get(0));
        assertEquals("w24", words(chunks.get(3)).get(3));
    }

    @Test
    @DisplayName("consecutive chunks share exactly the overlap tokens")
    void chunk_consecutive_shareOverlap() {
        final List<Chunk> chunks = chunker.chunk("doc", singlePage(40));

        for (int i = 0; i + 1 < chunks.size(); i++) {
            final List<String> current = words(chunks.get(i));
            final List<String> next = words(chunks.get(i + 1));
            assertEquals(current.subList(current.size() - OVERLAP, current.size()), next.subList(0, OVERLAP),
                    "overlap between chunk " + i + " and " + (i + 1));
        }
    }

    @Test
    @DisplayName("chunk spans cover the full text without gaps")
    void chunk_spans_coverText() {
        final DocumentText document = singlePage(57);
        final List<Chunk> chunks = chunker.chunk("doc", document);

        assertEquals(0, chunks.get(0).start());
        assertEquals(document.text().length(), chunks.get(chunks.size() - 1).end());
        for (int i = 0; i + 1 < chunks.size(); i++) {
            assertTrue(chunks.get(i + 1).start() <= chunks.get(i).end(), "gap after chunk " + i);
            assertTrue(chunks.get(i + 1).start() > chunks.get(i).start(), "chunks must advance");
        }
    }

    @Test
    @DisplayName("chunking the same input twice yields identical chunks")
    void chunk_twice_identical() {
        final DocumentText document = singlePage(123);

        assertEquals(chunker.chunk("doc", document), chunker.chunk("doc", document));
    }

    @Test
    @DisplayName("a text shorter than a window yields exactly one chunk")
    void chunk_shortText_singleChunk() {
        final List<Chunk> chunks = chunker.chunk("abc", singlePage(4));

        assertEquals(1, chunks.size());
        assertEquals("abc_00000_p1-1", chunks.get(0).chunkId());
        assertEquals("w0 w1 w2 w3", chunks.get(0).text());
        assertEquals(4, chunks.get(0).tokenCount());
    }

    @Test
    @DisplayName("page ranges and ids follow the page spans")
    void chunk_acrossPages_pageRange() {
        // page 1 "a b c", page 2 empty, page 3 "d e f"
        final DocumentText document = new DocumentText("a b c d e f",
                List.of(new PageSpan(1, 0, 5), new PageSpan(2, 5, 5), new PageSpan(3, 6, 11)));

        final List<Chunk> chunks = new Chunker(4, 1).chunk("doc", document);

        assertEquals(2, chunks.size());
        assertEquals("doc_00000_p1-3", chunks.get(0).chunkId());
        assertEquals(1, chunks.get(0).pageStart());
        assertEquals(3, chunks.get(0).pageEnd());
        assertEquals("doc_00001_p3-3", chunks.get(1).chunkId());
        assertEquals("d e f", chunks.get(1).text());
    }

    @Test
    @DisplayName("blank text yields no chunk")
    void chunk_blankText_empty() {
        assertTrue(chunker.chunk("doc", new DocumentText("", List.of())).isEmpty());
    }

    @Test
    @DisplayName("invalid window settings are rejected")
    void constructor_invalidSettings_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(10, 10));
        assertThrows(IllegalArgumentException.class, () -> new Chunker(10, -1));
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk(" ", singlePage(3)));
    }
}
