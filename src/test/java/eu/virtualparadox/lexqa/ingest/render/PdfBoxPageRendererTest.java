package eu.virtualparadox.lexqa.ingest.render;

import eu.virtualparadox.lexqa.testsupport.TestPdfs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfBoxPageRendererTest {

    private final PdfBoxPageRenderer renderer = new PdfBoxPageRenderer();

    @Test
    @DisplayName("pages render at the requested resolution")
    void render_a6At72Dpi_pointSize() throws RenderException {
        final byte[] pdf = TestPdfs.withPages(List.of("Section 302", "Section 304"));

        final BufferedImage image = renderer.render(pdf, 1, 72);

        // A6 is 297.6 x 419.5 points
        assertTrue(Math.abs(image.getWidth() - 298) <= 1, "width " + image.getWidth());
        assertTrue(Math.abs(image.getHeight() - 420) <= 1, "height " + image.getHeight());
    }

    @Test
    @DisplayName("an opened document reports its page count and renders every page")
    void open_multiPage_rendersAll() throws RenderException {
        try (RenderedPdf pdf = renderer.open(TestPdfs.withPages(List.of("one", "two", "three")), null)) {
            assertEquals(3, pdf.pageCount());
            for (int i = 0; i < pdf.pageCount(); i++) {
                assertTrue(pdf.render(i, 50).getWidth() > 0);
            }
        }
    }

    @Test
    @DisplayName("out-of-range pages are reported as such")
    void render_outOfRange_fails() {
        final byte[] pdf = TestPdfs.withPages(List.of("only page"));

        final RenderException e = assertThrows(RenderException.class, () -> renderer.render(pdf, 1, 72));
        assertEquals(RenderException.Reason.PAGE_OUT_OF_RANGE, e.getReason());
        assertEquals(1, e.getPageIndex());
    }

    @Test
    @DisplayName("garbage bytes are reported as corrupt")
    void open_garbage_corrupt() {
        final byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);

        final RenderException e = assertThrows(RenderException.class, () -> renderer.open(garbage, null));
        assertEquals(RenderException.Reason.CORRUPT, e.getReason());
        assertEquals(RenderException.Reason.CORRUPT,
                assertThrows(RenderException.class, () -> renderer.open(new byte[0], null)).getReason());
    }

    @Test
    @DisplayName("encrypted PDFs need the right password")
    void open_encrypted_needsPassword() throws RenderException {
        final byte[] pdf = TestPdfs.encrypted("s3cret");

        assertEquals(RenderException.Reason.ENCRYPTED,
                assertThrows(RenderException.class, () -> renderer.open(pdf, null)).getReason());
        assertEquals(RenderException.Reason.ENCRYPTED,
                assertThrows(RenderException.class, () -> renderer.open(pdf, "wrong")).getReason());
        try (RenderedPdf opened = renderer.open(pdf, "s3cret")) {
            assertEquals(1, opened.pageCount());
        }
    }
}
