package eu.virtualparadox.lexqa.ingest.render;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * PDFBox based {@link PageRenderer}.
 * <p>PDFBox renderers are not thread-safe, so one opened document renders one page at a time;
 * the parallelism lives in the extraction that follows.</p>
 */
@Component
@Slf4j
public class PdfBoxPageRenderer implements PageRenderer {

    @Override
    public BufferedImage render(final byte[] pdfBytes, final int pageIndex, final int dpi) throws RenderException {
        try (RenderedPdf pdf = open(pdfBytes, null)) {
            return pdf.render(pageIndex, dpi);
        }
    }

    @Override
    public RenderedPdf open(final byte[] pdfBytes, final String password) throws RenderException {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new RenderException(RenderException.Reason.CORRUPT, -1, "PDF content is empty");
        }
        try {
            final PDDocument document = password == null
                    ? Loader.loadPDF(pdfBytes)
                    : Loader.loadPDF(pdfBytes, password);
            return new PdfBoxDocument(document);
        } catch (InvalidPasswordException e) {
            throw new RenderException(RenderException.Reason.ENCRYPTED, -1,
                    "PDF is encrypted and no valid password was supplied", e);
        } catch (IOException e) {
            throw new RenderException(RenderException.Reason.CORRUPT, -1, "PDF cannot be parsed: " + e.getMessage(), e);
        }
    }

    private static final class PdfBoxDocument implements RenderedPdf {

        private final PDDocument document;
        private final PDFRenderer renderer;

        private PdfBoxDocument(final PDDocument document) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public synchronized BufferedImage render(final int pageIndex, final int dpi) throws RenderException {
            if (pageIndex < 0 || pageIndex >= document.getNumberOfPages()) {
                throw new RenderException(RenderException.Reason.PAGE_OUT_OF_RANGE, pageIndex,
                        "Page index " + pageIndex + " outside 0.." + (document.getNumberOfPages() - 1));
            }
            if (dpi <= 0) {
                throw new IllegalArgumentException("dpi must be > 0");
            }
            try {
                return renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
            } catch (IOException | RuntimeException e) {
                throw new RenderException(RenderException.Reason.RENDERING, pageIndex,
                        "Rendering page " + pageIndex + " failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                document.close();
            } catch (IOException e) {
                log.warn("Unable to close PDF document", e);
            }
        }
    }
}
