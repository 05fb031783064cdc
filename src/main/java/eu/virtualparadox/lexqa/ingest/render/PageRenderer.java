package eu.virtualparadox.lexqa.ingest.render;

import java.awt.image.BufferedImage;

/**
 * Rasterizes PDF pages for the vision extractors.
 */
public interface PageRenderer {

    int DEFAULT_DPI = 300;

    /**
     * Renders a single page of an unencrypted PDF.
     *
     * @param pdfBytes  PDF content
     * @param pageIndex zero-based page index
     * @param dpi       target resolution
     * @return rendered page
     * @throws RenderException if the PDF is corrupt or encrypted, or the index is out of range
     */
    BufferedImage render(byte[] pdfBytes, int pageIndex, int dpi) throws RenderException;

    /**
     * Opens a PDF for repeated page rendering.
     *
     * @param pdfBytes PDF content
     * @param password user password, {@code null} for none
     * @return opened document, to be closed by the caller
     * @throws RenderException if the PDF is corrupt or the password is missing or wrong
     */
    RenderedPdf open(byte[] pdfBytes, String password) throws RenderException;
}
