package eu.virtualparadox.lexqa.ingest.render;

import java.awt.image.BufferedImage;

/**
 * An opened PDF whose pages can be rasterized one by one.
 * Implementations serialize rendering internally and may be shared by page workers.
 */
public interface RenderedPdf extends AutoCloseable {

    int pageCount();

    /**
     * @param pageIndex zero-based page index
     * @param dpi       target resolution
     * @return the page as an RGB image
     * @throws RenderException if the index is out of range or rasterization fails
     */
    BufferedImage render(int pageIndex, int dpi) throws RenderException;

    @Override
    void close();
}
