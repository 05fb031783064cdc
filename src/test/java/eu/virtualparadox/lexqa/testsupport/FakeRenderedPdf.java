package eu.virtualparadox.lexqa.testsupport;

import eu.virtualparadox.lexqa.ingest.render.RenderException;
import eu.virtualparadox.lexqa.ingest.render.RenderedPdf;

import java.awt.image.BufferedImage;
import java.util.Set;

/**
 * In-memory document whose pages render to blank images; listed pages fail to render.
 */
public final class FakeRenderedPdf implements RenderedPdf {

    private final int pageCount;
    private final Set<Integer> brokenPages;

    public FakeRenderedPdf(final int pageCount, final Set<Integer> brokenPages) {
        this.pageCount = pageCount;
        this.brokenPages = brokenPages;
    }

    public FakeRenderedPdf(final int pageCount) {
        this(pageCount, Set.of());
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    public BufferedImage render(final int pageIndex, final int dpi) throws RenderException {
        if (brokenPages.contains(pageIndex)) {
            throw new RenderException(RenderException.Reason.RENDERING, pageIndex, "broken page " + pageIndex);
        }
        return new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
