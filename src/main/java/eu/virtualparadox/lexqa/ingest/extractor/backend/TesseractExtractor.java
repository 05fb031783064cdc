package eu.virtualparadox.lexqa.ingest.extractor.backend;

import eu.virtualparadox.lexqa.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Tesseract OCR through Tess4J, the last resort of the chain.
 * <p>
 * Confidence is the mean word confidence reported by Tesseract. A fresh engine is created per
 * call since {@link Tesseract} instances are not thread-safe.
 */
@Component
@Slf4j
public class TesseractExtractor implements ExtractorBackend {

    public static final String NAME = "tesseract";

    private final String language;
    private final Path dataPath;

    private volatile Boolean ready;

    public TesseractExtractor(final ApplicationConfig config) {
        this.language = config.getExtraction().getTesseractLanguage();
        this.dataPath = resolveDataPath(config.getExtraction().getTesseractDataPath());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.OCR;
    }

    @Override
    public boolean isReady() {
        Boolean current = ready;
        if (current == null) {
            current = languagesInstalled();
            ready = current;
            if (!current) {
                log.warn("Tesseract language data for '{}' not found under {}", language, dataPath);
            }
        }
        return current;
    }

    @Override
    public ExtractedText extract(final BufferedImage image, final int pageIndex) throws ExtractionException {
        final List<Word> words;
        try {
            words = newEngine().getWords(image, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        } catch (RuntimeException | Error e) {
            // native failures surface as unchecked JNA errors
            throw new ExtractionException(NAME, "OCR failed on page " + pageIndex + ": " + e.getMessage(), e);
        }

        final StringBuilder text = new StringBuilder();
        double confidenceSum = 0.0;
        int counted = 0;
        for (final Word word : words) {
            final String value = word.getText() == null ? "" : word.getText().strip();
            if (value.isEmpty()) {
                continue;
            }
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(value);
            if (word.getConfidence() > 0) {
                confidenceSum += word.getConfidence();
                counted++;
            }
        }

        final double confidence = counted == 0 ? 0.0 : confidenceSum / counted / 100.0;
        return new ExtractedText(text.toString(), confidence);
    }

    private Tesseract newEngine() {
        final Tesseract tesseract = new Tesseract();
        if (dataPath != null) {
            tesseract.setDatapath(dataPath.toString());
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(ITessAPI.TessPageSegMode.PSM_AUTO);
        return tesseract;
    }

    private boolean languagesInstalled() {
        if (dataPath == null) {
            return false;
        }
        for (final String lang : language.split("\\+")) {
            if (!Files.isRegularFile(dataPath.resolve(lang + ".traineddata"))) {
                return false;
            }
        }
        return true;
    }

    private static Path resolveDataPath(final Path configured) {
        if (configured != null) {
            return configured;
        }
        final String env = System.getenv("TESSDATA_PREFIX");
        return env == null || env.isBlank() ? null : Path.of(env);
    }
}
