package eu.virtualparadox.lexqa.application.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings bound from {@code lexqa.*}.
 * <p>Folder paths are created on startup; the nested groups are handed to the components
 * that need them at construction time.</p>
 */
@Configuration
@ConfigurationProperties(prefix = "lexqa")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path index;
    private Path db;
    private Path blob;
    private Path models;

    private Extraction extraction = new Extraction();
    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private IndexSettings indexSettings = new IndexSettings();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (index != null) Files.createDirectories(index);
        if (blob != null) Files.createDirectories(blob);
        if (models != null) Files.createDirectories(models);
        if (db != null) {
            final Path dbDir = db.getParent();
            if (dbDir != null) Files.createDirectories(dbDir);
        }
    }

    @Getter @Setter
    public static class Extraction {
        /** Backend names in priority order. */
        private List<String> backends = new ArrayList<>(List.of("donut", "pix2struct", "remote-vision", "tesseract"));
        /** A result is accepted when its confidence is strictly above this value. */
        private double acceptanceThreshold = 0.0;
        private int dpi = 300;
        /** Page worker count, 0 means available processors. */
        private int concurrency = 0;
        private Duration backendTimeout = Duration.ofSeconds(120);
        private String tesseractLanguage = "hin+eng";
        private Path tesseractDataPath;
        private String remoteVisionPrompt = "Extract all text from this document page exactly as written. "
                + "Preserve Hindi (Devanagari) and English text. Return only the extracted text.";
        private int maxDecodeTokens = 768;

        public int effectiveConcurrency() {
            return concurrency > 0 ? concurrency : Runtime.getRuntime().availableProcessors();
        }
    }

    @Getter @Setter
    public static class Chunking {
        private int windowTokens = 512;
        private int overlapTokens = 50;
    }

    @Getter @Setter
    public static class Embedding {
        private String modelId = "law-ai/InLegalBERT";
        private int maxTokens = 512;
        private int batchSize = 16;
    }

    @Getter @Setter
    public static class Retrieval {
        private double denseWeight = 0.5;
        private double sparseWeight = 0.5;
        /** Candidates fetched from each index per requested result. */
        private int candidateMultiplier = 2;
        private int defaultTopK = 5;
    }

    @Getter @Setter
    public static class IndexSettings {
        /** Wipes both indexes on startup and rebuilds them from the chunk store. */
        private boolean rebuildOnStartup = false;
    }
}
