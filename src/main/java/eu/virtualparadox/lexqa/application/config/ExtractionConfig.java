package eu.virtualparadox.lexqa.application.config;

import eu.virtualparadox.lexqa.application.executor.InferenceExecutor;
import eu.virtualparadox.lexqa.application.executor.PageExecutor;
import eu.virtualparadox.lexqa.ingest.extractor.ExtractionOrchestrator;
import eu.virtualparadox.lexqa.ingest.extractor.backend.ExtractorBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the extractor chain in the configured priority order.
 */
@Configuration
@Slf4j
public class ExtractionConfig {

    @Bean
    public ExtractionOrchestrator extractionOrchestrator(final ApplicationConfig config,
                                                         final List<ExtractorBackend> backends,
                                                         final PageExecutor pageExecutor,
                                                         final InferenceExecutor inferenceExecutor) {
        final ApplicationConfig.Extraction extraction = config.getExtraction();
        final List<ExtractorBackend> chain = ExtractionOrchestrator.prioritize(backends, extraction.getBackends());
        if (chain.isEmpty()) {
            log.warn("No extractor backend configured, every page will end without text");
        }
        log.info("Extractor chain: {} (acceptance threshold {}, {} dpi, {} page workers)",
                chain.stream().map(ExtractorBackend::name).toList(),
                extraction.getAcceptanceThreshold(), extraction.getDpi(), extraction.effectiveConcurrency());

        return new ExtractionOrchestrator(chain,
                extraction.getAcceptanceThreshold(),
                extraction.getDpi(),
                extraction.getBackendTimeout(),
                pageExecutor,
                inferenceExecutor);
    }
}
