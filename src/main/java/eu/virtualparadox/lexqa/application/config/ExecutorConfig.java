package eu.virtualparadox.lexqa.application.config;

import eu.virtualparadox.lexqa.application.executor.InferenceExecutor;
import eu.virtualparadox.lexqa.application.executor.IngestionExecutor;
import eu.virtualparadox.lexqa.application.executor.PageExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor() {
        final IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(1);        // documents are ingested one at a time
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public PageExecutor pageExecutor(final ApplicationConfig config) {
        final int workers = config.getExtraction().effectiveConcurrency();
        final PageExecutor executor = new PageExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("page-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public InferenceExecutor inferenceExecutor(final ApplicationConfig config) {
        // one slot per page worker, backends of one page run sequentially
        final int workers = config.getExtraction().effectiveConcurrency();
        final InferenceExecutor executor = new InferenceExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(workers * 4);
        executor.setThreadNamePrefix("infer-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
