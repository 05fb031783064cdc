package eu.virtualparadox.lexqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single-worker executor that runs queued document ingestions.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
