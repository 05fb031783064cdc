package eu.virtualparadox.lexqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs individual backend calls so that each can be bounded by its own timeout.
 */
public class InferenceExecutor extends ThreadPoolTaskExecutor {
}
