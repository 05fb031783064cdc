package eu.virtualparadox.lexqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool running one page-extraction task per page.
 */
public class PageExecutor extends ThreadPoolTaskExecutor {
}
