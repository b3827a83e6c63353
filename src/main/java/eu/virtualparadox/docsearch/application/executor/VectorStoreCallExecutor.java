package eu.virtualparadox.docsearch.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Runs individual vector-store calls so that each one can be bounded by a timeout.
 */
public class VectorStoreCallExecutor extends ThreadPoolTaskExecutor {
}
