package eu.virtualparadox.docsearch.application.config;

import eu.virtualparadox.docsearch.application.executor.EmbeddingCallExecutor;
import eu.virtualparadox.docsearch.application.executor.VectorStoreCallExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    /**
     * Grows on demand: a timed-out call that ignores interruption must not starve the next one.
     */
    @Bean
    public EmbeddingCallExecutor embeddingCallExecutor(final IndexingProperties properties) {
        EmbeddingCallExecutor executor = new EmbeddingCallExecutor();
        executor.setCorePoolSize(properties.getEmbedding().getMaxWorkers());
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("embed-call-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public VectorStoreCallExecutor vectorStoreCallExecutor() {
        VectorStoreCallExecutor executor = new VectorStoreCallExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("store-call-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }
}
