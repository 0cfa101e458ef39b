package com.simsuggest.similarity.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SimilarityExecutionConfig {

    /**
     * Hybrid requests hold two threads at once, so the pool never drops below that.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService similarityExecutor(SimilarityExecutionProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getPoolSize()));
    }
}
