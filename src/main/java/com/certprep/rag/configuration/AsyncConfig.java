package com.certprep.rag.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool for running the sub-queries of a scenario question concurrently.
 *
 * Only created when {@code app.retrieval.parallel-scenario-queries=true}; otherwise
 * sub-queries run on the calling thread.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "app.retrieval", name = "parallel-scenario-queries", havingValue = "true")
public class AsyncConfig {

    @Bean(name = "retrievalExecutor")
    public Executor retrievalExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // one main query plus up to four options
        executor.setCorePoolSize(5);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("retrieval-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("✅ Retrieval executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
