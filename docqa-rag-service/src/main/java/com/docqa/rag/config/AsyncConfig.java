package com.docqa.rag.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * One pool per stage. Work submitted to a pool never waits on a task of the
 * same pool, so a full pool cannot deadlock. Queues are unbounded: a caller-runs
 * policy would run provider calls outside their timeout.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(DocQaProperties props) {
        return pool("ingest-", props.getIngestion().getParallelism());
    }

    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor(DocQaProperties props) {
        return pool("embed-", props.getEmbedding().getMaxConcurrent());
    }

    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor(DocQaProperties props) {
        return pool("llm-", props.getGateway().getPoolSize());
    }

    @Bean(name = "summaryMapExecutor")
    public ThreadPoolTaskExecutor summaryMapExecutor(DocQaProperties props) {
        return pool("summary-map-", props.getSummarization().getMapParallelism());
    }

    @Bean(name = "batchExecutor")
    public ThreadPoolTaskExecutor batchExecutor(DocQaProperties props) {
        return pool("batch-", props.getBatch().getParallelism());
    }

    private static ThreadPoolTaskExecutor pool(String prefix, int size) {
        int threads = Math.max(1, size);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Executor {} initialised with {} thread(s)", prefix, threads);
        return executor;
    }
}
