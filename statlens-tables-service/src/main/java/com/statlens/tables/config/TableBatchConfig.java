package com.statlens.tables.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for {@code GET /api/v1/tables?dataflows=...}, which lists the tables of several dataflows at once.
 * When the queue is full the request thread lists the dataflow itself instead of rejecting it.
 */
@Configuration
public class TableBatchConfig {

    public static final String TABLE_BATCH_EXECUTOR = "tableBatchExecutor";

    @Bean(name = TABLE_BATCH_EXECUTOR)
    public ThreadPoolTaskExecutor tableBatchExecutor(@Value("${statlens.table-batch.threads:4}") int threads,
                                                     @Value("${statlens.table-batch.queue-capacity:32}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("table-batch-");
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
