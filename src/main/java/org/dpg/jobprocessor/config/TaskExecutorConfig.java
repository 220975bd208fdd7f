package org.dpg.jobprocessor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pools used by background jobs.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final JobProcessingConfig config;

    @Value("${spring.task.execution.pool.core-size:8}")
    private int coreSize;

    @Value("${spring.task.execution.pool.max-size:32}")
    private int maxSize;

    @Value("${spring.task.execution.pool.queue-capacity:200}")
    private int queueCapacity;

    /**
     * Pool that runs one background task per accepted job request. Sized from the
     * `spring.task.execution.pool.*` properties; a full queue rejects the task.
     *
     * @return the job executor.
     */
    @Bean("applicationTaskExecutor")
    public AsyncTaskExecutor applicationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("job-task-");
        executor.initialize();
        return executor;
    }

    /**
     * Bounded pool for the parallel IIIF derivative batches of the import phase. Its size caps how
     * many batches of one or more finalizations run at the same time.
     *
     * @return the IIIF batch executor.
     */
    @Bean("iiifTaskExecutor")
    public AsyncTaskExecutor iiifTaskExecutor() {
        int concurrency = Math.max(1, config.getFinalization().getIiifConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setThreadNamePrefix("iiif-batch-");
        executor.initialize();
        return executor;
    }
}
