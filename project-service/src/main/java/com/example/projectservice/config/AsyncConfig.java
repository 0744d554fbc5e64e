package com.example.projectservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for the parallel reads issued by ProjectHydrator.
 *
 * Hydration waits on its reads, so a saturated pool runs the read on the request
 * thread (CallerRunsPolicy) instead of failing the request.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${project.hydration.core-pool-size:8}")
    private int corePoolSize;

    @Value("${project.hydration.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${project.hydration.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = "hydrationExecutor")
    public Executor hydrationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("hydrate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.setKeepAliveSeconds(60);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Initialized hydration executor: core={}, max={}, queue={}",
                corePoolSize, maxPoolSize, queueCapacity);

        return executor;
    }
}
