package com.example.guardianservice.config;

import com.example.guardianservice.metrics.GuardianMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded thread pool for overhaul and repair runs.
 * 
 * Each run occupies one thread for its whole duration, including retry backoff sleeps, so runs
 * for different guilds never wait on each other's backoff.
 * 
 * - Core pool: 2 threads
 * - Max pool: 4 threads
 * - Queue: 20 runs
 * - Rejection: AbortPolicy (the caller gets RejectedExecutionException, the guild lock is released)
 */
@Configuration
@Slf4j
public class AsyncConfig {
    
    @Bean(name = "overhaulTaskExecutor")
    public Executor overhaulTaskExecutor(
            @Value("${guardian.overhaul.executor.core-pool-size:2}") int corePoolSize,
            @Value("${guardian.overhaul.executor.max-pool-size:4}") int maxPoolSize,
            @Value("${guardian.overhaul.executor.queue-capacity:20}") int queueCapacity,
            @Value("${guardian.overhaul.executor.thread-name-prefix:overhaul-}") String threadNamePrefix,
            GuardianMetrics metrics) {
        
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        
        // AbortPolicy: a full queue rejects the run instead of running it on the caller thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        
        // correlationId and guildId follow the run onto the worker thread
        executor.setTaskDecorator(new MdcTaskDecorator());
        
        executor.initialize();
        metrics.registerThreadPoolMetrics("overhaul", executor.getThreadPoolExecutor());
        
        log.info("Initialized overhaulTaskExecutor - core={}, max={}, queue={}, prefix='{}'",
                corePoolSize, maxPoolSize, queueCapacity, threadNamePrefix);
        
        return executor;
    }
    
    /**
     * Copies the submitting thread's MDC onto the worker thread for the duration of the task.
     */
    public static class MdcTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            
            return () -> {
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        }
    }
}
