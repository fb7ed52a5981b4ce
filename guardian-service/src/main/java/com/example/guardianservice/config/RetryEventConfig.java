package com.example.guardianservice.config;

import com.example.guardianservice.metrics.GuardianMetrics;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Retry event logging for platform calls.
 * 
 * Logs emitted:
 * - WARN on retry attempt (also counted in guardian_remote_retries_total)
 * - INFO on success after retry (only if retried)
 * - WARN on retry exhaustion
 */
@Configuration
@Slf4j
public class RetryEventConfig {
    
    private final RetryRegistry retryRegistry;
    private final GuardianMetrics metrics;
    private final int maxAttempts;

    public RetryEventConfig(RetryRegistry retryRegistry, GuardianMetrics metrics,
                            @Value("${guardian.discord.retry.max-attempts:5}") int maxAttempts) {
        this.retryRegistry = retryRegistry;
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
    }
    
    @PostConstruct
    public void configureRetryEventLogging() {
        retryRegistry.getAllRetries()
            .stream()
            .filter(retry -> retry.getName().equals(ResilienceConfig.DISCORD))
            .findFirst()
            .ifPresentOrElse(
                retry -> retry.getEventPublisher()
                        .onRetry(this::logRetryAttempt)
                        .onSuccess(this::logRetrySuccess)
                        .onError(this::logRetryError),
                () -> log.warn("Retry not found in registry, skipping event config: {}", ResilienceConfig.DISCORD)
            );
    }
    
    private void logRetryAttempt(RetryOnRetryEvent event) {
        metrics.recordRetry();
        log.warn("RETRY_ATTEMPT name={} attempt={}/{} wait={} error={}", 
            event.getName(),
            event.getNumberOfRetryAttempts(),
            maxAttempts,
            event.getWaitInterval(),
            event.getLastThrowable().getMessage());
    }
    
    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} attempts={}", 
                event.getName(),
                event.getNumberOfRetryAttempts());
        }
    }
    
    private void logRetryError(RetryOnErrorEvent event) {
        // permanent errors also end here, after a single attempt
        if (event.getNumberOfRetryAttempts() >= maxAttempts) {
            log.warn("RETRY_EXHAUSTED name={} attempts={} error={}", 
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable().getMessage());
        }
    }
}
