package com.example.guardianservice.config;

import com.example.guardianservice.exception.RemoteApiException;
import com.example.guardianservice.exception.TransientRemoteException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.internal.SemaphoreBasedRateLimiter;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j configuration for platform API calls.
 * 
 * Rate limiting:
 * - One process-wide limiter shared by overhaul runs, leveling and panels
 * - Semaphore based with a fair semaphore, so waiting callers get permits in arrival order
 * 
 * Retry strategy:
 * - Max attempts: 5
 * - Exponential backoff: 500ms → 1s → 2s → ... capped at 30s
 * - A rate-limit response replaces the computed wait with the one the platform asked for
 *   (still capped)
 * - Retry on: transient remote errors only; permanent errors fail immediately
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String DISCORD = "discord";

    @Bean
    public RateLimiter discordRateLimiter(
            @Value("${guardian.discord.rate-limit.limit-for-period:40}") int limitForPeriod,
            @Value("${guardian.discord.rate-limit.refresh-period:1s}") Duration refreshPeriod,
            @Value("${guardian.discord.rate-limit.timeout:60s}") Duration timeout) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(limitForPeriod)
                .limitRefreshPeriod(refreshPeriod)
                .timeoutDuration(timeout)
                .build();
        log.info("Platform rate limiter: {} calls per {}, wait timeout {}", limitForPeriod, refreshPeriod, timeout);
        return new SemaphoreBasedRateLimiter(DISCORD, config);
    }

    @Bean
    public RetryRegistry retryRegistry(
            @Value("${guardian.discord.retry.max-attempts:5}") int maxAttempts,
            @Value("${guardian.discord.retry.initial-backoff:500ms}") Duration initialBackoff,
            @Value("${guardian.discord.retry.multiplier:2.0}") double multiplier,
            @Value("${guardian.discord.retry.max-backoff:30s}") Duration maxBackoff) {
        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(DISCORD, discordRetryConfig(maxAttempts, initialBackoff, multiplier, maxBackoff));
        return registry;
    }

    public static RetryConfig discordRetryConfig(int maxAttempts, Duration initialBackoff, double multiplier,
                                                 Duration maxBackoff) {
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier, maxBackoff);
        long cap = maxBackoff.toMillis();
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .retryOnException(e -> e instanceof RemoteApiException remote && remote.isRetryable())
                .intervalBiFunction((attempt, outcome) -> {
                    if (outcome.isLeft()
                            && outcome.getLeft() instanceof TransientRemoteException transientError
                            && transientError.getRetryAfter().isPresent()) {
                        return Math.min(transientError.getRetryAfter().get().toMillis(), cap);
                    }
                    return backoff.apply(attempt);
                })
                .build();
    }
}
