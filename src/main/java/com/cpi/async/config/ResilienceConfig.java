package com.cpi.async.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for Resilience4j patterns.
 * Outbound calls are bounded by a time limiter only; neither fetch nor
 * delivery is retried.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

    public static final String CALLBACK_INSTANCE = "cpiCallback";

    /**
     * Configures the time limiter shared by both collaborator calls.
     */
    @Bean
    public TimeLimiter callbackTimeLimiter(TimeLimiterRegistry timeLimiterRegistry) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(CALLBACK_INSTANCE);

        // Event listeners for monitoring
        timeLimiter.getEventPublisher()
                .onSuccess(event -> log.debug("Time limiter success: {}", event))
                .onTimeout(event -> log.warn("Callback call timed out after {}",
                        timeLimiter.getTimeLimiterConfig().getTimeoutDuration()))
                .onError(event -> log.warn("Time limiter error: {}", event.getThrowable().getMessage()));

        return timeLimiter;
    }
}
