package com.example.campaign.admin.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the {@code dispatchQueue} retry instance configured under
 * {@code resilience4j.retry.instances.dispatchQueue}.
 */
@Configuration
@Slf4j
public class DispatchRetryConfig {

    public static final String DISPATCH_QUEUE_RETRY = "dispatchQueue";

    @Bean
    public Retry dispatchQueueRetry(RetryRegistry retryRegistry) {
        Retry retry = retryRegistry.retry(DISPATCH_QUEUE_RETRY);
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Dispatch publish attempt {} failed, retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
                .onError(event -> log.error("Dispatch publish gave up after {} attempts: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
