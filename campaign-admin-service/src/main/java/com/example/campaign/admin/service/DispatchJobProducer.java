package com.example.campaign.admin.service;

import com.example.campaign.admin.queue.DispatchQueue;
import com.example.campaign.shared.aspect.Monitored;
import com.example.campaign.shared.config.MonitoringConfig;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.DispatchQueueException;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Publishes one send job per dispatch item through the configured {@link DispatchQueue},
 * retrying transient failures with the {@code dispatchQueue} retry policy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Monitored("producer")
public class DispatchJobProducer {

    private final DispatchQueue dispatchQueue;
    private final Retry dispatchQueueRetry;
    private final MonitoringConfig.CampaignMetricsCollector metricsCollector;

    /**
     * @throws DispatchQueueException once every attempt has failed
     */
    public void enqueue(DispatchJob job) {
        try {
            dispatchQueueRetry.executeRunnable(() -> dispatchQueue.publish(job));
            metricsCollector.incrementCounter(MonitoringConfig.JOBS_PUBLISHED, "queue", "dispatch");
            log.debug("Enqueued job for item {} of campaign {} on {}", job.getCampaignItemId(), job.getCampaignId(), dispatchQueue.destination());
        } catch (DispatchQueueException e) {
            metricsCollector.incrementCounter(MonitoringConfig.JOBS_FAILED, "queue", "dispatch");
            throw e;
        }
    }
}
