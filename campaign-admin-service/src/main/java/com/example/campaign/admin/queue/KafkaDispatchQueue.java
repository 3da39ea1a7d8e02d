package com.example.campaign.admin.queue;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.DispatchQueueException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes jobs to a Kafka topic keyed by campaign id, which keeps one campaign's jobs
 * on one partition in send order.
 */
@Component
@ConditionalOnProperty(prefix = "campaign.queue", name = "type", havingValue = "kafka")
@Slf4j
public class KafkaDispatchQueue implements DispatchQueue {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final long publishTimeoutMs;

    public KafkaDispatchQueue(KafkaTemplate<String, Object> kafkaTemplate, AppProperties appProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = appProperties.getKafka().getTopic().getName();
        this.publishTimeoutMs = appProperties.getQueue().getPublishTimeoutMs();
    }

    @Override
    public void publish(DispatchJob job) {
        String key = String.valueOf(job.getCampaignId());
        try {
            SendResult<String, Object> result = kafkaTemplate.send(topic, key, job).get(publishTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug("Published job for item {} to {}-{}@{}", job.getCampaignItemId(), topic,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchQueueException("Interrupted while publishing to " + topic, job.getCampaignItemId(), e);
        } catch (ExecutionException e) {
            throw new DispatchQueueException("Kafka publish to " + topic + " failed: " + e.getCause().getMessage(), job.getCampaignItemId(), e.getCause());
        } catch (TimeoutException e) {
            throw new DispatchQueueException("Kafka publish to " + topic + " timed out after " + publishTimeoutMs + "ms", job.getCampaignItemId(), e);
        }
    }

    @Override
    public String destination() {
        return "kafka:" + topic;
    }
}
