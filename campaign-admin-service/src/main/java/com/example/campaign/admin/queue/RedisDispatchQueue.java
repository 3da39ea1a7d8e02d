package com.example.campaign.admin.queue;

import com.example.campaign.shared.config.AppProperties;
import com.example.campaign.shared.dto.DispatchJob;
import com.example.campaign.shared.exception.DispatchQueueException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * LPUSHes each job as JSON onto a Redis list; the sender BRPOPs from the other end.
 */
@Component
@ConditionalOnProperty(prefix = "campaign.queue", name = "type", havingValue = "redis", matchIfMissing = true)
@Slf4j
public class RedisDispatchQueue implements DispatchQueue {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public RedisDispatchQueue(@Qualifier("dispatchQueueRedisTemplate") StringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper,
                              AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.queueName = appProperties.getQueue().getName();
    }

    @Override
    public void publish(DispatchJob job) {
        String json;
        try {
            json = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize dispatch job for item " + job.getCampaignItemId(), e);
        }
        try {
            Long length = redisTemplate.opsForList().leftPush(queueName, json);
            log.debug("Pushed job for item {} onto {} (length {})", job.getCampaignItemId(), queueName, length);
        } catch (DataAccessException e) {
            throw new DispatchQueueException("Redis push to " + queueName + " failed: " + e.getMessage(), job.getCampaignItemId(), e);
        }
    }

    @Override
    public String destination() {
        return "redis:" + queueName;
    }
}
