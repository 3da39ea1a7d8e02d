package com.example.campaign.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * The dispatch queue is a plain Redis list of JSON strings, so jobs are written with
 * string serializers. The command timeout ({@code spring.data.redis.timeout}) bounds each publish.
 */
@Configuration
@ConditionalOnProperty(prefix = "campaign.queue", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean("dispatchQueueRedisTemplate")
    public StringRedisTemplate dispatchQueueRedisTemplate(RedisConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
