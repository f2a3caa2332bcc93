package com.flowpilot.scheduler.config;

import com.flowpilot.scheduler.pubsub.MemoryPubSub;
import com.flowpilot.scheduler.pubsub.PubSub;
import com.flowpilot.scheduler.pubsub.RedisPubSub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Builds the process-wide pub/sub once, from FP_QUEUE_MODE.
 *
 * DISTRIBUTED uses Redis: one client for publishing (the template) and one
 * subscription connection owned by the listener container.
 */
@Configuration
public class PubSubConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PubSubConfiguration.class);

    @Bean
    public PubSub pubSub(SystemConfig config, ObjectProvider<StringRedisTemplate> redisTemplate) {
        QueueMode mode = config.getQueueMode();
        log.info("Using {} pub/sub", mode);
        return switch (mode) {
            case MEMORY      -> new MemoryPubSub();
            case DISTRIBUTED -> redisPubSub(redisTemplate.getObject(),
                    config.get(SystemProp.REDIS_CHANNEL_PREFIX).orElse(""));
        };
    }

    private static RedisPubSub redisPubSub(StringRedisTemplate redisTemplate, String channelPrefix) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(redisTemplate.getRequiredConnectionFactory());
        container.afterPropertiesSet();
        container.start();
        return new RedisPubSub(redisTemplate, container, channelPrefix);
    }
}
