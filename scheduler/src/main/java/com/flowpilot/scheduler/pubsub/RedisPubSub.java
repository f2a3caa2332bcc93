package com.flowpilot.scheduler.pubsub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Redis-backed pub/sub shared by every scheduler instance.
 *
 * Publishing goes through the template's pooled connections; subscriptions
 * live on the listener container's dedicated connection, so a subscribed
 * connection is never used for commands.
 */
public class RedisPubSub implements PubSub, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisPubSub.class);

    private final StringRedisTemplate            redisTemplate;
    private final RedisMessageListenerContainer container;
    private final String                         channelPrefix;

    /**
     * @param channelPrefix prepended to every channel name, may be empty; lets
     *                      several deployments share one Redis
     */
    public RedisPubSub(StringRedisTemplate redisTemplate,
                       RedisMessageListenerContainer container,
                       String channelPrefix) {
        this.redisTemplate = redisTemplate;
        this.container     = container;
        this.channelPrefix = channelPrefix == null ? "" : channelPrefix;
    }

    @Override
    public void publish(String channel, String message) {
        redisTemplate.convertAndSend(channelPrefix + channel, message);
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        ChannelTopic topic = new ChannelTopic(channelPrefix + channel);
        MessageListener listener = (message, pattern) -> {
            try {
                handler.accept(new String(message.getBody(), StandardCharsets.UTF_8));
            } catch (RuntimeException e) {
                log.warn("Subscriber of channel '{}' failed: {}", topic.getTopic(), e.getMessage(), e);
            }
        };
        container.addMessageListener(listener, topic);
        log.debug("Subscribed to Redis channel '{}'", topic.getTopic());
        return () -> container.removeMessageListener(listener, topic);
    }

    @Override
    public void close() throws Exception {
        container.destroy();
    }
}
