package com.flowpilot.scheduler.pubsub;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class RedisPubSubTest {

    @Mock StringRedisTemplate           redisTemplate;
    @Mock RedisMessageListenerContainer container;

    @Test
    void publish_prefixesChannel() {
        RedisPubSub pubSub = new RedisPubSub(redisTemplate, container, "tenant-a:");

        pubSub.publish("flow-run-finished", "{}");

        verify(redisTemplate).convertAndSend("tenant-a:flow-run-finished", "{}");
    }

    @Test
    void subscribe_deliversMessageBodyToHandler() {
        RedisPubSub pubSub = new RedisPubSub(redisTemplate, container, null);
        List<String> received = new ArrayList<>();

        pubSub.subscribe("flow-run-finished", received::add);

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(container).addMessageListener(listener.capture(), argThat((Topic t) -> "flow-run-finished".equals(t.getTopic())));
        listener.getValue().onMessage(new DefaultMessage(
                "flow-run-finished".getBytes(StandardCharsets.UTF_8),
                "{\"runId\":\"run-1\"}".getBytes(StandardCharsets.UTF_8)), null);
        assertThat(received).containsExactly("{\"runId\":\"run-1\"}");
    }

    @Test
    void unsubscribe_removesTheSameListener() {
        RedisPubSub pubSub = new RedisPubSub(redisTemplate, container, "");

        Subscription subscription = pubSub.subscribe("runs", m -> {});
        subscription.unsubscribe();

        ArgumentCaptor<MessageListener> added   = ArgumentCaptor.forClass(MessageListener.class);
        ArgumentCaptor<MessageListener> removed = ArgumentCaptor.forClass(MessageListener.class);
        verify(container).addMessageListener(added.capture(), argThat((Topic t) -> "runs".equals(t.getTopic())));
        verify(container).removeMessageListener(removed.capture(), argThat((Topic t) -> "runs".equals(t.getTopic())));
        assertThat(removed.getValue()).isSameAs(added.getValue());
    }
}
