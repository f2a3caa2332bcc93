package com.flowpilot.scheduler.pubsub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub. Handlers run synchronously on the publishing thread.
 */
public class MemoryPubSub implements PubSub {

    private static final Logger log = LoggerFactory.getLogger(MemoryPubSub.class);

    private final Map<String, List<Consumer<String>>> handlers = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, String message) {
        for (Consumer<String> handler : handlers.getOrDefault(channel, List.of())) {
            try {
                handler.accept(message);
            } catch (RuntimeException e) {
                // One broken subscriber must not starve the others.
                log.warn("Subscriber of channel '{}' failed: {}", channel, e.getMessage(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> handler) {
        // Add inside compute so a concurrent last unsubscribe cannot drop the list under us.
        handlers.compute(channel, (c, list) -> {
            List<Consumer<String>> target = list == null ? new CopyOnWriteArrayList<>() : list;
            target.add(handler);
            return target;
        });
        return () -> handlers.computeIfPresent(channel, (c, list) -> {
            list.remove(handler);
            return list.isEmpty() ? null : list;
        });
    }
}
