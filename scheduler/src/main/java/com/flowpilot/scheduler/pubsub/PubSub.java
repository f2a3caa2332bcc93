package com.flowpilot.scheduler.pubsub;

import java.util.function.Consumer;

/**
 * Fire-and-forget broadcast between scheduler instances.
 *
 * Every subscriber of a channel receives every message published after it
 * subscribed. Nothing is persisted; a message published while nobody listens
 * is lost.
 */
public interface PubSub {

    void publish(String channel, String message);

    Subscription subscribe(String channel, Consumer<String> handler);
}
