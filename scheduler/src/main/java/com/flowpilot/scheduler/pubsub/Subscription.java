package com.flowpilot.scheduler.pubsub;

/** Handle returned by {@link PubSub#subscribe}. Unsubscribing twice is a no-op. */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
