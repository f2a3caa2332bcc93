package com.flowpilot.scheduler.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * App events a trigger wants routed to its flow, as returned by ON_ENABLE.
 *
 * @param events          event names in the app's vocabulary
 * @param identifierValue value that identifies the user's account on the app side
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppEventListener(List<String> events, String identifierValue) {

    public AppEventListener {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
