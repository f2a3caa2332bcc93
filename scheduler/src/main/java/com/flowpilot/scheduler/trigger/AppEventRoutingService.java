package com.flowpilot.scheduler.trigger;

import java.util.List;

/**
 * Routes events received on an app-wide webhook to the flows listening for
 * them. Provided by the hosting application.
 */
public interface AppEventRoutingService {

    void createListeners(String projectId, String flowId, String appName,
                         List<String> events, String identifierValue);

    /** Removes every listener registered for the flow. */
    void deleteListeners(String projectId, String flowId);
}
