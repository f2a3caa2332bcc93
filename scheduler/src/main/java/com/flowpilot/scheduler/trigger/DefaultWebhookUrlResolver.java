package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.config.SystemProp;

/**
 * {@code {FP_WEBHOOK_URL}/v1/webhooks/{flowId}}, with a {@code /simulate}
 * suffix while the user is testing the trigger.
 */
public class DefaultWebhookUrlResolver implements WebhookUrlResolver {

    private final SystemConfig config;

    public DefaultWebhookUrlResolver(SystemConfig config) {
        this.config = config;
    }

    @Override
    public String getWebhookUrl(String flowId, boolean simulate) {
        String base = config.getOrThrow(SystemProp.WEBHOOK_URL);
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String url = base + "/v1/webhooks/" + flowId;
        return simulate ? url + "/simulate" : url;
    }
}
