package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.config.Edition;
import com.flowpilot.scheduler.config.SystemConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Edition-dependent trigger behaviour, decided once at startup.
 */
@Configuration
public class TriggerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TriggerConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(WebhookUrlResolver.class)
    public WebhookUrlResolver webhookUrlResolver(SystemConfig config) {
        return new DefaultWebhookUrlResolver(config);
    }

    @Bean
    @ConditionalOnMissingBean(PollingIntervalPolicy.class)
    public PollingIntervalPolicy pollingIntervalPolicy(SystemConfig config,
                                                       ObjectProvider<PlanLimitsService> planLimits) {
        Edition edition = config.getEdition();
        log.info("Polling interval policy for edition {}", edition);
        return switch (edition) {
            case CLOUD                 -> new PlanPollingIntervalPolicy(planLimits.getObject(),
                    new ConfiguredPollingIntervalPolicy(config));
            case COMMUNITY, ENTERPRISE -> new ConfiguredPollingIntervalPolicy(config);
        };
    }
}
