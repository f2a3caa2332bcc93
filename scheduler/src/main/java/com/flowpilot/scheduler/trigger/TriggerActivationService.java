package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.engine.AppEventListener;
import com.flowpilot.scheduler.engine.EngineClient;
import com.flowpilot.scheduler.engine.EngineResponse;
import com.flowpilot.scheduler.engine.TriggerHookRequest;
import com.flowpilot.scheduler.engine.TriggerHookResult;
import com.flowpilot.scheduler.engine.TriggerHookType;
import com.flowpilot.scheduler.error.FlowPilotException;
import com.flowpilot.scheduler.model.FlowTrigger;
import com.flowpilot.scheduler.model.FlowVersion;
import com.flowpilot.scheduler.model.RunEnvironment;
import com.flowpilot.scheduler.model.TriggerType;
import com.flowpilot.scheduler.queue.Job;
import com.flowpilot.scheduler.queue.JobData;
import com.flowpilot.scheduler.queue.JobQueue;
import com.flowpilot.scheduler.queue.RepeatableJobType;
import com.flowpilot.scheduler.queue.ScheduleOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a published flow version's trigger into the things that make it fire.
 *
 * Enable flow:
 *   1. Resolve the piece trigger and the flow's webhook URL.
 *   2. Run the trigger's ON_ENABLE hook in the engine and wait for it.
 *   3. Depending on the trigger strategy:
 *        APP_WEBHOOK → register app event listeners
 *        WEBHOOK     → schedule webhook renewal (CRON renew strategy only)
 *        POLLING     → schedule polling
 *
 * Schedules are keyed by flow version id, so enabling the same version again
 * reconfigures its schedule instead of adding a second one.
 */
@Service
public class TriggerActivationService {

    private static final Logger log = LoggerFactory.getLogger(TriggerActivationService.class);

    private final PieceMetadataService   pieceMetadataService;
    private final WebhookUrlResolver     webhookUrlResolver;
    private final EngineClient           engineClient;
    private final AppEventRoutingService appEventRoutingService;
    private final PollingIntervalPolicy  pollingIntervalPolicy;
    private final JobQueue               jobQueue;

    public TriggerActivationService(PieceMetadataService pieceMetadataService,
                                    WebhookUrlResolver webhookUrlResolver,
                                    EngineClient engineClient,
                                    AppEventRoutingService appEventRoutingService,
                                    PollingIntervalPolicy pollingIntervalPolicy,
                                    JobQueue jobQueue) {
        this.pieceMetadataService   = pieceMetadataService;
        this.webhookUrlResolver     = webhookUrlResolver;
        this.engineClient           = engineClient;
        this.appEventRoutingService = appEventRoutingService;
        this.pollingIntervalPolicy  = pollingIntervalPolicy;
        this.jobQueue               = jobQueue;
    }

    // ------------------------------------------------------------------
    // Enable
    // ------------------------------------------------------------------

    /**
     * Activates the trigger of a flow version.
     *
     * @return empty if the flow has no piece trigger; otherwise the engine's
     *         ON_ENABLE response. A non-OK response is returned as is and
     *         nothing is scheduled. For POLLING triggers the returned result
     *         carries the schedule that was actually installed.
     * @throws FlowPilotException PIECE_TRIGGER_NOT_FOUND, ENGINE_UNAVAILABLE or JOB_QUEUE_FAILURE
     */
    public Optional<EngineResponse<TriggerHookResult>> enable(EnableTriggerRequest request) {
        FlowVersion flowVersion = request.flowVersion();
        FlowTrigger trigger     = flowVersion.trigger();
        String      projectId   = request.projectId();
        if (trigger.type() != TriggerType.PIECE) {
            return Optional.empty();
        }

        PieceTriggerMetadata pieceTrigger = pieceMetadataService.getPieceTriggerOrThrow(trigger, projectId);
        String webhookUrl = webhookUrlResolver.getWebhookUrl(flowVersion.flowId(), request.simulate());

        EngineResponse<TriggerHookResult> response = engineClient.executeTriggerHook(new TriggerHookRequest(
                TriggerHookType.ON_ENABLE, flowVersion, webhookUrl, projectId, request.simulate()));
        if (!response.isOk()) {
            log.warn("ON_ENABLE of flow version {} returned {}, nothing scheduled",
                    flowVersion.id(), response.status());
            return Optional.of(response);
        }

        TriggerHookResult result = response.result() == null
                ? new TriggerHookResult(null, null)
                : response.result();

        TriggerHookResult applied = switch (pieceTrigger.strategy()) {
            case APP_WEBHOOK -> registerListeners(flowVersion, projectId, trigger, result);
            case WEBHOOK     -> scheduleWebhookRenewal(flowVersion, projectId,
                    pieceTrigger.renewConfiguration(), result);
            case POLLING     -> schedulePolling(flowVersion, projectId, result);
        };
        return Optional.of(response.withResult(applied));
    }

    // ------------------------------------------------------------------
    // Disable
    // ------------------------------------------------------------------

    /**
     * Undoes {@link #enable}. The ON_DISABLE hook is best-effort: the schedule
     * or listeners are removed even if the engine fails, so a broken trigger
     * can always be turned off.
     */
    public void disable(FlowVersion flowVersion, String projectId, boolean simulate) {
        FlowTrigger trigger = flowVersion.trigger();
        if (trigger.type() != TriggerType.PIECE) {
            return;
        }
        PieceTriggerMetadata pieceTrigger = pieceMetadataService.getPieceTriggerOrThrow(trigger, projectId);
        String webhookUrl = webhookUrlResolver.getWebhookUrl(flowVersion.flowId(), simulate);

        try {
            EngineResponse<TriggerHookResult> response = engineClient.executeTriggerHook(new TriggerHookRequest(
                    TriggerHookType.ON_DISABLE, flowVersion, webhookUrl, projectId, simulate));
            if (!response.isOk()) {
                log.warn("ON_DISABLE of flow version {} returned {}: {}",
                        flowVersion.id(), response.status(), response.errorMessage());
            }
        } catch (FlowPilotException e) {
            log.warn("ON_DISABLE of flow version {} failed: {}", flowVersion.id(), e.getMessage());
        }

        boolean removed = switch (pieceTrigger.strategy()) {
            case APP_WEBHOOK      -> {
                appEventRoutingService.deleteListeners(projectId, flowVersion.flowId());
                yield true;
            }
            case WEBHOOK, POLLING -> jobQueue.removeRepeatingJob(flowVersion.id());
        };
        if (removed) {
            log.info("Deactivated {} trigger of flow version {}", pieceTrigger.strategy(), flowVersion.id());
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private TriggerHookResult registerListeners(FlowVersion flowVersion, String projectId,
                                                FlowTrigger trigger, TriggerHookResult result) {
        for (AppEventListener listener : result.listeners()) {
            appEventRoutingService.createListeners(projectId, flowVersion.flowId(),
                    trigger.pieceName(), listener.events(), listener.identifierValue());
        }
        log.info("Registered {} app event listener(s) for flow {} ({})",
                result.listeners().size(), flowVersion.flowId(), trigger.pieceName());
        return result;
    }

    private TriggerHookResult scheduleWebhookRenewal(FlowVersion flowVersion, String projectId,
                                                     WebhookRenewConfiguration renew, TriggerHookResult result) {
        if (renew == null || renew.strategy() != WebhookRenewStrategy.CRON) {
            return result;
        }
        JobData data = new JobData.Repeating(
                JobData.LATEST_SCHEMA_VERSION,
                RepeatableJobType.RENEW_WEBHOOK,
                flowVersion.flowId(),
                flowVersion.id(),
                projectId,
                null,
                null);
        jobQueue.add(Job.repeating(flowVersion.id(), data, ScheduleOptions.utc(renew.cronExpression())));
        log.info("Scheduled webhook renewal of flow version {} at '{}'", flowVersion.id(), renew.cronExpression());
        return result;
    }

    /** Schedules polling with the engine's options, or every N minutes per the polling policy. */
    private TriggerHookResult schedulePolling(FlowVersion flowVersion, String projectId, TriggerHookResult result) {
        if (result.scheduleOptions() == null) {
            int minutes = pollingIntervalPolicy.pollingIntervalMinutes(projectId);
            result = result.withScheduleOptions(ScheduleOptions.everyMinutes(minutes));
        }
        ScheduleOptions options = result.scheduleOptions();
        JobData data = new JobData.Repeating(
                JobData.LATEST_SCHEMA_VERSION,
                RepeatableJobType.EXECUTE_TRIGGER,
                flowVersion.flowId(),
                flowVersion.id(),
                projectId,
                RunEnvironment.PRODUCTION,
                TriggerType.PIECE);
        jobQueue.add(Job.repeating(flowVersion.id(), data, options));
        log.info("Scheduled polling of flow version {} at '{}' ({})",
                flowVersion.id(), options.cronExpression(), options.timezone());
        return result;
    }
}
