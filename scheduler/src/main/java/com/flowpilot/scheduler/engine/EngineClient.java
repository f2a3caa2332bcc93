package com.flowpilot.scheduler.engine;

/**
 * The sandboxed engine that runs piece code.
 *
 * Calls block until the engine answers or the configured timeout elapses.
 */
public interface EngineClient {

    /**
     * Runs a trigger lifecycle hook.
     *
     * @return the engine's answer; TIMEOUT if it did not answer in time
     * @throws com.flowpilot.scheduler.error.FlowPilotException ENGINE_UNAVAILABLE
     *         if the engine could not be reached or answered with a non-2xx status
     */
    EngineResponse<TriggerHookResult> executeTriggerHook(TriggerHookRequest request);
}
