package com.flowpilot.scheduler.flowrun;

import com.flowpilot.scheduler.model.ExecutionType;
import com.flowpilot.scheduler.model.FlowRun;
import com.flowpilot.scheduler.model.RunHookType;

import java.util.Objects;

/**
 * @param payload              trigger output or resume body, opaque to the scheduler
 * @param synchronousHandlerId set when an HTTP caller is waiting for the run's result
 * @param hookType             optional run hook, may be null
 */
public record StartParams(
        FlowRun       flowRun,
        ExecutionType executionType,
        Object        payload,
        String        synchronousHandlerId,
        RunHookType   hookType) {

    public StartParams {
        Objects.requireNonNull(flowRun, "flowRun");
        Objects.requireNonNull(executionType, "executionType");
    }

    public static StartParams of(FlowRun flowRun, ExecutionType executionType, Object payload) {
        return new StartParams(flowRun, executionType, payload, null, null);
    }
}
