package com.flowpilot.scheduler.flowrun;

/** Usage accounting, called once per finished run. */
public interface FlowRunHooks {

    void onFinish(String projectId, int tasks);
}
