package com.flowpilot.scheduler.flowrun;

import com.flowpilot.scheduler.model.FlowRun;

/** Tells interested parties that a run has finished. */
public interface RunNotifier {

    void notifyRun(FlowRun flowRun);
}
