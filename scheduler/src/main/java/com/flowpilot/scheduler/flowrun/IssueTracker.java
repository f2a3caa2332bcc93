package com.flowpilot.scheduler.flowrun;

/** Records that a flow failed in production. */
public interface IssueTracker {

    void add(String flowId, String projectId);
}
