package com.flowpilot.scheduler.model;

/**
 * The unit triggers and runs bind to. Only the fields the scheduler reads are modelled.
 */
public record FlowVersion(String id, String flowId, FlowTrigger trigger) {}
