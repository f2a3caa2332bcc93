package com.flowpilot.scheduler.model;

import java.util.Map;

/**
 * Trigger definition stored on a flow version.
 *
 * @param type         EMPTY for a flow that has no trigger yet
 * @param name         step name of the trigger inside the flow
 * @param pieceName    e.g. "@flowpilot/piece-gmail"; null for EMPTY triggers
 * @param pieceVersion semantic version of the piece
 * @param triggerName  trigger identifier inside the piece, e.g. "new_email"
 * @param settings     user input for the trigger (opaque here)
 */
public record FlowTrigger(
        TriggerType         type,
        String              name,
        String              pieceName,
        String              pieceVersion,
        String              triggerName,
        Map<String, Object> settings) {

    public FlowTrigger {
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    public static FlowTrigger empty(String name) {
        return new FlowTrigger(TriggerType.EMPTY, name, null, null, null, Map.of());
    }

    public static FlowTrigger piece(String pieceName, String pieceVersion, String triggerName) {
        return new FlowTrigger(TriggerType.PIECE, "trigger", pieceName, pieceVersion, triggerName, Map.of());
    }
}
