package com.flowpilot.scheduler.trigger;

import com.flowpilot.scheduler.model.FlowTrigger;

/**
 * Looks up piece trigger definitions. Provided by the hosting application.
 */
public interface PieceMetadataService {

    /**
     * @throws com.flowpilot.scheduler.error.FlowPilotException PIECE_TRIGGER_NOT_FOUND
     *         if the piece, its version or the trigger does not exist for the project
     */
    PieceTriggerMetadata getPieceTriggerOrThrow(FlowTrigger trigger, String projectId);
}
