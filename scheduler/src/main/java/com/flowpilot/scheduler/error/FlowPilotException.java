package com.flowpilot.scheduler.error;

import java.util.Map;

/**
 * The single unchecked exception type of the scheduler.
 *
 * Callers catch it only when they have a recovery strategy for the given
 * {@link ErrorCode}; everything else propagates to the job producer or the
 * worker loop, which logs it.
 */
public class FlowPilotException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, String> params;

    public FlowPilotException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public FlowPilotException(ErrorCode code, String message, Throwable cause) {
        this(code, message, Map.of(), cause);
    }

    public FlowPilotException(ErrorCode code, String message, Map<String, String> params) {
        this(code, message, params, null);
    }

    public FlowPilotException(ErrorCode code, String message, Map<String, String> params, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code   = code;
        this.params = Map.copyOf(params);
    }

    public ErrorCode getCode()              { return code; }
    public Map<String, String> getParams()  { return params; }

    public static FlowPilotException validation(String message) {
        return new FlowPilotException(ErrorCode.VALIDATION, message);
    }
}
