package com.flowpilot.scheduler.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of an engine operation.
 *
 * A non-OK response is a normal result, not an exception: callers hand it
 * back to their own caller unchanged.
 *
 * @param result       present only when status is OK
 * @param errorMessage engine-provided reason for ERROR / TIMEOUT
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineResponse<T>(EngineResponseStatus status, T result, String errorMessage) {

    public static <T> EngineResponse<T> ok(T result) {
        return new EngineResponse<>(EngineResponseStatus.OK, result, null);
    }

    public static <T> EngineResponse<T> error(String errorMessage) {
        return new EngineResponse<>(EngineResponseStatus.ERROR, null, errorMessage);
    }

    public static <T> EngineResponse<T> timeout(String errorMessage) {
        return new EngineResponse<>(EngineResponseStatus.TIMEOUT, null, errorMessage);
    }

    @JsonIgnore
    public boolean isOk() {
        return status == EngineResponseStatus.OK;
    }

    public EngineResponse<T> withResult(T newResult) {
        return new EngineResponse<>(status, newResult, errorMessage);
    }
}
