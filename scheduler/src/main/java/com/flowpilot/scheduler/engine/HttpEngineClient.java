package com.flowpilot.scheduler.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowpilot.scheduler.config.SystemConfig;
import com.flowpilot.scheduler.config.SystemProp;
import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for the engine service.
 *
 * Uses java.net.http.HttpClient so every header and byte on the wire is
 * explicit. Activation calls this on request threads, so the request timeout
 * (FP_TRIGGER_TIMEOUT_SECONDS) bounds how long an activation can block.
 */
@Component
public class HttpEngineClient implements EngineClient {

    private static final Logger log = LoggerFactory.getLogger(HttpEngineClient.class);

    private static final String TRIGGER_HOOKS_PATH = "/v1/engine/trigger-hooks";
    private static final TypeReference<EngineResponse<TriggerHookResult>> TRIGGER_HOOK_RESPONSE =
            new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    @Autowired
    public HttpEngineClient(SystemConfig config, ObjectMapper objectMapper) {
        this(config.getOrThrow(SystemProp.ENGINE_URL),
             Duration.ofSeconds(config.getNumberOrThrow(SystemProp.TRIGGER_TIMEOUT_SECONDS)),
             objectMapper);
    }

    public HttpEngineClient(String baseUrl, Duration timeout, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public EngineResponse<TriggerHookResult> executeTriggerHook(TriggerHookRequest request) {
        String opName = request.hookType() + " hook for flow version " + request.flowVersion().id();
        log.info("Running {} (test={})", opName, request.test());
        try {
            String body = post(TRIGGER_HOOKS_PATH, toJson(request), opName);
            EngineResponse<TriggerHookResult> response = json.readValue(body, TRIGGER_HOOK_RESPONSE);
            if (!response.isOk()) {
                log.warn("{} returned {}: {}", opName, response.status(), response.errorMessage());
            }
            return response;
        } catch (HttpTimeoutException e) {
            log.warn("{} timed out after {}", opName, timeout);
            return EngineResponse.timeout(opName + " timed out after " + timeout.toSeconds() + "s");
        } catch (JsonProcessingException e) {
            throw unavailable("Failed to parse response of " + opName, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST with the configured timeout; returns response body as String. */
    private String post(String path, String jsonBody, String opName) throws HttpTimeoutException {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw unavailable(opName + " failed, HTTP " + resp.statusCode() + ": " + resp.body(), null);
            }
            return resp.body();
        } catch (HttpTimeoutException e) {
            throw e;
        } catch (IOException e) {
            throw unavailable(opName + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable(opName + " interrupted", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw unavailable("JSON serialization failed", e);
        }
    }

    private static FlowPilotException unavailable(String message, Throwable cause) {
        return new FlowPilotException(ErrorCode.ENGINE_UNAVAILABLE, message, cause);
    }
}
