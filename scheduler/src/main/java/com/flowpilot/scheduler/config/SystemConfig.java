package com.flowpilot.scheduler.config;

import com.flowpilot.scheduler.error.ErrorCode;
import com.flowpilot.scheduler.error.FlowPilotException;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed, read-only access to process configuration.
 *
 * Every lookup goes through {@code FP_<PROP>} in the Spring {@link Environment}
 * first and then through the static defaults of {@link SystemProp}. The
 * environment is fixed once the application context is refreshed, so the
 * values never change afterwards.
 */
@Component
public class SystemConfig {

    private final Environment environment;

    public SystemConfig(Environment environment) {
        this.environment = environment;
    }

    // ------------------------------------------------------------------
    // Raw getters
    // ------------------------------------------------------------------

    public Optional<String> get(SystemProp prop) {
        String value = environment.getProperty(prop.envName());
        if (value == null) {
            value = prop.defaultValue();
        }
        return Optional.ofNullable(value);
    }

    /** Returns empty when the value is missing, blank or not an integer. */
    public Optional<Integer> getNumber(SystemProp prop) {
        return get(prop)
                .filter(v -> !v.isBlank())
                .flatMap(SystemConfig::parseInt);
    }

    public Optional<Boolean> getBoolean(SystemProp prop) {
        return get(prop).map("true"::equals);
    }

    public List<String> getList(SystemProp prop) {
        return get(prop)
                .map(v -> Arrays.stream(v.split(","))
                        .map(String::trim)
                        .toList())
                .orElse(List.of());
    }

    public String getOrThrow(SystemProp prop) {
        return get(prop).orElseThrow(() -> notDefined(prop));
    }

    public int getNumberOrThrow(SystemProp prop) {
        return getNumber(prop).orElseThrow(() -> notDefined(prop));
    }

    // ------------------------------------------------------------------
    // Typed helpers
    // ------------------------------------------------------------------

    public Edition getEdition() {
        return parseEnum(SystemProp.EDITION, Edition.class);
    }

    public QueueMode getQueueMode() {
        return parseEnum(SystemProp.QUEUE_MODE, QueueMode.class);
    }

    public ContainerType getContainerType() {
        return parseEnum(SystemProp.CONTAINER_TYPE, ContainerType.class);
    }

    public boolean isWorker() {
        return EnumSet.of(ContainerType.WORKER, ContainerType.WORKER_AND_APP).contains(getContainerType());
    }

    public boolean isApp() {
        return EnumSet.of(ContainerType.APP, ContainerType.WORKER_AND_APP).contains(getContainerType());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private <E extends Enum<E>> E parseEnum(SystemProp prop, Class<E> type) {
        String raw = getOrThrow(prop);
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new FlowPilotException(ErrorCode.SYSTEM_PROP_NOT_DEFINED,
                    "System property " + prop.envName() + " has unsupported value '" + raw + "'",
                    Map.of("prop", prop.envName()), e);
        }
    }

    private static FlowPilotException notDefined(SystemProp prop) {
        return new FlowPilotException(ErrorCode.SYSTEM_PROP_NOT_DEFINED,
                "System property " + prop.envName() + " is not defined, please check the documentation",
                Map.of("prop", prop.envName()));
    }

    private static Optional<Integer> parseInt(String value) {
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
