package com.teamlens.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of the running service: overall status, the live gauges an operator looks at first,
 * and one entry per component ({@code watcher}, {@code database}, {@code observers}).
 *
 * @param status             DOWN when any component is DOWN
 * @param observerCount      observers connected right now
 * @param watchedDirectories directories registered with the file watcher, absent while it is stopped
 * @param components         component name to its status, in check order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthReport(
    Status status,
    int observerCount,
    Integer watchedDirectories,
    Map<String, ComponentHealth> components
) {

    public enum Status { UP, DOWN }

    public HealthReport {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }

    public static HealthReport of(int observerCount, Integer watchedDirectories,
                                  Map<String, ComponentHealth> components) {
        boolean anyDown = components.values().stream().anyMatch(ComponentHealth::isDown);
        return new HealthReport(anyDown ? Status.DOWN : Status.UP, observerCount, watchedDirectories, components);
    }

    /** Report used when no health service is wired at all. */
    public static HealthReport unavailable() {
        return new HealthReport(Status.DOWN, 0, null, Map.of());
    }

    @JsonIgnore
    public boolean isDown() {
        return status == Status.DOWN;
    }
}
