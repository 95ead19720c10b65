package com.teamlens.core.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Status of one part of the ingestion pipeline.
 */
public record ComponentHealth(HealthReport.Status status, String detail) {

    public static ComponentHealth up(String detail) {
        return new ComponentHealth(HealthReport.Status.UP, detail);
    }

    public static ComponentHealth down(String detail) {
        return new ComponentHealth(HealthReport.Status.DOWN, detail);
    }

    @JsonIgnore
    public boolean isDown() {
        return status == HealthReport.Status.DOWN;
    }
}
