package com.codeheadsystems.pqsession.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Used by: {@code GET /pqc/health} response
 *
 * @param status     {@code healthy} or {@code degraded}
 * @param subsystems per-subsystem status lines
 */
public record HealthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("subsystems") Map<String, String> subsystems) {
}
