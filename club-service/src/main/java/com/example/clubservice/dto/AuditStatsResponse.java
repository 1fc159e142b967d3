package com.example.clubservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregated audit counters for one organization over the last N days.
 */
public record AuditStatsResponse(
    @JsonProperty("total") long total,
    @JsonProperty("success") long success,
    @JsonProperty("failed") long failed,
    @JsonProperty("by_action") Map<String, Long> byAction,
    @JsonProperty("by_entity_type") Map<String, Long> byEntityType,
    @JsonProperty("by_user") Map<String, Long> byUser,
    @JsonProperty("period_days") int periodDays
) {
}
