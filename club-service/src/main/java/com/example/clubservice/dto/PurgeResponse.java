package com.example.clubservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Result of an audit retention purge.
 */
public record PurgeResponse(
    @JsonProperty("deleted") int deleted,
    @JsonProperty("cutoff_date") LocalDateTime cutoffDate,
    @JsonProperty("retention_days") int retentionDays
) {
}
