package com.example.clubservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of audit entries plus the total match count.
 */
public record AuditLogPageResponse(
    @JsonProperty("data") List<AuditLogDto> data,
    @JsonProperty("total") long total,
    @JsonProperty("limit") int limit,
    @JsonProperty("offset") int offset
) {
}
