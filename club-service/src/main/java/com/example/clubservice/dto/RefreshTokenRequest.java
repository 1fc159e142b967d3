package com.example.clubservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Refresh token request DTO.
 */
public record RefreshTokenRequest(
    @JsonProperty("refresh_token")
    @NotBlank(message = "Refresh token is required")
    String refreshToken
) {
}
