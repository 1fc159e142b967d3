package com.example.clubservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token pair response DTO, returned by login, register and refresh.
 */
public record LoginResponse(
    @JsonProperty("access_token")
    String accessToken,

    @JsonProperty("refresh_token")
    String refreshToken,

    @JsonProperty("token_type")
    String tokenType,

    @JsonProperty("expires_in")
    long expiresIn,

    @JsonProperty("principal")
    PrincipalDto principal
) {
    /**
     * Factory method with default tokenType = "Bearer"
     */
    public static LoginResponse of(String accessToken, String refreshToken, long expiresIn, PrincipalDto principal) {
        return new LoginResponse(accessToken, refreshToken, "Bearer", expiresIn, principal);
    }
}
