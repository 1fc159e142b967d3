package com.example.clubservice.exception;

/**
 * Thrown when a refresh token was already revoked (consumed by rotation or logout).
 * Response: 401 Unauthorized
 */
public class TokenRevokedException extends CredentialException {

    public TokenRevokedException() {
        super("Token revoked");
    }

    @Override
    public String getReason() {
        return "TOKEN_REVOKED";
    }
}
