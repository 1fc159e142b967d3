package com.example.clubservice.exception;

/**
 * Thrown when a refresh token is past its expires_at.
 * Response: 401 Unauthorized
 */
public class TokenExpiredException extends CredentialException {

    public TokenExpiredException() {
        super("Token expired");
    }

    @Override
    public String getReason() {
        return "TOKEN_EXPIRED";
    }
}
