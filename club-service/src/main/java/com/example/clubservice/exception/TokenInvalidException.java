package com.example.clubservice.exception;

/**
 * Thrown when a refresh token is unknown or its owner can no longer authenticate.
 * Response: 401 Unauthorized
 */
public class TokenInvalidException extends CredentialException {

    public TokenInvalidException() {
        super("Token invalid");
    }

    public TokenInvalidException(String message) {
        super(message);
    }

    @Override
    public String getReason() {
        return "TOKEN_INVALID";
    }
}
