package com.example.clubservice.exception;

/**
 * Thrown when login credentials are invalid.
 * Unknown email, wrong password and inactive account are not distinguished.
 * Response: 401 Unauthorized
 */
public class InvalidCredentialsException extends CredentialException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }

    @Override
    public String getReason() {
        return "AUTH_FAILED";
    }
}
