package com.example.clubservice.exception;

/**
 * Base class for every authentication failure of the credential flow.
 *
 * All subclasses are answered with the same 401 body; the concrete reason
 * ({@link #getReason()}) is only written to the logs.
 */
public abstract class CredentialException extends RuntimeException {

    protected CredentialException(String message) {
        super(message);
    }

    /**
     * Internal reason code, e.g. TOKEN_REVOKED. Never returned to the client.
     */
    public abstract String getReason();
}
