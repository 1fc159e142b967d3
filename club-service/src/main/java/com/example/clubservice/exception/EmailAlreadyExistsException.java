package com.example.clubservice.exception;

/**
 * Thrown when email already exists during registration.
 * Response: 409 Conflict - "Email already registered"
 */
public class EmailAlreadyExistsException extends RuntimeException {

    public EmailAlreadyExistsException() {
        super("Email already registered");
    }
}
