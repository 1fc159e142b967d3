package com.example.clubservice.exception;

/**
 * Thrown when an audit entry does not exist in the caller's organization.
 * Response: 404 Not Found
 */
public class AuditLogNotFoundException extends RuntimeException {

    public AuditLogNotFoundException(Long id) {
        super("Audit log not found: " + id);
    }
}
