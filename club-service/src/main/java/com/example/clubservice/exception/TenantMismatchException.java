package com.example.clubservice.exception;

/**
 * Thrown by the tenant guard when a request references another organization.
 *
 * Carries the offending location and key (e.g. body / organization_id) for diagnosis,
 * never an organization identifier.
 * Response: 403 Forbidden
 */
public class TenantMismatchException extends RuntimeException {

    private final String location;
    private final String key;

    public TenantMismatchException(String location, String key) {
        super("Access denied: cannot access resources from another organization (" + location + "." + key + ")");
        this.location = location;
        this.key = key;
    }

    public String getLocation() {
        return location;
    }

    public String getKey() {
        return key;
    }
}
