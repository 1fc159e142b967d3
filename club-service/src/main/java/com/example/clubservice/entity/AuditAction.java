package com.example.clubservice.entity;

/**
 * Audit action kinds for AuditLog.
 *
 * Default kinds are derived from the HTTP verb (CREATE, UPDATE, DELETE, OTHER);
 * the others are set through a route's action override or by the
 * credential flow (LOGIN, FAILED_LOGIN).
 */
public enum AuditAction {
    // Entity lifecycle
    CREATE("created"),
    UPDATE("updated"),
    DELETE("deleted"),
    SOFT_DELETE("soft deleted"),
    RESTORE("restored"),

    // Authentication
    LOGIN("logged in"),
    LOGOUT("logged out"),
    FAILED_LOGIN("failed to login"),
    PASSWORD_CHANGE("changed password"),

    // Subscription lifecycle
    CANCEL("cancelled"),
    RENEW("renewed"),
    SUSPEND("suspended"),
    REACTIVATE("reactivated"),

    OTHER("performed action on");

    private final String pastTense;

    AuditAction(String pastTense) {
        this.pastTense = pastTense;
    }

    /**
     * Verb used in the human readable audit description.
     */
    public String pastTense() {
        return pastTense;
    }

    /**
     * Default action for an HTTP method: POST, PUT/PATCH, DELETE, anything else.
     */
    public static AuditAction fromHttpMethod(String method) {
        if (method == null) {
            return OTHER;
        }
        return switch (method.toUpperCase()) {
            case "POST" -> CREATE;
            case "PUT", "PATCH" -> UPDATE;
            case "DELETE" -> DELETE;
            default -> OTHER;
        };
    }
}
