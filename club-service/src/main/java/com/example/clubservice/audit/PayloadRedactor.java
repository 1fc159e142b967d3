package com.example.clubservice.audit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Masks sensitive top-level fields before a payload is written to the audit trail.
 *
 * Pure function: the input map is never modified, a shallow copy is returned.
 * Nested objects are copied as-is.
 */
public final class PayloadRedactor {

    public static final String REDACTED_MARKER = "[REDACTED]";

    static final Set<String> SENSITIVE_FIELDS = Set.of(
            "password",
            "password_hash",
            "token",
            "secret",
            "api_key",
            "credit_card"
    );

    private PayloadRedactor() {
    }

    /**
     * @param payload request payload or handler result, may be null
     * @return a copy with every sensitive key present replaced by {@link #REDACTED_MARKER}, null for null input
     */
    public static Map<String, Object> redact(Map<String, ?> payload) {
        if (payload == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>(payload);
        for (String field : SENSITIVE_FIELDS) {
            if (copy.containsKey(field)) {
                copy.put(field, REDACTED_MARKER);
            }
        }
        return copy;
    }
}
