package com.example.clubservice.audit;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadRedactorTest {

    @Test
    void redactsEverySensitiveTopLevelKey() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("password", "hunter22");
        payload.put("password_hash", "$2a$10$abc");
        payload.put("token", "t");
        payload.put("secret", "s");
        payload.put("api_key", "k");
        payload.put("credit_card", "4111111111111111");
        payload.put("email", "coach@club.test");

        Map<String, Object> redacted = PayloadRedactor.redact(payload);

        for (String field : PayloadRedactor.SENSITIVE_FIELDS) {
            assertEquals(PayloadRedactor.REDACTED_MARKER, redacted.get(field), field);
        }
        assertEquals("coach@club.test", redacted.get("email"));
    }

    @Test
    void leavesInputUntouched() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("password", "hunter22");

        Map<String, Object> redacted = PayloadRedactor.redact(payload);

        assertNotSame(payload, redacted);
        assertEquals("hunter22", payload.get("password"));
    }

    @Test
    void doesNotAddMissingKeys() {
        Map<String, Object> redacted = PayloadRedactor.redact(Map.of("name", "Yoga"));

        assertEquals(Map.of("name", "Yoga"), redacted);
    }

    @Test
    void onlyTopLevelKeysAreRedacted() {
        Map<String, Object> nested = Map.of("password", "inner");
        Map<String, Object> redacted = PayloadRedactor.redact(Map.of("profile", nested));

        assertEquals(nested, redacted.get("profile"));
    }

    @Test
    void nullPayloadStaysNull() {
        assertNull(PayloadRedactor.redact(null));
    }
}
