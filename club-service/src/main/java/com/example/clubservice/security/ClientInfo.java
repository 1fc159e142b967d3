package com.example.clubservice.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client metadata captured from the HTTP request: IP address and user agent.
 * Both are client controlled, so they are cut to the width of the columns they land in.
 */
public record ClientInfo(String ipAddress, String userAgent) {

    public static final int MAX_IP_ADDRESS_LENGTH = 45;
    public static final int MAX_USER_AGENT_LENGTH = 500;

    public static final ClientInfo UNKNOWN = new ClientInfo(null, null);

    public ClientInfo {
        ipAddress = truncate(ipAddress, MAX_IP_ADDRESS_LENGTH);
        userAgent = truncate(userAgent, MAX_USER_AGENT_LENGTH);
    }

    public static ClientInfo from(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        return new ClientInfo(resolveClientIp(request), request.getHeader("User-Agent"));
    }

    /**
     * Null-safe cut to at most {@code maxLength} characters.
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
