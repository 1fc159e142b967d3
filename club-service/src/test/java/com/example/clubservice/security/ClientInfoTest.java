package com.example.clubservice.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class ClientInfoTest {

    @Test
    void firstForwardedAddressWins() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.2");
        request.addHeader("User-Agent", "club-app/2.1");
        request.setRemoteAddr("10.0.0.2");

        ClientInfo client = ClientInfo.from(request);

        assertEquals("203.0.113.7", client.ipAddress());
        assertEquals("club-app/2.1", client.userAgent());
    }

    @Test
    void fallsBackToRemoteAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.168.1.20");

        ClientInfo client = ClientInfo.from(request);

        assertEquals("192.168.1.20", client.ipAddress());
        assertNull(client.userAgent());
    }

    @Test
    void oversizedHeadersAreCutToColumnWidth() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("User-Agent", "x".repeat(600));
        request.addHeader("X-Forwarded-For", "y".repeat(80) + ", 10.0.0.2");

        ClientInfo client = ClientInfo.from(request);

        assertEquals(ClientInfo.MAX_USER_AGENT_LENGTH, client.userAgent().length());
        assertEquals(ClientInfo.MAX_IP_ADDRESS_LENGTH, client.ipAddress().length());
    }
}
