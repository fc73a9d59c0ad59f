package com.salonhub.authservice.services;

import lombok.Value;

/**
 * Where a request came from. Stored on refresh tokens and security events for forensics only; never
 * consulted for an authorization decision.
 */
@Value
public class ClientContext {

    public static final int MAX_IP_ADDRESS_LENGTH = 45;
    public static final int MAX_USER_AGENT_LENGTH = 255;

    private static final ClientContext UNKNOWN = new ClientContext(null, null);

    String ipAddress;
    String userAgent;

    public ClientContext(String ipAddress, String userAgent) {
        this.ipAddress = truncate(ipAddress, MAX_IP_ADDRESS_LENGTH);
        this.userAgent = truncate(userAgent, MAX_USER_AGENT_LENGTH);
    }

    public static ClientContext unknown() {
        return UNKNOWN;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
