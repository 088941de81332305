package io.datahub.client.auth;

/**
 * Where and how tokens are requested.
 */
public record TokenEndpoint(String url, String grantType, String clientId) {

    public static final String DEFAULT_GRANT_TYPE = "password";
    public static final String DEFAULT_CLIENT_ID = "admin-cli";

    public TokenEndpoint {
        url = require(url, "url");
        grantType = require(grantType, "grantType");
        clientId = require(clientId, "clientId");
    }

    public static TokenEndpoint passwordGrant(String url) {
        return new TokenEndpoint(url, DEFAULT_GRANT_TYPE, DEFAULT_CLIENT_ID);
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
        return value.trim();
    }
}
