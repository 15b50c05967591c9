package com.example.importservice.client.auth;

import org.springframework.http.HttpHeaders;

/**
 * OAuth 2.0 access token.
 */
public class BearerTokenAuthentication implements JiraAuthentication {

    private final String accessToken;

    public BearerTokenAuthentication(String accessToken) {
        this.accessToken = accessToken;
    }

    @Override
    public void apply(HttpHeaders headers) {
        headers.setBearerAuth(accessToken);
    }
}
