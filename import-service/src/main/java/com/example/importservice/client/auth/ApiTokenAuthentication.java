package com.example.importservice.client.auth;

import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Basic auth with account email and API token.
 */
public class ApiTokenAuthentication implements JiraAuthentication {

    private final String encodedCredentials;

    public ApiTokenAuthentication(String email, String apiToken) {
        this.encodedCredentials = Base64.getEncoder()
                .encodeToString((email + ":" + apiToken).getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void apply(HttpHeaders headers) {
        headers.set(HttpHeaders.AUTHORIZATION, "Basic " + encodedCredentials);
    }
}
