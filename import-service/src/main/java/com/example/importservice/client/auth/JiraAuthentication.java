package com.example.importservice.client.auth;

import org.springframework.http.HttpHeaders;

/**
 * Applies one authentication scheme to outgoing Jira requests.
 */
public interface JiraAuthentication {

    void apply(HttpHeaders headers);
}
