package com.example.importservice.client.auth;

import org.springframework.http.HttpHeaders;

/**
 * Browser session cookies. The raw value is sanitized once, at construction.
 */
public class CookieAuthentication implements JiraAuthentication {

    private final String cookieHeader;

    public CookieAuthentication(String rawCookies) {
        this.cookieHeader = CookieSanitizer.sanitize(rawCookies);
    }

    @Override
    public void apply(HttpHeaders headers) {
        headers.set(HttpHeaders.COOKIE, cookieHeader);
    }

    String cookieHeader() {
        return cookieHeader;
    }
}
