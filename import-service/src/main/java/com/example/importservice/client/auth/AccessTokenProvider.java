package com.example.importservice.client.auth;

import java.util.Optional;

/**
 * Resolves a usable OAuth access token for a stored account, refreshing if needed.
 * Empty when the account has no credential or it cannot be refreshed.
 */
public interface AccessTokenProvider {

    Optional<String> getValidAccessToken(String accountKey);

    /**
     * REST base URL delegated tokens must be sent to, empty when the account has no known site.
     */
    Optional<String> apiBaseUrl(String accountKey);
}
