package com.example.importservice.dto;

/**
 * How requests to Jira are authenticated.
 */
public enum AuthMode {
    /** Basic auth with account email and API token. */
    CREDENTIAL,
    /** Browser session cookies copied by the user. */
    COOKIE,
    /** OAuth 2.0 (3LO) bearer token, supplied directly or resolved by account key. */
    OAUTH
}
