package com.example.importservice.exception;

/**
 * Jira rejected the credentials (401), or no usable OAuth token exists.
 */
public class JiraUnauthorizedException extends JiraClientException {

    public JiraUnauthorizedException(String message, Integer statusCode) {
        super(message, statusCode);
    }
}
