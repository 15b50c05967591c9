package com.example.importservice.exception;

/**
 * Base type for failures talking to the Jira REST API.
 * Carries the HTTP status when the remote answered at all.
 */
public class JiraClientException extends RuntimeException {

    private final Integer statusCode;

    public JiraClientException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public JiraClientException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
