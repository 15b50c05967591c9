package com.example.importservice.exception;

/**
 * Connection refused, DNS failure or timeout. No HTTP status is available.
 */
public class JiraUnreachableException extends JiraClientException {

    public JiraUnreachableException(String message, Throwable cause) {
        super(message, null, cause);
    }
}
