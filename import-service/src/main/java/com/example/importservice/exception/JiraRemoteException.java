package com.example.importservice.exception;

/**
 * Any other non-success answer from Jira (429, 5xx, unexpected 4xx).
 */
public class JiraRemoteException extends JiraClientException {

    public JiraRemoteException(String message, Integer statusCode) {
        super(message, statusCode);
    }

    public JiraRemoteException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
