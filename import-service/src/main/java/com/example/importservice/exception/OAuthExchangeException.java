package com.example.importservice.exception;

/**
 * Thrown when the Atlassian identity provider rejects or fails a request.
 * Message carries the provider's error_description when one was returned.
 */
public class OAuthExchangeException extends RuntimeException {

    private final Integer statusCode;

    public OAuthExchangeException(String message, Integer statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public OAuthExchangeException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Network failures and 5xx answers are worth retrying, 4xx are not.
     */
    public boolean isTransient() {
        return statusCode == null || statusCode >= 500;
    }
}
