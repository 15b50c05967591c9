package com.example.importservice.exception;

/**
 * Thrown when a supplied credential (cookie header) is empty after sanitization.
 */
public class InvalidCredentialFormatException extends InvalidConfigurationException {

    public InvalidCredentialFormatException(String message) {
        super(message);
    }
}
