package com.example.importservice.exception;

/**
 * Thrown when a client configuration fails validation.
 * Raised before any import run is recorded.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}
