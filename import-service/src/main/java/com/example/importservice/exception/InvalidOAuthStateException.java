package com.example.importservice.exception;

/**
 * Thrown when an OAuth callback presents a state that is unknown, expired or already used.
 */
public class InvalidOAuthStateException extends RuntimeException {

    public InvalidOAuthStateException(String message) {
        super(message);
    }
}
