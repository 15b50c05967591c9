package com.example.importservice.exception;

/**
 * Thrown when encryption/decryption of a stored credential fails.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
