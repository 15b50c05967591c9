package com.example.importservice.exception;

/**
 * Wraps a failed upsert of a single record. Aborts the remaining records of that kind.
 */
public class ImportPersistenceException extends RuntimeException {

    public ImportPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
