package com.example.importservice.exception;

public class NoRefreshTokenException extends RuntimeException {

    public NoRefreshTokenException(String accountKey) {
        super("No refresh token available for account: " + accountKey);
    }
}
