package com.example.importservice.exception;

public class CredentialNotFoundException extends RuntimeException {

    public CredentialNotFoundException(String accountKey) {
        super("No OAuth credential stored for account: " + accountKey);
    }
}
