package com.example.importservice.exception;

public class JiraForbiddenException extends JiraClientException {

    public JiraForbiddenException(String message) {
        super(message, 403);
    }
}
