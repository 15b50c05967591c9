package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of probing Jira with a configuration. Never carries credentials.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionTestResult {

    private boolean success;
    private String message;
    private JiraIdentity identity;

    public static ConnectionTestResult success(JiraIdentity identity) {
        return ConnectionTestResult.builder()
                .success(true)
                .message("Connected successfully as " + identity.displayName())
                .identity(identity)
                .build();
    }

    public static ConnectionTestResult failure(String message) {
        return ConnectionTestResult.builder()
                .success(false)
                .message(message)
                .build();
    }
}
