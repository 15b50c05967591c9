package com.example.importservice.dto;

/**
 * The Jira user the credentials resolve to.
 */
public record JiraIdentity(String accountId, String displayName, String emailAddress) {
}
