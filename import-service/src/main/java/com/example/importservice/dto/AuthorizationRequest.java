package com.example.importservice.dto;

/**
 * URL the user is sent to for consent, plus the single-use state bound to it.
 */
public record AuthorizationRequest(String authorizationUrl, String state) {
}
