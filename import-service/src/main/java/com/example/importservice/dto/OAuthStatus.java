package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Token status for one account, without the tokens themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OAuthStatus {

    private boolean authenticated;
    private boolean expired;
    private boolean hasRefreshToken;
    private Instant expiresAt;
    private String siteId;
    private String siteUrl;
    private String userEmail;
    private String userName;

    public static OAuthStatus unauthenticated() {
        return OAuthStatus.builder().authenticated(false).build();
    }
}
