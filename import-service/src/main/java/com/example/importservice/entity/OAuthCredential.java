package com.example.importservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Encrypted OAuth tokens and the profile/site they were granted for.
 */
@Entity
@Table(name = "oauth_credentials",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_oauth_credentials_account_key", columnNames = {"account_key"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OAuthCredential extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_key", nullable = false, length = 255)
    private String accountKey;

    @Column(name = "access_token_encrypted", nullable = false, length = 8192)
    private String accessTokenEncrypted;

    @Column(name = "refresh_token_encrypted", length = 8192)
    private String refreshTokenEncrypted;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "scope", length = 1000)
    private String scope;

    @Column(name = "site_id", length = 255)
    private String siteId;

    @Column(name = "site_url", length = 255)
    private String siteUrl;

    @Column(name = "user_account_id", length = 255)
    private String userAccountId;

    @Column(name = "user_email", length = 255)
    private String userEmail;

    @Column(name = "user_name", length = 255)
    private String userName;

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean hasRefreshToken() {
        return refreshTokenEncrypted != null;
    }
}
