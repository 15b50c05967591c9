package com.example.importservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Pending authorization state. Deleted on first use or after expiry.
 */
@Entity
@Table(name = "oauth_states", indexes = {
        @Index(name = "idx_oauth_states_expires_at", columnList = "expires_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OAuthState {

    @Id
    @Column(name = "state_token", nullable = false, length = 128)
    private String stateToken;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
