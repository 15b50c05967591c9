package com.example.importservice.service;

import com.example.importservice.entity.OAuthState;
import com.example.importservice.repository.OAuthStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Database-backed state store (table oauth_states).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaOAuthStateStore implements OAuthStateStore {

    private final OAuthStateRepository oauthStateRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void save(String state, Instant createdAt, Duration ttl) {
        oauthStateRepository.save(OAuthState.builder()
                .stateToken(state)
                .createdAt(createdAt)
                .expiresAt(createdAt.plus(ttl))
                .build());
    }

    @Override
    @Transactional
    public boolean consume(String state) {
        int accepted = oauthStateRepository.deleteUnexpired(state, Instant.now(clock));
        if (accepted == 1) {
            return true;
        }
        // expired leftovers are removed too, but still rejected
        int expired = oauthStateRepository.deleteByToken(state);
        log.warn("Rejected OAuth state: {}", expired > 0 ? "expired" : "unknown or already used");
        return false;
    }

    @Override
    @Transactional
    public int purgeExpired() {
        return oauthStateRepository.deleteExpired(Instant.now(clock));
    }
}
