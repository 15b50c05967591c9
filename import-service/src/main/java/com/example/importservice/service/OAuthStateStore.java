package com.example.importservice.service;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared store of pending OAuth authorization states.
 * Visible to every instance; a state can be consumed once.
 */
public interface OAuthStateStore {

    void save(String state, Instant createdAt, Duration ttl);

    /**
     * Remove the state. True only for the single caller that removed it while unexpired.
     */
    boolean consume(String state);

    /**
     * Remove every expired state, returns how many were removed.
     */
    int purgeExpired();
}
