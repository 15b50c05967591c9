package com.example.importservice.service;

import com.example.importservice.config.JpaConfig;
import com.example.importservice.repository.OAuthStateRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaConfig.class, JpaOAuthStateStore.class})
class JpaOAuthStateStoreTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    @Autowired
    private JpaOAuthStateStore stateStore;

    @Autowired
    private OAuthStateRepository oauthStateRepository;

    @Test
    void consume_FreshState_AcceptedExactlyOnce() {
        stateStore.save("state-1", Instant.now(), TTL);

        assertThat(stateStore.consume("state-1")).isTrue();
        assertThat(stateStore.consume("state-1")).isFalse();
        assertThat(oauthStateRepository.existsById("state-1")).isFalse();
    }

    @Test
    void consume_ExpiredState_RejectedAndRemoved() {
        stateStore.save("state-old", Instant.now().minus(Duration.ofMinutes(20)), TTL);

        assertThat(stateStore.consume("state-old")).isFalse();
        assertThat(oauthStateRepository.existsById("state-old")).isFalse();
    }

    @Test
    void consume_UnknownState_Rejected() {
        assertThat(stateStore.consume("never-issued")).isFalse();
    }

    @Test
    void purgeExpired_RemovesOnlyExpiredStates() {
        Instant now = Instant.now();
        stateStore.save("expired-1", now.minus(Duration.ofMinutes(30)), TTL);
        stateStore.save("expired-2", now.minus(Duration.ofMinutes(15)), TTL);
        stateStore.save("fresh", now, TTL);

        assertThat(stateStore.purgeExpired()).isEqualTo(2);
        assertThat(oauthStateRepository.findAll()).extracting("stateToken").containsExactly("fresh");
    }
}
