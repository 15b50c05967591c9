package com.example.importservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;

/**
 * JPA configuration.
 *
 * Enables JPA auditing for created_at/updated_at and exposes the clock used for
 * import timestamps and token expiry checks.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
