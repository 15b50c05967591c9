package com.example.importservice.client.external;

import com.example.importservice.exception.OAuthExchangeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransientOAuthFailurePredicateTest {

    private final TransientOAuthFailurePredicate predicate = new TransientOAuthFailurePredicate();

    @Test
    void retriesNetworkFailuresAndServerErrors() {
        assertThat(predicate.test(new OAuthExchangeException("Failed to get user information: timeout", null))).isTrue();
        assertThat(predicate.test(new OAuthExchangeException("Failed to get user information: HTTP 503", 503))).isTrue();
    }

    @Test
    void doesNotRetryClientErrorsOrOtherExceptions() {
        assertThat(predicate.test(new OAuthExchangeException("Failed to get user information: HTTP 401", 401))).isFalse();
        assertThat(predicate.test(new IllegalStateException("boom"))).isFalse();
    }
}
