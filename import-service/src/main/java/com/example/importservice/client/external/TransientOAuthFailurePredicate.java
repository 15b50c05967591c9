package com.example.importservice.client.external;

import com.example.importservice.exception.OAuthExchangeException;

import java.util.function.Predicate;

/**
 * Retry predicate for atlassianRetry: only network failures and 5xx answers.
 */
public class TransientOAuthFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof OAuthExchangeException e && e.isTransient();
    }
}
