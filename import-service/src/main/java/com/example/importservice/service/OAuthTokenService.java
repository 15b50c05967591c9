package com.example.importservice.service;

import com.example.importservice.client.auth.AccessTokenProvider;
import com.example.importservice.client.external.AtlassianOAuthClient;
import com.example.importservice.dto.AccessibleResource;
import com.example.importservice.dto.AtlassianProfile;
import com.example.importservice.dto.AuthorizationRequest;
import com.example.importservice.dto.OAuthStatus;
import com.example.importservice.dto.TokenResponse;
import com.example.importservice.entity.OAuthCredential;
import com.example.importservice.exception.CredentialNotFoundException;
import com.example.importservice.exception.EncryptionException;
import com.example.importservice.exception.InvalidConfigurationException;
import com.example.importservice.exception.InvalidOAuthStateException;
import com.example.importservice.exception.NoRefreshTokenException;
import com.example.importservice.metrics.ImportMetrics;
import com.example.importservice.repository.OAuthCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Atlassian OAuth 2.0 (3LO) token lifecycle: authorization, storage, refresh, revocation.
 *
 * CRITICAL DESIGN:
 * - Tokens are stored encrypted (CredentialCodec), never logged
 * - Authorization states live in the shared OAuthStateStore, single-use, 10 minute TTL
 * - Refresh is single-flight per account: concurrent callers share one refresh call
 * - Identity provider calls run OUTSIDE transactions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OAuthTokenService implements AccessTokenProvider {

    static final Duration STATE_TTL = Duration.ofMinutes(10);
    private static final int STATE_BYTES = 32;
    private static final String JIRA_API_BASE = "https://api.atlassian.com/ex/jira/";

    private final AtlassianOAuthClient oauthClient;
    private final OAuthStateStore stateStore;
    private final OAuthCredentialRepository credentialRepository;
    private final CredentialCodec credentialCodec;
    private final ImportMetrics importMetrics;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();
    private final ConcurrentMap<String, CompletableFuture<TokenResponse>> inflightRefreshes = new ConcurrentHashMap<>();

    /**
     * Record a fresh state and build the consent URL bound to it.
     */
    public AuthorizationRequest beginAuthorization() {
        String state = newState();
        String url = oauthClient.buildAuthorizationUrl(state);

        Instant now = Instant.now(clock);
        stateStore.save(state, now, STATE_TTL);
        int purged = stateStore.purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired OAuth states", purged);
        }

        log.info("OAuth authorization started");
        return new AuthorizationRequest(url, state);
    }

    /**
     * Handle the callback: consume the state, exchange the code, and store tokens
     * together with the user's profile and first Jira-capable site.
     *
     * @throws InvalidOAuthStateException if the state is unknown, expired or reused
     */
    public OAuthCredential completeAuthorization(String code, String state) {
        if (state == null || state.isBlank() || !stateStore.consume(state)) {
            throw new InvalidOAuthStateException("Invalid or expired OAuth state");
        }
        if (code == null || code.isBlank()) {
            throw new InvalidConfigurationException("Missing authorization code");
        }

        TokenResponse tokens = oauthClient.exchangeAuthorizationCode(code);
        AtlassianProfile profile = oauthClient.getProfile(tokens.getAccessToken());
        List<AccessibleResource> sites = oauthClient.getAccessibleResources(tokens.getAccessToken());

        AccessibleResource site = sites.stream()
                .filter(AccessibleResource::grantsJiraAccess)
                .findFirst()
                .orElse(null);
        if (site == null) {
            log.warn("⚠️ No Jira site with Jira scopes is accessible for account={}", profile.getAccountId());
        }

        OAuthCredential saved = saveTokens(profile.getAccountId(), tokens, profile, site);
        log.info("OAuth authorization completed for account={}, site={}",
                saved.getAccountKey(), saved.getSiteUrl());
        return saved;
    }

    /**
     * Decrypted access token, refreshed first if expired.
     * Empty (never an exception) when the account cannot be served.
     */
    @Override
    public Optional<String> getValidAccessToken(String accountKey) {
        Optional<OAuthCredential> stored = credentialRepository.findByAccountKey(accountKey);
        if (stored.isEmpty()) {
            return Optional.empty();
        }

        OAuthCredential credential = stored.get();
        if (!credential.isExpired(Instant.now(clock))) {
            try {
                return Optional.of(credentialCodec.decrypt(credential.getAccessTokenEncrypted()));
            } catch (EncryptionException e) {
                log.error("Stored access token for account={} cannot be decrypted: {}", accountKey, e.getMessage());
                return Optional.empty();
            }
        }

        if (!credential.hasRefreshToken()) {
            log.warn("Access token expired and no refresh token available for account={}", accountKey);
            return Optional.empty();
        }

        try {
            return Optional.of(refreshOnce(accountKey).getAccessToken());
        } catch (RuntimeException e) {
            log.error("Failed to refresh expired token for account={}: {}", accountKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Explicit refresh.
     *
     * @throws NoRefreshTokenException if no record or no refresh token exists
     */
    public TokenResponse refresh(String accountKey) {
        return refreshOnce(accountKey);
    }

    /**
     * @throws CredentialNotFoundException if nothing is stored for the account
     */
    public void revoke(String accountKey) {
        OAuthCredential credential = credentialRepository.findByAccountKey(accountKey)
                .orElseThrow(() -> new CredentialNotFoundException(accountKey));
        credentialRepository.delete(credential);
        log.info("OAuth tokens deleted for account={}", accountKey);
    }

    public OAuthStatus getStatus(String accountKey) {
        return credentialRepository.findByAccountKey(accountKey)
                .map(credential -> {
                    boolean expired = credential.isExpired(Instant.now(clock));
                    return OAuthStatus.builder()
                            .authenticated(!expired || credential.hasRefreshToken())
                            .expired(expired)
                            .hasRefreshToken(credential.hasRefreshToken())
                            .expiresAt(credential.getExpiresAt())
                            .siteId(credential.getSiteId())
                            .siteUrl(credential.getSiteUrl())
                            .userEmail(credential.getUserEmail())
                            .userName(credential.getUserName())
                            .build();
                })
                .orElseGet(OAuthStatus::unauthenticated);
    }

    /**
     * Jira REST base URL for the account's site, routed through the OAuth gateway.
     */
    @Override
    public Optional<String> apiBaseUrl(String accountKey) {
        return credentialRepository.findByAccountKey(accountKey)
                .map(OAuthCredential::getSiteId)
                .map(siteId -> JIRA_API_BASE + siteId);
    }

    private TokenResponse refreshOnce(String accountKey) {
        CompletableFuture<TokenResponse> own = new CompletableFuture<>();
        CompletableFuture<TokenResponse> inflight = inflightRefreshes.putIfAbsent(accountKey, own);
        if (inflight != null) {
            log.debug("Joining in-flight token refresh for account={}", accountKey);
            return join(inflight);
        }

        try {
            TokenResponse response = performRefresh(accountKey);
            own.complete(response);
            return response;
        } catch (RuntimeException e) {
            own.completeExceptionally(e);
            throw e;
        } finally {
            inflightRefreshes.remove(accountKey, own);
        }
    }

    private TokenResponse performRefresh(String accountKey) {
        OAuthCredential credential = credentialRepository.findByAccountKey(accountKey)
                .filter(OAuthCredential::hasRefreshToken)
                .orElseThrow(() -> {
                    importMetrics.recordTokenRefresh("no_refresh_token");
                    return new NoRefreshTokenException(accountKey);
                });

        try {
            String refreshToken = credentialCodec.decrypt(credential.getRefreshTokenEncrypted());
            TokenResponse response = oauthClient.refreshAccessToken(refreshToken);
            saveTokens(accountKey, response, null, null);
            importMetrics.recordTokenRefresh("success");
            log.info("Refreshed OAuth access token for account={}", accountKey);
            return response;
        } catch (RuntimeException e) {
            importMetrics.recordTokenRefresh("failure");
            throw e;
        }
    }

    /**
     * Upsert by account key. Profile and site are only overwritten when supplied;
     * a response without a refresh token keeps the stored one.
     */
    private OAuthCredential saveTokens(String accountKey, TokenResponse tokens,
                                       AtlassianProfile profile, AccessibleResource site) {
        OAuthCredential credential = credentialRepository.findByAccountKey(accountKey)
                .orElseGet(() -> OAuthCredential.builder().accountKey(accountKey).build());

        credential.setAccessTokenEncrypted(credentialCodec.encrypt(tokens.getAccessToken()));
        if (tokens.getRefreshToken() != null) {
            credential.setRefreshTokenEncrypted(credentialCodec.encrypt(tokens.getRefreshToken()));
        }
        credential.setExpiresAt(Instant.now(clock).plusSeconds(tokens.getExpiresIn()));
        credential.setScope(tokens.getScope());

        if (profile != null) {
            credential.setUserAccountId(profile.getAccountId());
            credential.setUserEmail(profile.getEmail());
            credential.setUserName(profile.getName());
        }
        if (site != null) {
            credential.setSiteId(site.getId());
            credential.setSiteUrl(site.getUrl());
        }

        OAuthCredential saved = credentialRepository.save(credential);
        log.info("OAuth tokens saved for account={}, hasRefreshToken={}", accountKey, saved.hasRefreshToken());
        return saved;
    }

    private String newState() {
        byte[] bytes = new byte[STATE_BYTES];
        secureRandom.nextBytes(bytes);
        StringBuilder sb = new StringBuilder(STATE_BYTES * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static TokenResponse join(CompletableFuture<TokenResponse> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
