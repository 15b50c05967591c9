package com.example.importservice.client.external;

import com.example.importservice.config.AtlassianOAuthProperties;
import com.example.importservice.dto.AccessibleResource;
import com.example.importservice.dto.AtlassianProfile;
import com.example.importservice.dto.TokenResponse;
import com.example.importservice.exception.InvalidConfigurationException;
import com.example.importservice.exception.OAuthExchangeException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Client for Atlassian identity endpoints (OAuth 2.0 3LO).
 *
 * Token POSTs are never retried (authorization codes are single-use).
 * Profile and accessible-resources GETs retry on transient failures (atlassianRetry).
 * Must be called OUTSIDE @Transactional.
 */
@Component
@Slf4j
public class AtlassianOAuthClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<AccessibleResource>> RESOURCE_LIST =
            new ParameterizedTypeReference<>() {};

    private final WebClient atlassianWebClient;
    private final AtlassianOAuthProperties properties;

    public AtlassianOAuthClient(@Qualifier("atlassianWebClient") WebClient atlassianWebClient,
                                AtlassianOAuthProperties properties) {
        this.atlassianWebClient = atlassianWebClient;
        this.properties = properties;
    }

    /**
     * Consent URL carrying audience, client id, scopes, redirect URI and state.
     */
    public String buildAuthorizationUrl(String state) {
        requireClientId();
        return UriComponentsBuilder.fromHttpUrl(properties.getAuthBaseUrl())
                .path("/authorize")
                .queryParam("audience", "api.atlassian.com")
                .queryParam("client_id", properties.getClientId())
                .queryParam("scope", properties.getScopes())
                .queryParam("redirect_uri", properties.getCallbackUrl())
                .queryParam("state", state)
                .queryParam("response_type", "code")
                .queryParam("prompt", "consent")
                .encode()
                .toUriString();
    }

    public TokenResponse exchangeAuthorizationCode(String code) {
        Map<String, Object> body = tokenRequest("authorization_code");
        body.put("code", code);
        body.put("redirect_uri", properties.getCallbackUrl());
        return postToken(body, "Failed to exchange authorization code");
    }

    public TokenResponse refreshAccessToken(String refreshToken) {
        Map<String, Object> body = tokenRequest("refresh_token");
        body.put("refresh_token", refreshToken);
        return postToken(body, "Failed to refresh token");
    }

    @Retry(name = "atlassianRetry")
    public AtlassianProfile getProfile(String accessToken) {
        return get("/me", accessToken, "Failed to get user information",
                spec -> spec.bodyToMono(AtlassianProfile.class));
    }

    @Retry(name = "atlassianRetry")
    public List<AccessibleResource> getAccessibleResources(String accessToken) {
        List<AccessibleResource> resources = get("/oauth/token/accessible-resources", accessToken,
                "Failed to get accessible sites", spec -> spec.bodyToMono(RESOURCE_LIST));
        return resources != null ? resources : List.of();
    }

    private TokenResponse postToken(Map<String, Object> body, String failureMessage) {
        try {
            TokenResponse response = atlassianWebClient.post()
                    .uri(properties.getAuthBaseUrl() + "/oauth/token")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> toExchangeException(resp, failureMessage))
                    .bodyToMono(TokenResponse.class)
                    .timeout(TIMEOUT)
                    .block();

            if (response == null || response.getAccessToken() == null) {
                throw new OAuthExchangeException(failureMessage + ": empty token response", null);
            }
            return response;
        } catch (RuntimeException e) {
            throw translate(e, failureMessage);
        }
    }

    private <T> T get(String path, String accessToken, String failureMessage,
                      Function<WebClient.ResponseSpec, Mono<T>> bodyExtractor) {
        try {
            WebClient.ResponseSpec spec = atlassianWebClient.get()
                    .uri(properties.getApiBaseUrl() + path)
                    .headers(headers -> headers.setBearerAuth(accessToken))
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> toExchangeException(resp, failureMessage));
            return bodyExtractor.apply(spec)
                    .timeout(TIMEOUT)
                    .block();
        } catch (RuntimeException e) {
            throw translate(e, failureMessage);
        }
    }

    private Mono<OAuthExchangeException> toExchangeException(ClientResponse response, String failureMessage) {
        int status = response.statusCode().value();
        return response.bodyToMono(JSON_OBJECT)
                .onErrorResume(e -> Mono.empty())
                .defaultIfEmpty(Map.of())
                .map(body -> {
                    Object description = body.get("error_description");
                    String detail = description != null ? description.toString() : "HTTP " + status;
                    log.error("{}: status={}, error={}", failureMessage, status, body.get("error"));
                    return new OAuthExchangeException(failureMessage + ": " + detail, status);
                });
    }

    private static OAuthExchangeException translate(RuntimeException e, String failureMessage) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof OAuthExchangeException exchangeException) {
            return exchangeException;
        }
        log.error("{}: {}", failureMessage, cause.getMessage());
        return new OAuthExchangeException(failureMessage + ": " + cause.getMessage(), null, cause);
    }

    private Map<String, Object> tokenRequest(String grantType) {
        requireClientId();
        if (properties.getClientSecret() == null || properties.getClientSecret().isBlank()) {
            throw new InvalidConfigurationException("Atlassian OAuth client secret is not configured");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("grant_type", grantType);
        body.put("client_id", properties.getClientId());
        body.put("client_secret", properties.getClientSecret());
        return body;
    }

    private void requireClientId() {
        if (properties.getClientId() == null || properties.getClientId().isBlank()) {
            throw new InvalidConfigurationException("Atlassian OAuth client id is not configured");
        }
    }
}
