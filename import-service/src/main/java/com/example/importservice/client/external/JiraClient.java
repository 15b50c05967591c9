package com.example.importservice.client.external;

import com.example.importservice.client.auth.AccessTokenProvider;
import com.example.importservice.client.auth.ApiTokenAuthentication;
import com.example.importservice.client.auth.BearerTokenAuthentication;
import com.example.importservice.client.auth.CookieAuthentication;
import com.example.importservice.client.auth.JiraAuthentication;
import com.example.importservice.dto.AuthMode;
import com.example.importservice.dto.ClientConfig;
import com.example.importservice.dto.ConnectionTestResult;
import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIdentity;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.dto.JiraSearchPage;
import com.example.importservice.dto.RecordKind;
import com.example.importservice.exception.InvalidCredentialFormatException;
import com.example.importservice.exception.JiraClientException;
import com.example.importservice.exception.JiraForbiddenException;
import com.example.importservice.exception.JiraRemoteException;
import com.example.importservice.exception.JiraUnauthorizedException;
import com.example.importservice.exception.JiraUnreachableException;
import com.example.importservice.metrics.ImportMetrics;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Client for the Jira Cloud REST API (v3).
 *
 * CRITICAL DESIGN:
 * - Blocking calls on WebClient, must be called OUTSIDE @Transactional
 * - Cursor pagination (nextPageToken), hard ceiling of maxPages per search
 * - Every search page passes the jiraRateLimiter
 * - Failures are classified into typed JiraClientException subclasses
 */
@Component
@Slf4j
public class JiraClient {

    static final int PAGE_SIZE = 100;

    static final List<String> SEARCH_FIELDS = List.of(
            "key", "summary", "status", "duedate", "priority", "customfield_10112",
            "fixVersions", "customfield_10192", "customfield_10193", "customfield_10194",
            "issuetype", "created", "updated", "resolutiondate", "resolution",
            "customfield_10033", "customfield_10014", "customfield_10019", "customfield_10020");

    static final String UNREACHABLE_MESSAGE = "Cannot connect to Jira server. Please check the URL.";

    private static final String SEARCH_PATH = "/rest/api/3/search/jql";
    private static final String MYSELF_PATH = "/rest/api/3/myself";
    private static final String USER_AGENT = "JiraImportService/1.0";

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final WebClient jiraWebClient;
    private final AccessTokenProvider accessTokenProvider;
    private final JiraRecordExtractor extractor;
    private final ImportMetrics importMetrics;
    private final RateLimiter rateLimiter;
    private final Duration timeout;
    private final int maxPages;

    public JiraClient(@Qualifier("jiraWebClient") WebClient jiraWebClient,
                      AccessTokenProvider accessTokenProvider,
                      JiraRecordExtractor extractor,
                      ImportMetrics importMetrics,
                      RateLimiterRegistry rateLimiterRegistry,
                      @Value("${jira.client.timeout-seconds:30}") int timeoutSeconds,
                      @Value("${jira.client.max-pages:50}") int maxPages) {
        this.jiraWebClient = jiraWebClient;
        this.accessTokenProvider = accessTokenProvider;
        this.extractor = extractor;
        this.importMetrics = importMetrics;
        this.rateLimiter = rateLimiterRegistry.rateLimiter("jiraRateLimiter");
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.maxPages = maxPages;
    }

    /**
     * JQL selecting the team's records of one kind, resolved on or after importSince or unresolved.
     *
     * Values are interpolated as-is: a double quote in the project key or team name
     * produces invalid JQL.
     */
    public String buildQuery(RecordKind kind, ClientConfig config) {
        String scope = String.format(
                "project = \"%s\" AND \"Team (Development)[Dropdown]\" in (\"%s\") "
                        + "AND (resolutiondate >= %s OR resolutiondate IS EMPTY)",
                config.getProjectKey(), config.getTeamName(), config.getImportSince());

        return switch (kind) {
            case EPIC -> scope + " AND issuetype = Epic ORDER BY Rank ASC";
            case ISSUE -> scope + " AND issuetype in (Task, Story, \"Bug (new development)\", Bug) ORDER BY Rank ASC";
        };
    }

    /**
     * Resolve the authentication scheme for a config.
     * OAuth without an explicit token asks the token provider (may refresh).
     *
     * @throws InvalidCredentialFormatException if cookies sanitize to nothing
     * @throws JiraUnauthorizedException if no usable OAuth token exists
     */
    public JiraAuthentication authenticate(ClientConfig config) {
        return switch (config.getAuthMode()) {
            case CREDENTIAL -> new ApiTokenAuthentication(config.getEmail(), config.getApiToken());
            case COOKIE -> new CookieAuthentication(config.getCookieString());
            case OAUTH -> new BearerTokenAuthentication(resolveAccessToken(config));
        };
    }

    /**
     * Calls GET /rest/api/3/myself. Remote failures and unusable cookies are reported
     * in the result, not thrown.
     */
    public ConnectionTestResult testConnection(ClientConfig config) {
        try {
            JiraAuthentication auth = authenticate(config);
            Map<String, Object> me = exchange(jiraWebClient.get()
                    .uri(resolveBaseUrl(config) + MYSELF_PATH)
                    .headers(headers -> prepareHeaders(headers, auth)), config.getAuthMode());

            JiraIdentity identity = new JiraIdentity(
                    (String) me.get("accountId"),
                    (String) me.get("displayName"),
                    (String) me.get("emailAddress"));

            log.info("Jira connection test successful: user={}, authMode={}",
                    identity.displayName(), config.getAuthMode());
            return ConnectionTestResult.success(identity);

        } catch (JiraClientException e) {
            log.error("Jira connection test failed: status={}, authMode={}, error={}",
                    e.getStatusCode(), config.getAuthMode(), e.getMessage());

            String message = e instanceof JiraRemoteException ? "Connection failed" : e.getMessage();
            String status = e.getStatusCode() != null ? e.getStatusCode().toString() : "Unknown";
            return ConnectionTestResult.failure(message + " (Status: " + status + ")");

        } catch (InvalidCredentialFormatException e) {
            log.warn("Jira connection test rejected credentials before sending: authMode={}, error={}",
                    config.getAuthMode(), e.getMessage());
            return ConnectionTestResult.failure(e.getMessage());
        }
    }

    /**
     * Lazily page through every record matching the kind's JQL.
     *
     * Stops on an empty page, a missing/empty cursor, or after maxPages pages
     * (WARN + jira_page_limit_reached_total). Errors propagate to the consumer.
     */
    public Stream<Map<String, Object>> fetchAll(RecordKind kind, ClientConfig config) {
        String jql = buildQuery(kind, config);
        JiraAuthentication auth = authenticate(config);
        String baseUrl = resolveBaseUrl(config);
        log.info("Starting Jira {} fetch: team={}, project={}, jql={}",
                kind.tag(), config.getTeamName(), config.getProjectKey(), jql);

        Iterator<Map<String, Object>> records = new PagedSearchIterator(kind, jql, baseUrl, config, auth);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(records, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    public List<JiraEpicDto> fetchEpics(ClientConfig config) {
        return fetchAll(RecordKind.EPIC, config)
                .map(extractor::toEpic)
                .toList();
    }

    public List<JiraIssueDto> fetchIssues(ClientConfig config) {
        return fetchAll(RecordKind.ISSUE, config)
                .map(extractor::toIssue)
                .toList();
    }

    /**
     * Request body for one search page.
     */
    Map<String, Object> buildSearchRequest(String jql, String nextPageToken) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jql", jql);
        body.put("maxResults", PAGE_SIZE);
        body.put("fields", SEARCH_FIELDS);
        if (nextPageToken != null && !nextPageToken.isEmpty()) {
            body.put("nextPageToken", nextPageToken);
        }
        return body;
    }

    private JiraSearchPage fetchPage(String jql, String nextPageToken, String baseUrl,
                                     ClientConfig config, JiraAuthentication auth) {
        Map<String, Object> body = buildSearchRequest(jql, nextPageToken);

        Map<String, Object> response = RateLimiter.decorateSupplier(rateLimiter, () -> exchange(
                jiraWebClient.post()
                        .uri(baseUrl + SEARCH_PATH)
                        .headers(headers -> prepareHeaders(headers, auth))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body),
                config.getAuthMode())).get();

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> issues = (List<Map<String, Object>>) response.get("issues");
        return new JiraSearchPage(issues, (String) response.get("nextPageToken"));
    }

    private Map<String, Object> exchange(WebClient.RequestHeadersSpec<?> request, AuthMode authMode) {
        try {
            return request.retrieve()
                    .onStatus(HttpStatusCode::isError, response ->
                            Mono.error(classify(response.statusCode(), authMode)))
                    .bodyToMono(JSON_OBJECT)
                    .timeout(timeout)
                    .blockOptional()
                    .orElse(Map.of());
        } catch (JiraClientException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof JiraClientException jiraException) {
                throw jiraException;
            }
            if (cause instanceof WebClientRequestException || cause instanceof TimeoutException) {
                log.error("Jira unreachable: {}", cause.getMessage());
                throw new JiraUnreachableException(UNREACHABLE_MESSAGE, cause);
            }
            log.error("Unexpected error calling Jira: {}", cause.getMessage(), cause);
            throw new JiraRemoteException("Unexpected error calling Jira: " + cause.getMessage(), null, cause);
        }
    }

    JiraClientException classify(HttpStatusCode status, AuthMode authMode) {
        if (status.value() == HttpStatus.UNAUTHORIZED.value()) {
            log.error("Jira authentication failed (401), authMode={}", authMode);
            return new JiraUnauthorizedException(unauthorizedMessage(authMode), status.value());
        }
        if (status.value() == HttpStatus.FORBIDDEN.value()) {
            log.error("Jira access forbidden (403)");
            return new JiraForbiddenException("Access forbidden. Please check your permissions.");
        }
        if (status.value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
            log.warn("Jira rate limit exceeded (429)");
            return new JiraRemoteException("Jira rate limit exceeded", status.value());
        }
        log.error("Jira request failed: status={}", status.value());
        return new JiraRemoteException("Jira request failed with status " + status.value(), status.value());
    }

    private static String unauthorizedMessage(AuthMode authMode) {
        return switch (authMode) {
            case COOKIE -> "Invalid or expired cookies. Please refresh your browser session and copy new cookies.";
            case OAUTH -> "OAuth access token rejected. Please re-authorize the account.";
            case CREDENTIAL -> "Invalid API credentials. Please check your email and API token.";
        };
    }

    private String resolveAccessToken(ClientConfig config) {
        if (!isBlank(config.getAccessToken())) {
            return config.getAccessToken();
        }
        String accountKey = config.getOauthAccountKey();
        return accessTokenProvider.getValidAccessToken(accountKey)
                .orElseThrow(() -> new JiraUnauthorizedException(
                        "No valid OAuth access token for account " + accountKey + ". Please re-authorize.", null));
    }

    /**
     * Delegated accounts are served through the OAuth gateway for their site; every other
     * config, including OAuth with an explicit token, talks to its own base URL.
     */
    String resolveBaseUrl(ClientConfig config) {
        if (config.getAuthMode() == AuthMode.OAUTH
                && isBlank(config.getAccessToken())
                && !isBlank(config.getOauthAccountKey())) {
            return accessTokenProvider.apiBaseUrl(config.getOauthAccountKey())
                    .orElseGet(config::normalizedBaseUrl);
        }
        return config.normalizedBaseUrl();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void prepareHeaders(HttpHeaders headers, JiraAuthentication auth) {
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        auth.apply(headers);
    }

    /**
     * Walks search pages on demand, one page buffered at a time.
     */
    private final class PagedSearchIterator implements Iterator<Map<String, Object>> {

        private final RecordKind kind;
        private final String jql;
        private final String baseUrl;
        private final ClientConfig config;
        private final JiraAuthentication auth;

        private Iterator<Map<String, Object>> page = Collections.emptyIterator();
        private String cursor;
        private int pagesFetched;
        private int recordsFetched;
        private boolean exhausted;

        private PagedSearchIterator(RecordKind kind, String jql, String baseUrl,
                                    ClientConfig config, JiraAuthentication auth) {
            this.kind = kind;
            this.jql = jql;
            this.baseUrl = baseUrl;
            this.config = config;
            this.auth = auth;
        }

        @Override
        public boolean hasNext() {
            while (!page.hasNext()) {
                if (exhausted) {
                    return false;
                }
                if (pagesFetched >= maxPages) {
                    log.warn("⚠️ Jira {} fetch stopped after {} pages (more than {} records) for project={}",
                            kind.tag(), maxPages, maxPages * PAGE_SIZE, config.getProjectKey());
                    importMetrics.recordPageLimitReached(kind);
                    finish();
                    return false;
                }

                JiraSearchPage result = fetchPage(jql, cursor, baseUrl, config, auth);
                pagesFetched++;

                if (result.issues().isEmpty()) {
                    finish();
                    return false;
                }
                page = result.issues().iterator();
                recordsFetched += result.issues().size();
                log.debug("Jira {} page {} fetched: {} records", kind.tag(), pagesFetched, result.issues().size());

                if (result.hasNextPage()) {
                    cursor = result.nextPageToken();
                } else {
                    finish();
                }
            }
            return true;
        }

        @Override
        public Map<String, Object> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }

        private void finish() {
            if (!exhausted) {
                exhausted = true;
                log.info("Jira {} fetch completed: records={}, pages={}",
                        kind.tag(), recordsFetched, pagesFetched);
            }
        }
    }
}
