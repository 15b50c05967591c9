package com.example.importservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Atlassian OAuth 2.0 (3LO) application settings.
 */
@ConfigurationProperties(prefix = "atlassian.oauth")
@Getter
@Setter
public class AtlassianOAuthProperties {

    private String clientId;

    private String clientSecret;

    private String callbackUrl = "http://localhost:4000/oauth/callback";

    private String scopes = "read:jira-work read:jira-user write:jira-work offline_access";

    private String authBaseUrl = "https://auth.atlassian.com";

    private String apiBaseUrl = "https://api.atlassian.com";
}
