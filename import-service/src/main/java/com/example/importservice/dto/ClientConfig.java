package com.example.importservice.dto;

import com.example.importservice.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to reach one Jira project for one team.
 * Immutable; credentials are excluded from toString.
 */
@Value
@Builder(toBuilder = true)
public class ClientConfig {

    String baseUrl;
    AuthMode authMode;

    String email;
    @ToString.Exclude
    String apiToken;

    @ToString.Exclude
    String cookieString;

    @ToString.Exclude
    String accessToken;
    String oauthAccountKey;

    String projectKey;
    String teamName;
    LocalDate importSince;

    /**
     * Collect every validation problem, empty when the config is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        if (isBlank(baseUrl)) {
            errors.add("Jira base URL is required");
        } else if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            errors.add("Jira base URL must start with http or https");
        }

        if (authMode == null) {
            errors.add("Authentication mode is required");
        } else {
            switch (authMode) {
                case CREDENTIAL -> {
                    if (isBlank(email) || isBlank(apiToken)) {
                        errors.add("Email and API token are required for API authentication");
                    }
                }
                case COOKIE -> {
                    if (isBlank(cookieString)) {
                        errors.add("Cookies are required for cookie authentication");
                    }
                }
                case OAUTH -> {
                    if (isBlank(accessToken) && isBlank(oauthAccountKey)) {
                        errors.add("An access token or OAuth account key is required for OAuth authentication");
                    }
                }
            }
        }

        if (isBlank(projectKey)) {
            errors.add("Project key is required");
        }
        if (isBlank(teamName)) {
            errors.add("Team name is required");
        }
        if (importSince == null) {
            errors.add("Import start date is required");
        }
        return errors;
    }

    /**
     * @throws InvalidConfigurationException listing all problems
     */
    public void requireValid() {
        List<String> errors = validate();
        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException("Invalid Jira configuration: " + String.join(", ", errors));
        }
    }

    /**
     * Base URL without trailing slashes, ready for path concatenation.
     */
    public String normalizedBaseUrl() {
        return baseUrl.replaceAll("/+$", "");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
