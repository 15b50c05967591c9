package com.example.importservice.dto;

import com.example.importservice.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientConfigTest {

    private static final ClientConfig VALID = ClientConfig.builder()
            .baseUrl("https://acme.atlassian.net/")
            .authMode(AuthMode.COOKIE)
            .cookieString("tenant.session.token=abc")
            .projectKey("SHOP")
            .teamName("Payments")
            .importSince(LocalDate.of(2024, 1, 1))
            .build();

    @Test
    void validate_CompleteConfig_NoErrors() {
        assertThat(VALID.validate()).isEmpty();
        assertThat(VALID.normalizedBaseUrl()).isEqualTo("https://acme.atlassian.net");
    }

    @Test
    void validate_CollectsEveryProblem() {
        ClientConfig broken = ClientConfig.builder()
                .baseUrl("ftp://acme")
                .authMode(AuthMode.CREDENTIAL)
                .email("dev@acme.test")
                .build();

        assertThat(broken.validate()).containsExactly(
                "Jira base URL must start with http or https",
                "Email and API token are required for API authentication",
                "Project key is required",
                "Team name is required",
                "Import start date is required");
    }

    @Test
    void validate_ModeSpecificCredentials() {
        assertThat(VALID.toBuilder().cookieString("  ").build().validate())
                .containsExactly("Cookies are required for cookie authentication");
        assertThat(VALID.toBuilder().authMode(AuthMode.OAUTH).build().validate()).hasSize(1);
        assertThat(VALID.toBuilder().authMode(AuthMode.OAUTH).oauthAccountKey("acct-1").build().validate()).isEmpty();
        assertThat(VALID.toBuilder().baseUrl(null).build().validate())
                .containsExactly("Jira base URL is required");
    }

    @Test
    void requireValid_ThrowsWithAllMessages() {
        assertThatThrownBy(() -> VALID.toBuilder().projectKey("").teamName(null).build().requireValid())
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessage("Invalid Jira configuration: Project key is required, Team name is required");
    }

    @Test
    void toString_HidesSecrets() {
        ClientConfig config = VALID.toBuilder().apiToken("api-secret").accessToken("bearer-secret").build();

        assertThat(config.toString())
                .doesNotContain("tenant.session.token", "api-secret", "bearer-secret")
                .contains("SHOP");
    }
}
