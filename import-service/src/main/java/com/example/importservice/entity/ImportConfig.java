package com.example.importservice.entity;

import com.example.importservice.dto.AuthMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Saved connection settings for one (team, project) pair.
 * Secrets are stored encrypted, format {iv_base64}:{ciphertext_base64}.
 */
@Entity
@Table(name = "import_configs",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_import_configs_team_project",
                        columnNames = {"team_name", "project_key"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportConfig extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_name", nullable = false, length = 100)
    private String teamName;

    @Column(name = "project_key", nullable = false, length = 50)
    private String projectKey;

    @Column(name = "base_url", nullable = false, length = 255)
    private String baseUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "auth_mode", nullable = false, length = 20)
    private AuthMode authMode;

    @Column(name = "email", length = 255)
    private String email;

    @Column(name = "api_token_encrypted", length = 2048)
    private String apiTokenEncrypted;

    @Column(name = "cookies_encrypted", length = 8192)
    private String cookiesEncrypted;

    @Column(name = "oauth_account_key", length = 255)
    private String oauthAccountKey;

    @Column(name = "import_since", nullable = false)
    private LocalDate importSince;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;
}
