package com.example.importservice.service;

import com.example.importservice.dto.AuthMode;
import com.example.importservice.dto.ClientConfig;
import com.example.importservice.entity.ImportConfig;
import com.example.importservice.repository.ImportConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Saved (team, project) connection settings.
 * Secrets are encrypted with {@link CredentialCodec} before they reach the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportConfigService {

    private final ImportConfigRepository importConfigRepository;
    private final CredentialCodec credentialCodec;

    @Transactional(readOnly = true)
    public Optional<ImportConfig> getImportConfig(String teamName, String projectKey) {
        return importConfigRepository.findByTeamNameAndProjectKey(teamName, projectKey);
    }

    /**
     * All configs ordered by team then project, optionally only active ones.
     */
    @Transactional(readOnly = true)
    public List<ImportConfig> getAllImportConfigs(boolean activeOnly) {
        return activeOnly
                ? importConfigRepository.findByActiveTrueOrderByTeamNameAscProjectKeyAsc()
                : importConfigRepository.findAllByOrderByTeamNameAscProjectKeyAsc();
    }

    /**
     * Insert or update the config for (team, project). Credentials of the other
     * auth modes are cleared so only the active mode's secret is kept.
     */
    @Transactional
    public ImportConfig saveImportConfig(ClientConfig config, boolean active) {
        config.requireValid();

        ImportConfig entity = importConfigRepository
                .findByTeamNameAndProjectKey(config.getTeamName(), config.getProjectKey())
                .orElseGet(() -> ImportConfig.builder()
                        .teamName(config.getTeamName())
                        .projectKey(config.getProjectKey())
                        .build());
        boolean created = entity.getId() == null;

        entity.setBaseUrl(config.normalizedBaseUrl());
        entity.setAuthMode(config.getAuthMode());
        entity.setImportSince(config.getImportSince());
        entity.setActive(active && isReplayable(config));
        entity.setEmail(null);
        entity.setApiTokenEncrypted(null);
        entity.setCookiesEncrypted(null);
        entity.setOauthAccountKey(null);

        switch (config.getAuthMode()) {
            case CREDENTIAL -> {
                entity.setEmail(config.getEmail());
                entity.setApiTokenEncrypted(credentialCodec.encrypt(config.getApiToken()));
            }
            case COOKIE -> entity.setCookiesEncrypted(credentialCodec.encrypt(config.getCookieString()));
            case OAUTH -> entity.setOauthAccountKey(config.getOauthAccountKey());
        }

        if (active && !entity.isActive()) {
            log.warn("Import config team={}, project={} has no OAuth account key; stored inactive "
                    + "because raw access tokens are not persisted", config.getTeamName(), config.getProjectKey());
        }

        ImportConfig saved = importConfigRepository.save(entity);
        log.info("{} import config: team={}, project={}, authMode={}, active={}",
                created ? "Created" : "Updated", saved.getTeamName(), saved.getProjectKey(),
                saved.getAuthMode(), saved.isActive());
        return saved;
    }

    /**
     * Called by every import: persists the config it was started with, as active.
     */
    @Transactional
    public ImportConfig saveFromClientConfig(ClientConfig config) {
        return saveImportConfig(config, true);
    }

    /**
     * A saved config can be run again later only if its secret survives storage.
     * A one-off OAuth access token does not; an account key does.
     */
    private static boolean isReplayable(ClientConfig config) {
        return config.getAuthMode() != AuthMode.OAUTH
                || (config.getOauthAccountKey() != null && !config.getOauthAccountKey().isBlank());
    }

    /**
     * Rebuild a client config with decrypted secrets.
     * OAuth configs resolve their token through the account key at request time.
     */
    public ClientConfig toClientConfig(ImportConfig config) {
        ClientConfig.ClientConfigBuilder builder = ClientConfig.builder()
                .baseUrl(config.getBaseUrl())
                .authMode(config.getAuthMode())
                .projectKey(config.getProjectKey())
                .teamName(config.getTeamName())
                .importSince(config.getImportSince());

        if (config.getAuthMode() == AuthMode.CREDENTIAL) {
            builder.email(config.getEmail())
                    .apiToken(credentialCodec.decryptNullable(config.getApiTokenEncrypted()));
        } else if (config.getAuthMode() == AuthMode.COOKIE) {
            builder.cookieString(credentialCodec.decryptNullable(config.getCookiesEncrypted()));
        } else {
            builder.oauthAccountKey(config.getOauthAccountKey());
        }
        return builder.build();
    }
}
