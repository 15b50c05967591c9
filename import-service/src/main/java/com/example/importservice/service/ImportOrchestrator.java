package com.example.importservice.service;

import com.example.importservice.client.external.JiraClient;
import com.example.importservice.dto.ClientConfig;
import com.example.importservice.dto.ConnectionTestResult;
import com.example.importservice.dto.ImportResult;
import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.dto.RecordKind;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.entity.JiraEpic;
import com.example.importservice.entity.JiraIssue;
import com.example.importservice.exception.ImportPersistenceException;
import com.example.importservice.metrics.ImportMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Orchestrator for Jira imports.
 *
 * CRITICAL DESIGN:
 * - Jira calls OUTSIDE transactions, epics and issues fetched concurrently on importTaskExecutor
 * - Database writes INSIDE short transactions (via ImportDataService), one record at a time
 * - A failure of one kind never undoes the other kind; the run is FAILED if any kind failed
 * - Every import records exactly one ImportRun with a terminal status
 * - Correlation ID in MDC for tracing
 */
@Service
@Slf4j
public class ImportOrchestrator {

    private static final String CORRELATION_ID = "correlationId";

    private final JiraClient jiraClient;
    private final ImportDataService importDataService;
    private final ImportConfigService importConfigService;
    private final ImportMetrics importMetrics;
    private final Executor importTaskExecutor;

    public ImportOrchestrator(JiraClient jiraClient,
                              ImportDataService importDataService,
                              ImportConfigService importConfigService,
                              ImportMetrics importMetrics,
                              @Qualifier("importTaskExecutor") Executor importTaskExecutor) {
        this.jiraClient = jiraClient;
        this.importDataService = importDataService;
        this.importConfigService = importConfigService;
        this.importMetrics = importMetrics;
        this.importTaskExecutor = importTaskExecutor;
    }

    /**
     * Import one team's epics and/or issues.
     *
     * FLOW:
     * 1. Validate config (throws, no run recorded)
     * 2. Create run (STARTED)
     * 3. Save config, test connection (failure fails the run)
     * 4. Fetch requested kinds concurrently (OUTSIDE transaction)
     * 5. Upsert epics, then issues; a failed record aborts the rest of its kind
     * 6. Finish run: COMPLETED when error-free, FAILED otherwise
     *
     * @throws com.example.importservice.exception.InvalidConfigurationException if the config is invalid
     */
    public ImportResult performImport(ClientConfig config, ImportRun.ImportKind kind) {
        config.requireValid();

        long startTime = System.currentTimeMillis();
        String correlationId = "IMPORT-" + UUID.randomUUID().toString().substring(0, 8);
        boolean ownsMdc = MDC.get(CORRELATION_ID) == null;
        if (ownsMdc) {
            MDC.put(CORRELATION_ID, correlationId);
        }

        ImportRun run = null;
        try {
            log.info("Starting {} import for team={}, project={}", kind, config.getTeamName(), config.getProjectKey());
            importMetrics.recordRunStarted();

            run = importDataService.createImportRun(config.getTeamName(), config.getProjectKey(), kind, correlationId);
            importConfigService.saveFromClientConfig(config);

            ConnectionTestResult connection = jiraClient.testConnection(config);
            if (!connection.isSuccess()) {
                throw new IllegalStateException("Connection test failed: " + connection.getMessage());
            }

            // Fetch both kinds concurrently (OUTSIDE transaction)
            CompletableFuture<List<JiraEpicDto>> epicsFuture = kind.includesEpics()
                    ? fetchAsync(() -> jiraClient.fetchEpics(config))
                    : CompletableFuture.completedFuture(List.of());
            CompletableFuture<List<JiraIssueDto>> issuesFuture = kind.includesIssues()
                    ? fetchAsync(() -> jiraClient.fetchIssues(config))
                    : CompletableFuture.completedFuture(List.of());

            List<String> errors = new ArrayList<>();
            int epicsProcessed = 0;
            int issuesProcessed = 0;

            if (kind.includesEpics()) {
                try {
                    epicsProcessed = persistEpics(await(epicsFuture), config);
                } catch (RuntimeException e) {
                    String message = "Epic import failed: " + e.getMessage();
                    log.error("❌ {}", message, e);
                    errors.add(message);
                }
            }

            if (kind.includesIssues()) {
                try {
                    issuesProcessed = persistIssues(await(issuesFuture), config);
                } catch (RuntimeException e) {
                    String message = "Issue import failed: " + e.getMessage();
                    log.error("❌ {}", message, e);
                    errors.add(message);
                }
            }

            int recordsProcessed = epicsProcessed + issuesProcessed;
            long duration = System.currentTimeMillis() - startTime;
            ImportRun.RunStatus status;

            if (errors.isEmpty()) {
                importDataService.completeImportRun(run.getId(), recordsProcessed);
                status = ImportRun.RunStatus.COMPLETED;
                log.info("✅ Completed {} import for team={}, project={}: epics={}, issues={}, duration={}ms",
                        kind, config.getTeamName(), config.getProjectKey(), epicsProcessed, issuesProcessed, duration);
            } else {
                importDataService.failImportRun(run.getId(), recordsProcessed, String.join("; ", errors));
                status = ImportRun.RunStatus.FAILED;
                log.warn("⚠️ {} import for team={}, project={} finished with {} error(s): epics={}, issues={}",
                        kind, config.getTeamName(), config.getProjectKey(), errors.size(), epicsProcessed, issuesProcessed);
            }
            importMetrics.recordRunFinished(kind, status, duration);

            return ImportResult.builder()
                    .success(errors.isEmpty())
                    .epicsProcessed(epicsProcessed)
                    .issuesProcessed(issuesProcessed)
                    .errors(capErrors(errors))
                    .totalErrors(errors.size())
                    .runId(run.getId())
                    .correlationId(correlationId)
                    .durationMs(duration)
                    .build();

        } catch (Exception e) {
            String message = "Import failed: " + e.getMessage();
            log.error("❌ {} for team={}, project={}", message, config.getTeamName(), config.getProjectKey(), e);

            if (run != null) {
                recordFailure(run.getId(), message);
            }
            importMetrics.recordRunFinished(kind, ImportRun.RunStatus.FAILED, System.currentTimeMillis() - startTime);

            return ImportResult.builder()
                    .success(false)
                    .epicsProcessed(0)
                    .issuesProcessed(0)
                    .errors(List.of(message))
                    .totalErrors(1)
                    .runId(run != null ? run.getId() : null)
                    .correlationId(correlationId)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();
        } finally {
            if (ownsMdc) {
                MDC.remove(CORRELATION_ID);
            }
        }
    }

    /**
     * Most recent runs first, optionally filtered. Limit defaults to 50, clamped to 1..100.
     */
    public List<ImportRun> getImportHistory(String teamName, String projectKey, Integer limit) {
        return importDataService.findImportHistory(teamName, projectKey, limit);
    }

    public List<JiraEpic> getImportedEpics(String teamName, String projectKey) {
        return importDataService.findEpics(teamName, projectKey);
    }

    public List<JiraIssue> getImportedIssues(String teamName, String projectKey) {
        return importDataService.findIssues(teamName, projectKey);
    }

    private int persistEpics(List<JiraEpicDto> epics, ClientConfig config) {
        int processed = 0;
        for (JiraEpicDto epic : epics) {
            try {
                importDataService.upsertEpic(epic, config.getTeamName(), config.getProjectKey());
                processed++;
            } catch (RuntimeException e) {
                throw new ImportPersistenceException("Failed to import epic " + epic.getKey() + ": " + e.getMessage(), e);
            }
        }
        importMetrics.recordRecordsImported(RecordKind.EPIC, processed);
        log.info("Imported {} epics for team={}", processed, config.getTeamName());
        return processed;
    }

    private int persistIssues(List<JiraIssueDto> issues, ClientConfig config) {
        int processed = 0;
        for (JiraIssueDto issue : issues) {
            try {
                importDataService.upsertIssue(issue, config.getTeamName(), config.getProjectKey());
                processed++;
            } catch (RuntimeException e) {
                throw new ImportPersistenceException("Failed to import issue " + issue.getKey() + ": " + e.getMessage(), e);
            }
        }
        importMetrics.recordRecordsImported(RecordKind.ISSUE, processed);
        log.info("Imported {} issues for team={}", processed, config.getTeamName());
        return processed;
    }

    private <T> CompletableFuture<List<T>> fetchAsync(Supplier<List<T>> fetch) {
        return CompletableFuture.supplyAsync(fetch, importTaskExecutor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void recordFailure(Long runId, String message) {
        try {
            importDataService.failImportRun(runId, 0, message);
        } catch (RuntimeException e) {
            log.error("❌ Could not mark import run id={} as failed: {}", runId, e.getMessage(), e);
        }
    }

    private static List<String> capErrors(List<String> errors) {
        return List.copyOf(errors.subList(0, Math.min(errors.size(), ImportResult.MAX_REPORTED_ERRORS)));
    }
}
