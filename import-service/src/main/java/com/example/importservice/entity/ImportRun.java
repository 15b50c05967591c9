package com.example.importservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One attempt to import a team's Jira project.
 * Created STARTED and moved to a terminal status exactly once.
 */
@Entity
@Table(name = "import_runs", indexes = {
        @Index(name = "idx_import_runs_team_project", columnList = "team_name,project_key"),
        @Index(name = "idx_import_runs_started_at", columnList = "started_at"),
        @Index(name = "idx_import_runs_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportRun extends BaseEntity {

    static final int MAX_ERROR_SUMMARY_LENGTH = 4000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "team_name", nullable = false, length = 100)
    private String teamName;

    @Column(name = "project_key", nullable = false, length = 50)
    private String projectKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private ImportKind kind;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    @Column(name = "records_processed")
    private Integer recordsProcessed;

    @Column(name = "error_summary", length = MAX_ERROR_SUMMARY_LENGTH)
    private String errorSummary;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    /**
     * Execution duration in milliseconds, null while running.
     */
    public Long getDurationMs() {
        if (startedAt == null || endedAt == null) {
            return null;
        }
        return Duration.between(startedAt, endedAt).toMillis();
    }

    public boolean isFinished() {
        return status == RunStatus.COMPLETED || status == RunStatus.FAILED;
    }

    public void markAsStarted(String correlationId, LocalDateTime now) {
        this.status = RunStatus.STARTED;
        this.startedAt = now;
        this.correlationId = correlationId;
        this.recordsProcessed = 0;
    }

    public void markAsCompleted(int recordsProcessed, LocalDateTime now) {
        ensureRunning();
        this.status = RunStatus.COMPLETED;
        this.endedAt = now;
        this.recordsProcessed = recordsProcessed;
        this.errorSummary = null;
    }

    public void markAsFailed(int recordsProcessed, String errorSummary, LocalDateTime now) {
        ensureRunning();
        this.status = RunStatus.FAILED;
        this.endedAt = now;
        this.recordsProcessed = recordsProcessed;
        this.errorSummary = truncate(errorSummary);
    }

    private void ensureRunning() {
        if (isFinished()) {
            throw new IllegalStateException(
                    "Import run " + id + " already finished with status " + status);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_SUMMARY_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_SUMMARY_LENGTH);
    }

    public enum ImportKind {
        EPICS,
        ISSUES,
        FULL;

        public boolean includesEpics() {
            return this == EPICS || this == FULL;
        }

        public boolean includesIssues() {
            return this == ISSUES || this == FULL;
        }
    }

    public enum RunStatus {
        STARTED,
        COMPLETED,
        FAILED
    }
}
