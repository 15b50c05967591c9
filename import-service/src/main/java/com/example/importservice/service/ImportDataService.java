package com.example.importservice.service;

import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.entity.JiraEpic;
import com.example.importservice.entity.JiraIssue;
import com.example.importservice.metrics.ImportMetrics;
import com.example.importservice.repository.ImportRunRepository;
import com.example.importservice.repository.JiraEpicRepository;
import com.example.importservice.repository.JiraIssueRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Example;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for database operations with transactional boundaries.
 *
 * CRITICAL DESIGN:
 * - @Transactional methods are SHORT-LIVED, one record or one run per transaction
 * - NO external API calls inside these methods
 * - Upserts are keyed by Jira key: find-or-create, then overwrite every field
 * - Tracks constraint violations for production monitoring
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportDataService {

    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 100;

    private final ImportRunRepository importRunRepository;
    private final JiraEpicRepository jiraEpicRepository;
    private final JiraIssueRepository jiraIssueRepository;
    private final DataMapper dataMapper;
    private final ImportMetrics importMetrics;
    private final Clock clock;

    /**
     * Create and persist a new run in STARTED status.
     */
    @Transactional
    public ImportRun createImportRun(String teamName, String projectKey, ImportRun.ImportKind kind,
                                     String correlationId) {
        ImportRun run = ImportRun.builder()
                .teamName(teamName)
                .projectKey(projectKey)
                .kind(kind)
                .build();
        run.markAsStarted(correlationId, now());

        ImportRun saved = importRunRepository.save(run);
        log.debug("Created import run id={} for team={}, project={}, kind={}", saved.getId(), teamName, projectKey, kind);
        return saved;
    }

    @Transactional
    public ImportRun completeImportRun(Long runId, int recordsProcessed) {
        ImportRun run = findRun(runId);
        run.markAsCompleted(recordsProcessed, now());
        ImportRun saved = importRunRepository.save(run);

        log.info("Import run id={} completed: records={}, duration={}ms",
                runId, recordsProcessed, saved.getDurationMs());
        return saved;
    }

    @Transactional
    public ImportRun failImportRun(Long runId, int recordsProcessed, String errorSummary) {
        ImportRun run = findRun(runId);
        run.markAsFailed(recordsProcessed, errorSummary, now());
        ImportRun saved = importRunRepository.save(run);

        log.error("Import run id={} failed: records={}, errors={}", runId, recordsProcessed, errorSummary);
        return saved;
    }

    /**
     * Insert or fully replace the epic with this key.
     */
    @Transactional
    public JiraEpic upsertEpic(JiraEpicDto dto, String teamName, String projectKey) {
        JiraEpic epic = jiraEpicRepository.findByJiraKey(dto.getKey()).orElseGet(JiraEpic::new);
        boolean created = epic.getId() == null;
        dataMapper.applyEpic(epic, dto, teamName, projectKey, now());

        try {
            JiraEpic saved = jiraEpicRepository.saveAndFlush(epic);
            log.debug("{} epic {}", created ? "Inserted" : "Updated", dto.getKey());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.error("❌ Data integrity violation in jira_epics for key={}: {}", dto.getKey(), e.getMessage());
            importMetrics.recordConstraintViolation();
            throw e;
        }
    }

    /**
     * Insert or fully replace the issue with this key.
     */
    @Transactional
    public JiraIssue upsertIssue(JiraIssueDto dto, String teamName, String projectKey) {
        JiraIssue issue = jiraIssueRepository.findByJiraKey(dto.getKey()).orElseGet(JiraIssue::new);
        boolean created = issue.getId() == null;
        dataMapper.applyIssue(issue, dto, teamName, projectKey, now());

        try {
            JiraIssue saved = jiraIssueRepository.saveAndFlush(issue);
            log.debug("{} issue {}", created ? "Inserted" : "Updated", dto.getKey());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.error("❌ Data integrity violation in jira_issues for key={}: {}", dto.getKey(), e.getMessage());
            importMetrics.recordConstraintViolation();
            throw e;
        }
    }

    /**
     * Runs newest first, optionally filtered by team and/or project.
     * Limit is clamped to 1..100.
     */
    @Transactional(readOnly = true)
    public List<ImportRun> findImportHistory(String teamName, String projectKey, Integer limit) {
        ImportRun criteria = new ImportRun();
        criteria.setTeamName(teamName);
        criteria.setProjectKey(projectKey);

        PageRequest page = PageRequest.of(0, clampLimit(limit), Sort.by(Sort.Direction.DESC, "startedAt"));
        return importRunRepository.findAll(Example.of(criteria), page).getContent();
    }

    @Transactional(readOnly = true)
    public List<JiraEpic> findEpics(String teamName, String projectKey) {
        JiraEpic criteria = JiraEpic.builder().teamName(teamName).projectKey(projectKey).build();
        return jiraEpicRepository.findAll(Example.of(criteria), Sort.by(Sort.Direction.DESC, "lastImported"));
    }

    @Transactional(readOnly = true)
    public List<JiraIssue> findIssues(String teamName, String projectKey) {
        JiraIssue criteria = JiraIssue.builder().teamName(teamName).projectKey(projectKey).build();
        return jiraIssueRepository.findAll(Example.of(criteria), Sort.by(Sort.Direction.DESC, "lastImported"));
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_HISTORY_LIMIT;
        }
        return Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
    }

    private ImportRun findRun(Long runId) {
        return importRunRepository.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("ImportRun not found: " + runId));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
