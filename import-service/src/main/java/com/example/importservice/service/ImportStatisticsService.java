package com.example.importservice.service;

import com.example.importservice.dto.ImportStatistics;
import com.example.importservice.dto.TeamImportStatistics;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.repository.ImportConfigRepository;
import com.example.importservice.repository.ImportRunRepository;
import com.example.importservice.repository.JiraEpicRepository;
import com.example.importservice.repository.JiraIssueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Dashboard counters over runs, mirrored records and configs.
 */
@Service
@RequiredArgsConstructor
public class ImportStatisticsService {

    private final ImportRunRepository importRunRepository;
    private final JiraEpicRepository jiraEpicRepository;
    private final JiraIssueRepository jiraIssueRepository;
    private final ImportConfigRepository importConfigRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public ImportStatistics getImportStatistics() {
        LocalDateTime dayAgo = LocalDateTime.now(clock).minusHours(24);

        return ImportStatistics.builder()
                .totalRuns(importRunRepository.count())
                .completedRuns(importRunRepository.countByStatus(ImportRun.RunStatus.COMPLETED))
                .failedRuns(importRunRepository.countByStatus(ImportRun.RunStatus.FAILED))
                .runningRuns(importRunRepository.countByStatus(ImportRun.RunStatus.STARTED))
                .failedRunsLast24h(importRunRepository.countByStatusAndStartedAtAfter(ImportRun.RunStatus.FAILED, dayAgo))
                .totalEpics(jiraEpicRepository.count())
                .totalIssues(jiraIssueRepository.count())
                .activeConfigs(importConfigRepository.countByActiveTrue())
                .lastImportAt(importRunRepository.findFirstByOrderByStartedAtDesc()
                        .map(ImportRun::getStartedAt)
                        .orElse(null))
                .build();
    }

    /**
     * Same counters restricted to one team, plus the projects it actively imports.
     */
    @Transactional(readOnly = true)
    public TeamImportStatistics getTeamStatistics(String teamName) {
        return TeamImportStatistics.builder()
                .teamName(teamName)
                .totalRuns(importRunRepository.countByTeamName(teamName))
                .completedRuns(importRunRepository.countByTeamNameAndStatus(teamName, ImportRun.RunStatus.COMPLETED))
                .failedRuns(importRunRepository.countByTeamNameAndStatus(teamName, ImportRun.RunStatus.FAILED))
                .lastImportAt(importRunRepository.findFirstByTeamNameOrderByStartedAtDesc(teamName)
                        .map(ImportRun::getStartedAt)
                        .orElse(null))
                .totalEpics(jiraEpicRepository.countByTeamName(teamName))
                .totalIssues(jiraIssueRepository.countByTeamName(teamName))
                .activeProjectKeys(importConfigRepository.findActiveProjectKeysByTeamName(teamName))
                .build();
    }
}
