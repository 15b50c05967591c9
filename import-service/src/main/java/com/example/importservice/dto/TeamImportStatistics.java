package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Counts scoped to one team.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TeamImportStatistics {

    private String teamName;
    private long totalRuns;
    private long completedRuns;
    private long failedRuns;
    private LocalDateTime lastImportAt;
    private long totalEpics;
    private long totalIssues;
    private List<String> activeProjectKeys;
}
