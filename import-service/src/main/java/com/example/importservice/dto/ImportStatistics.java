package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Aggregate counts for dashboards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportStatistics {

    private long totalRuns;
    private long completedRuns;
    private long failedRuns;
    private long runningRuns;
    private long totalEpics;
    private long totalIssues;
    private long activeConfigs;
    private LocalDateTime lastImportAt;
    private long failedRunsLast24h;
}
