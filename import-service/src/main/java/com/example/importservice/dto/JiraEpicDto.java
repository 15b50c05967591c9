package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Normalized epic extracted from a Jira search result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JiraEpicDto {

    private String key;
    private String summary;
    private String status;
    private LocalDate dueDate;
    private String priority;
    private String fixVersions;  // comma-joined version names
    private Double roughEstimate;
    private Double originalEstimate;
    private Double remainingEstimate;
}
