package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Normalized issue (task, story, bug) extracted from a Jira search result.
 * Sprint fields describe the most recently started sprint the issue was assigned to.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JiraIssueDto {

    private String key;
    private String issueType;
    private String summary;
    private String status;
    private LocalDate dueDate;
    private LocalDate created;
    private LocalDate updated;
    private LocalDate resolved;
    private String resolution;
    private Double storyPoints;
    private String epicLink;
    private String backlogPriority;

    private String sprintState;  // "backlog" when never assigned to a sprint
    private String lastAssignedSprint;
    private LocalDate sprintStartDate;
    private LocalDate sprintEndDate;
}
