package com.example.importservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Local mirror of a Jira task, story or bug.
 * Denormalized: the latest sprint is flattened into the row.
 */
@Entity
@Table(name = "jira_issues",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_jira_issues_jira_key", columnNames = {"jira_key"})
        },
        indexes = {
                @Index(name = "idx_jira_issues_team_project", columnList = "team_name,project_key"),
                @Index(name = "idx_jira_issues_epic_link", columnList = "epic_link"),
                @Index(name = "idx_jira_issues_last_imported", columnList = "last_imported")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JiraIssue extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "jira_key", nullable = false, length = 50)
    private String jiraKey;

    @Column(name = "issue_type", length = 50)
    private String issueType;

    @Column(name = "summary", length = 500)
    private String summary;

    @Column(name = "status", length = 100)
    private String status;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "jira_created")
    private LocalDate jiraCreated;

    @Column(name = "jira_updated")
    private LocalDate jiraUpdated;

    @Column(name = "resolved")
    private LocalDate resolved;

    @Column(name = "resolution", length = 100)
    private String resolution;

    @Column(name = "story_points")
    private Double storyPoints;

    @Column(name = "epic_link", length = 50)
    private String epicLink;

    @Column(name = "backlog_priority", length = 255)
    private String backlogPriority;

    @Column(name = "sprint_state", length = 50)
    private String sprintState;

    @Column(name = "last_assigned_sprint", length = 255)
    private String lastAssignedSprint;

    @Column(name = "sprint_start_date")
    private LocalDate sprintStartDate;

    @Column(name = "sprint_end_date")
    private LocalDate sprintEndDate;

    @Column(name = "team_name", nullable = false, length = 100)
    private String teamName;

    @Column(name = "project_key", nullable = false, length = 50)
    private String projectKey;

    @Column(name = "last_imported", nullable = false)
    private LocalDateTime lastImported;
}
