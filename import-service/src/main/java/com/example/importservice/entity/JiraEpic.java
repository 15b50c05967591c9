package com.example.importservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Local mirror of a Jira epic, keyed by its Jira key.
 */
@Entity
@Table(name = "jira_epics",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_jira_epics_jira_key", columnNames = {"jira_key"})
        },
        indexes = {
                @Index(name = "idx_jira_epics_team_project", columnList = "team_name,project_key"),
                @Index(name = "idx_jira_epics_last_imported", columnList = "last_imported")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JiraEpic extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "jira_key", nullable = false, length = 50)
    private String jiraKey;

    @Column(name = "summary", length = 500)
    private String summary;

    @Column(name = "status", length = 100)
    private String status;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "priority", length = 50)
    private String priority;

    @Column(name = "fix_versions", length = 1000)
    private String fixVersions;

    @Column(name = "rough_estimate")
    private Double roughEstimate;

    @Column(name = "original_estimate")
    private Double originalEstimate;

    @Column(name = "remaining_estimate")
    private Double remainingEstimate;

    @Column(name = "team_name", nullable = false, length = 100)
    private String teamName;

    @Column(name = "project_key", nullable = false, length = 50)
    private String projectKey;

    @Column(name = "last_imported", nullable = false)
    private LocalDateTime lastImported;
}
