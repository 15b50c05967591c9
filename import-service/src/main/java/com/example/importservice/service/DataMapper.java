package com.example.importservice.service;

import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.entity.JiraEpic;
import com.example.importservice.entity.JiraIssue;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Copies normalized Jira DTOs onto entities.
 * Every descriptive field is overwritten, so an upsert fully replaces the previous snapshot.
 */
@Component
public class DataMapper {

    private static final int SUMMARY_MAX_LENGTH = 500;

    public void applyEpic(JiraEpic target, JiraEpicDto dto, String teamName, String projectKey,
                          LocalDateTime importedAt) {
        target.setJiraKey(dto.getKey());
        target.setSummary(truncate(dto.getSummary(), SUMMARY_MAX_LENGTH));
        target.setStatus(dto.getStatus());
        target.setDueDate(dto.getDueDate());
        target.setPriority(dto.getPriority());
        target.setFixVersions(dto.getFixVersions());
        target.setRoughEstimate(dto.getRoughEstimate());
        target.setOriginalEstimate(dto.getOriginalEstimate());
        target.setRemainingEstimate(dto.getRemainingEstimate());
        target.setTeamName(teamName);
        target.setProjectKey(projectKey);
        target.setLastImported(importedAt);
    }

    public void applyIssue(JiraIssue target, JiraIssueDto dto, String teamName, String projectKey,
                           LocalDateTime importedAt) {
        target.setJiraKey(dto.getKey());
        target.setIssueType(dto.getIssueType());
        target.setSummary(truncate(dto.getSummary(), SUMMARY_MAX_LENGTH));
        target.setStatus(dto.getStatus());
        target.setDueDate(dto.getDueDate());
        target.setJiraCreated(dto.getCreated());
        target.setJiraUpdated(dto.getUpdated());
        target.setResolved(dto.getResolved());
        target.setResolution(dto.getResolution());
        target.setStoryPoints(dto.getStoryPoints());
        target.setEpicLink(dto.getEpicLink());
        target.setBacklogPriority(dto.getBacklogPriority());
        target.setSprintState(dto.getSprintState());
        target.setLastAssignedSprint(dto.getLastAssignedSprint());
        target.setSprintStartDate(dto.getSprintStartDate());
        target.setSprintEndDate(dto.getSprintEndDate());
        target.setTeamName(teamName);
        target.setProjectKey(projectKey);
        target.setLastImported(importedAt);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
