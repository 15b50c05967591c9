package com.example.importservice.repository;

import com.example.importservice.entity.JiraIssue;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JiraIssueRepository extends JpaRepository<JiraIssue, Long> {

    Optional<JiraIssue> findByJiraKey(String jiraKey);

    long countByTeamName(String teamName);
}
