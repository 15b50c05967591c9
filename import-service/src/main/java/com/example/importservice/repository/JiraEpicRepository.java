package com.example.importservice.repository;

import com.example.importservice.entity.JiraEpic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JiraEpicRepository extends JpaRepository<JiraEpic, Long> {

    Optional<JiraEpic> findByJiraKey(String jiraKey);

    long countByTeamName(String teamName);
}
