package com.example.importservice.repository;

import com.example.importservice.entity.ImportRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Repository for ImportRun entity.
 * History queries use query-by-example (see ImportDataService).
 */
@Repository
public interface ImportRunRepository extends JpaRepository<ImportRun, Long> {

    long countByStatus(ImportRun.RunStatus status);

    /**
     * Count runs with a given status started after a point in time.
     */
    long countByStatusAndStartedAtAfter(ImportRun.RunStatus status, LocalDateTime since);

    Optional<ImportRun> findFirstByOrderByStartedAtDesc();

    long countByTeamName(String teamName);

    long countByTeamNameAndStatus(String teamName, ImportRun.RunStatus status);

    Optional<ImportRun> findFirstByTeamNameOrderByStartedAtDesc(String teamName);
}
