package com.example.importservice.repository;

import com.example.importservice.entity.ImportConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ImportConfigRepository extends JpaRepository<ImportConfig, Long> {

    Optional<ImportConfig> findByTeamNameAndProjectKey(String teamName, String projectKey);

    List<ImportConfig> findByActiveTrueOrderByTeamNameAscProjectKeyAsc();

    List<ImportConfig> findAllByOrderByTeamNameAscProjectKeyAsc();

    long countByActiveTrue();

    @Query("SELECT DISTINCT c.projectKey FROM ImportConfig c WHERE c.teamName = :teamName AND c.active = true "
            + "ORDER BY c.projectKey")
    List<String> findActiveProjectKeysByTeamName(@Param("teamName") String teamName);
}
