package com.example.importservice.service;

import com.example.importservice.config.JpaConfig;
import com.example.importservice.dto.AuthMode;
import com.example.importservice.dto.ImportStatistics;
import com.example.importservice.dto.TeamImportStatistics;
import com.example.importservice.entity.ImportConfig;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.entity.JiraEpic;
import com.example.importservice.entity.JiraIssue;
import com.example.importservice.repository.ImportConfigRepository;
import com.example.importservice.repository.ImportRunRepository;
import com.example.importservice.repository.JiraEpicRepository;
import com.example.importservice.repository.JiraIssueRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaConfig.class, ImportStatisticsService.class})
class ImportStatisticsServiceTest {

    @Autowired
    private ImportStatisticsService importStatisticsService;

    @Autowired
    private ImportRunRepository importRunRepository;

    @Autowired
    private JiraEpicRepository jiraEpicRepository;

    @Autowired
    private JiraIssueRepository jiraIssueRepository;

    @Autowired
    private ImportConfigRepository importConfigRepository;

    @Test
    void getImportStatistics_EmptyDatabase_AllZero() {
        ImportStatistics stats = importStatisticsService.getImportStatistics();

        assertThat(stats.getTotalRuns()).isZero();
        assertThat(stats.getTotalIssues()).isZero();
        assertThat(stats.getLastImportAt()).isNull();
    }

    @Test
    void getImportStatistics_CountsRunsByStatusAndRecentFailures() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC).withNano(0);
        run(now.minusDays(3), ImportRun.RunStatus.FAILED);
        run(now.minusHours(2), ImportRun.RunStatus.FAILED);
        run(now.minusHours(1), ImportRun.RunStatus.COMPLETED);
        ImportRun latest = run(now.minusMinutes(1), ImportRun.RunStatus.STARTED);
        jiraEpicRepository.save(JiraEpic.builder()
                .jiraKey("SHOP-1").teamName("Payments").projectKey("SHOP").lastImported(now).build());
        importConfigRepository.save(ImportConfig.builder()
                .teamName("Payments").projectKey("SHOP").baseUrl("https://acme.atlassian.net")
                .authMode(AuthMode.OAUTH).oauthAccountKey("acct-1").importSince(LocalDate.of(2024, 1, 1))
                .build());

        ImportStatistics stats = importStatisticsService.getImportStatistics();

        assertThat(stats.getTotalRuns()).isEqualTo(4);
        assertThat(stats.getFailedRuns()).isEqualTo(2);
        assertThat(stats.getFailedRunsLast24h()).isEqualTo(1);
        assertThat(stats.getCompletedRuns()).isEqualTo(1);
        assertThat(stats.getRunningRuns()).isEqualTo(1);
        assertThat(stats.getTotalEpics()).isEqualTo(1);
        assertThat(stats.getActiveConfigs()).isEqualTo(1);
        assertThat(stats.getLastImportAt()).isEqualTo(latest.getStartedAt());
    }

    @Test
    void getTeamStatistics_OnlyCountsTheRequestedTeam() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC).withNano(0);
        run("Payments", now.minusHours(3), ImportRun.RunStatus.COMPLETED);
        run("Payments", now.minusHours(2), ImportRun.RunStatus.FAILED);
        ImportRun latest = run("Payments", now.minusHours(1), ImportRun.RunStatus.COMPLETED);
        run("Platform", now.minusMinutes(5), ImportRun.RunStatus.FAILED);

        jiraEpicRepository.save(JiraEpic.builder()
                .jiraKey("SHOP-1").teamName("Payments").projectKey("SHOP").lastImported(now).build());
        jiraIssueRepository.save(JiraIssue.builder()
                .jiraKey("SHOP-2").teamName("Payments").projectKey("SHOP").lastImported(now).build());
        jiraIssueRepository.save(JiraIssue.builder()
                .jiraKey("WEB-7").teamName("Payments").projectKey("WEB").lastImported(now).build());
        jiraIssueRepository.save(JiraIssue.builder()
                .jiraKey("OPS-1").teamName("Platform").projectKey("OPS").lastImported(now).build());

        config("Payments", "WEB", true);
        config("Payments", "SHOP", true);
        config("Payments", "OLD", false);
        config("Platform", "OPS", true);

        TeamImportStatistics stats = importStatisticsService.getTeamStatistics("Payments");

        assertThat(stats.getTeamName()).isEqualTo("Payments");
        assertThat(stats.getTotalRuns()).isEqualTo(3);
        assertThat(stats.getCompletedRuns()).isEqualTo(2);
        assertThat(stats.getFailedRuns()).isEqualTo(1);
        assertThat(stats.getLastImportAt()).isEqualTo(latest.getStartedAt());
        assertThat(stats.getTotalEpics()).isEqualTo(1);
        assertThat(stats.getTotalIssues()).isEqualTo(2);
        assertThat(stats.getActiveProjectKeys()).containsExactly("SHOP", "WEB");
    }

    @Test
    void getTeamStatistics_UnknownTeam_Empty() {
        TeamImportStatistics stats = importStatisticsService.getTeamStatistics("Nobody");

        assertThat(stats.getTotalRuns()).isZero();
        assertThat(stats.getLastImportAt()).isNull();
        assertThat(stats.getActiveProjectKeys()).isEmpty();
    }

    private void config(String teamName, String projectKey, boolean active) {
        importConfigRepository.save(ImportConfig.builder()
                .teamName(teamName).projectKey(projectKey).baseUrl("https://acme.atlassian.net")
                .authMode(AuthMode.OAUTH).oauthAccountKey("acct-1").importSince(LocalDate.of(2024, 1, 1))
                .active(active)
                .build());
    }

    private ImportRun run(LocalDateTime startedAt, ImportRun.RunStatus status) {
        return run("Payments", startedAt, status);
    }

    private ImportRun run(String teamName, LocalDateTime startedAt, ImportRun.RunStatus status) {
        ImportRun run = ImportRun.builder()
                .teamName(teamName)
                .projectKey("SHOP")
                .kind(ImportRun.ImportKind.FULL)
                .build();
        run.markAsStarted("IMPORT-x", startedAt);
        if (status == ImportRun.RunStatus.COMPLETED) {
            run.markAsCompleted(1, startedAt.plusMinutes(1));
        } else if (status == ImportRun.RunStatus.FAILED) {
            run.markAsFailed(0, "Import failed: boom", startedAt.plusMinutes(1));
        }
        return importRunRepository.save(run);
    }
}
