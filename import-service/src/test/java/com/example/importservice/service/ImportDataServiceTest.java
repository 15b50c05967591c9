package com.example.importservice.service;

import com.example.importservice.config.JpaConfig;
import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.entity.JiraIssue;
import com.example.importservice.metrics.ImportMetrics;
import com.example.importservice.repository.ImportRunRepository;
import com.example.importservice.repository.JiraEpicRepository;
import com.example.importservice.repository.JiraIssueRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Persistence rules of ImportDataService on an embedded database.
 */
@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaConfig.class, ImportDataService.class, DataMapper.class, ImportMetrics.class})
class ImportDataServiceTest {

    @TestConfiguration
    static class MetricsConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private ImportDataService importDataService;

    @Autowired
    private JiraEpicRepository jiraEpicRepository;

    @Autowired
    private JiraIssueRepository jiraIssueRepository;

    @Autowired
    private ImportRunRepository importRunRepository;

    /**
     * TEST 1: RETRY IDEMPOTENCY
     *
     * Same key imported twice: one row, holding the latest snapshot.
     */
    @Test
    void upsertEpic_SameKeyTwice_KeepsOneRowWithLatestValues() {
        importDataService.upsertEpic(epic("SHOP-1", "First summary", "Open"), "Payments", "SHOP");
        importDataService.upsertEpic(epic("SHOP-1", "Second summary", "Done"), "Payments", "SHOP");

        assertThat(jiraEpicRepository.count()).isEqualTo(1);
        assertThat(jiraEpicRepository.findByJiraKey("SHOP-1")).get()
                .satisfies(epic -> {
                    assertThat(epic.getSummary()).isEqualTo("Second summary");
                    assertThat(epic.getStatus()).isEqualTo("Done");
                    assertThat(epic.getLastImported()).isNotNull();
                    assertThat(epic.getCreatedAt()).isNotNull();
                });
    }

    @Test
    void upsertIssue_ReplacesEveryField() {
        JiraIssueDto first = JiraIssueDto.builder()
                .key("SHOP-7").issueType("Story").summary("Pay").status("In Progress")
                .storyPoints(5.0).epicLink("SHOP-1")
                .sprintState("active").lastAssignedSprint("Sprint 3")
                .sprintStartDate(LocalDate.of(2024, 1, 29))
                .build();
        JiraIssueDto second = JiraIssueDto.builder()
                .key("SHOP-7").issueType("Story").summary("Pay").status("Done")
                .sprintState("backlog")
                .build();

        importDataService.upsertIssue(first, "Payments", "SHOP");
        JiraIssue saved = importDataService.upsertIssue(second, "Payments", "SHOP");

        assertThat(jiraIssueRepository.count()).isEqualTo(1);
        assertThat(saved.getStatus()).isEqualTo("Done");
        assertThat(saved.getStoryPoints()).isNull();
        assertThat(saved.getEpicLink()).isNull();
        assertThat(saved.getLastAssignedSprint()).isNull();
        assertThat(saved.getSprintState()).isEqualTo("backlog");
    }

    @Test
    void upsertEpic_LongSummary_IsTruncated() {
        importDataService.upsertEpic(epic("SHOP-2", "x".repeat(800), "Open"), "Payments", "SHOP");

        assertThat(jiraEpicRepository.findByJiraKey("SHOP-2").orElseThrow().getSummary()).hasSize(500);
    }

    @Test
    void findIssues_FiltersByTeamAndProject() {
        importDataService.upsertIssue(issue("SHOP-1"), "Payments", "SHOP");
        importDataService.upsertIssue(issue("SHOP-2"), "Payments", "SHOP");
        importDataService.upsertIssue(issue("OPS-1"), "Platform", "OPS");

        assertThat(importDataService.findIssues("Payments", null)).extracting(JiraIssue::getJiraKey)
                .containsExactlyInAnyOrder("SHOP-1", "SHOP-2");
        assertThat(importDataService.findIssues(null, "OPS")).extracting(JiraIssue::getJiraKey)
                .containsExactly("OPS-1");
        assertThat(importDataService.findIssues(null, null)).hasSize(3);
        assertThat(importDataService.findEpics("Payments", "SHOP")).isEmpty();
    }

    @Test
    void importRun_Lifecycle_CompletesOnce() {
        ImportRun run = importDataService.createImportRun("Payments", "SHOP", ImportRun.ImportKind.FULL, "IMPORT-1");

        assertThat(run.getId()).isNotNull();
        assertThat(run.getStatus()).isEqualTo(ImportRun.RunStatus.STARTED);
        assertThat(run.getCorrelationId()).isEqualTo("IMPORT-1");

        ImportRun completed = importDataService.completeImportRun(run.getId(), 12);

        assertThat(completed.getStatus()).isEqualTo(ImportRun.RunStatus.COMPLETED);
        assertThat(completed.getRecordsProcessed()).isEqualTo(12);
        assertThat(completed.getEndedAt()).isNotNull();
        assertThat(completed.getDurationMs()).isNotNull().isGreaterThanOrEqualTo(0L);

        assertThatThrownBy(() -> importDataService.failImportRun(run.getId(), 0, "late failure"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failImportRun_TruncatesErrorSummary() {
        ImportRun run = importDataService.createImportRun("Payments", "SHOP", ImportRun.ImportKind.ISSUES, "IMPORT-2");

        ImportRun failed = importDataService.failImportRun(run.getId(), 3, "e".repeat(5000));

        assertThat(failed.getStatus()).isEqualTo(ImportRun.RunStatus.FAILED);
        assertThat(failed.getRecordsProcessed()).isEqualTo(3);
        assertThat(failed.getErrorSummary()).hasSize(4000);
    }

    @Test
    void findImportHistory_NewestFirst_FilteredAndLimited() {
        LocalDateTime base = LocalDateTime.of(2024, 5, 1, 3, 0);
        saveRun("Payments", "SHOP", base);
        saveRun("Payments", "SHOP", base.plusDays(2));
        saveRun("Payments", "SHOP", base.plusDays(1));
        saveRun("Platform", "OPS", base.plusDays(3));

        List<ImportRun> payments = importDataService.findImportHistory("Payments", null, null);

        assertThat(payments).extracting(ImportRun::getStartedAt)
                .containsExactly(base.plusDays(2), base.plusDays(1), base);
        assertThat(importDataService.findImportHistory(null, null, 2)).extracting(ImportRun::getTeamName)
                .containsExactly("Platform", "Payments");
        assertThat(importDataService.findImportHistory(null, null, 0)).hasSize(1);
    }

    @Test
    void clampLimit_AppliesDefaultAndBounds() {
        assertThat(ImportDataService.clampLimit(null)).isEqualTo(50);
        assertThat(ImportDataService.clampLimit(-3)).isEqualTo(1);
        assertThat(ImportDataService.clampLimit(20)).isEqualTo(20);
        assertThat(ImportDataService.clampLimit(500)).isEqualTo(100);
    }

    private void saveRun(String team, String project, LocalDateTime startedAt) {
        ImportRun run = ImportRun.builder()
                .teamName(team)
                .projectKey(project)
                .kind(ImportRun.ImportKind.FULL)
                .build();
        run.markAsStarted("IMPORT-" + startedAt.getDayOfMonth(), startedAt);
        run.markAsCompleted(0, startedAt.plusMinutes(5));
        importRunRepository.save(run);
    }

    private static JiraEpicDto epic(String key, String summary, String status) {
        return JiraEpicDto.builder().key(key).summary(summary).status(status).build();
    }

    private static JiraIssueDto issue(String key) {
        return JiraIssueDto.builder().key(key).summary("Issue " + key).status("To Do").sprintState("backlog").build();
    }
}
