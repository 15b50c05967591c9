package com.example.importservice.client.external;

import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.metrics.ImportMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JiraRecordExtractorTest {

    private SimpleMeterRegistry meterRegistry;
    private JiraRecordExtractor extractor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        extractor = new JiraRecordExtractor(new ImportMetrics(meterRegistry));
    }

    @Test
    void toEpic_MapsFieldsAndJoinsFixVersions() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("summary", "Checkout redesign");
        fields.put("status", Map.of("name", "In Progress"));
        fields.put("duedate", "2024-06-30");
        fields.put("priority", Map.of("name", "High"));
        fields.put("fixVersions", List.of(Map.of("name", "1.2"), Map.of("name", "1.3")));
        fields.put("customfield_10192", 8);
        fields.put("customfield_10193", 5.5);

        JiraEpicDto epic = extractor.toEpic(Map.of("key", "SHOP-1", "fields", fields));

        assertThat(epic.getKey()).isEqualTo("SHOP-1");
        assertThat(epic.getSummary()).isEqualTo("Checkout redesign");
        assertThat(epic.getStatus()).isEqualTo("In Progress");
        assertThat(epic.getDueDate()).isEqualTo(LocalDate.of(2024, 6, 30));
        assertThat(epic.getPriority()).isEqualTo("High");
        assertThat(epic.getFixVersions()).isEqualTo("1.2, 1.3");
        assertThat(epic.getRoughEstimate()).isEqualTo(8.0);
        assertThat(epic.getOriginalEstimate()).isEqualTo(5.5);
        assertThat(epic.getRemainingEstimate()).isNull();
    }

    @Test
    void toEpic_MissingFields_DefaultsTextAndLeavesVersionsNull() {
        JiraEpicDto epic = extractor.toEpic(Map.of("key", "SHOP-2", "fields", Map.of("fixVersions", List.of())));

        assertThat(epic.getSummary()).isEmpty();
        assertThat(epic.getStatus()).isEmpty();
        assertThat(epic.getFixVersions()).isNull();
        assertThat(epic.getDueDate()).isNull();
    }

    @Test
    void toIssue_PicksSprintWithLatestStartDate() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("issuetype", Map.of("name", "Story"));
        fields.put("summary", "Pay with card");
        fields.put("status", Map.of("name", "Done"));
        fields.put("created", "2024-01-02T09:15:00.000+0100");
        fields.put("updated", "2024-02-03T10:00:00.000+0000");
        fields.put("resolutiondate", "2024-02-03T10:00:00.000+0000");
        fields.put("resolution", Map.of("name", "Fixed"));
        fields.put("customfield_10033", 3);
        fields.put("customfield_10014", "SHOP-1");
        fields.put("customfield_10019", "0|i0001:");
        fields.put("customfield_10020", List.of(
                Map.of("name", "Sprint 1", "state", "closed",
                        "startDate", "2024-01-01T08:00:00.000Z", "endDate", "2024-01-14T17:00:00.000Z"),
                Map.of("name", "Sprint 3", "state", "active",
                        "startDate", "2024-01-29T08:00:00.000Z", "endDate", "2024-02-11T17:00:00.000Z"),
                Map.of("name", "Sprint 2", "state", "closed",
                        "startDate", "2024-01-15T08:00:00.000Z", "endDate", "2024-01-28T17:00:00.000Z")));

        JiraIssueDto issue = extractor.toIssue(Map.of("key", "SHOP-7", "fields", fields));

        assertThat(issue.getIssueType()).isEqualTo("Story");
        assertThat(issue.getCreated()).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(issue.getUpdated()).isEqualTo(LocalDate.of(2024, 2, 3));
        assertThat(issue.getResolved()).isEqualTo(LocalDate.of(2024, 2, 3));
        assertThat(issue.getResolution()).isEqualTo("Fixed");
        assertThat(issue.getStoryPoints()).isEqualTo(3.0);
        assertThat(issue.getEpicLink()).isEqualTo("SHOP-1");
        assertThat(issue.getBacklogPriority()).isEqualTo("0|i0001:");
        assertThat(issue.getLastAssignedSprint()).isEqualTo("Sprint 3");
        assertThat(issue.getSprintState()).isEqualTo("active");
        assertThat(issue.getSprintStartDate()).isEqualTo(LocalDate.of(2024, 1, 29));
        assertThat(issue.getSprintEndDate()).isEqualTo(LocalDate.of(2024, 2, 11));
    }

    @Test
    void toIssue_NoSprints_IsBacklog() {
        JiraIssueDto issue = extractor.toIssue(Map.of("key", "SHOP-8", "fields", Map.of("summary", "Later")));

        assertThat(issue.getSprintState()).isEqualTo(JiraRecordExtractor.BACKLOG);
        assertThat(issue.getLastAssignedSprint()).isNull();
        assertThat(issue.getSprintStartDate()).isNull();
        assertThat(issue.getIssueType()).isEmpty();
    }

    @Test
    void latestSprint_NoneStarted_FallsBackToFirstListed() {
        List<Map<String, Object>> sprints = List.of(
                Map.of("name", "Future A", "state", "future"),
                Map.of("name", "Future B", "state", "future"));

        assertThat(extractor.latestSprint(sprints).orElseThrow().get("name")).isEqualTo("Future A");
        assertThat(extractor.latestSprint(List.of())).isEmpty();
    }

    @Test
    void parseDay_UnparseableValue_ReturnsNullAndCountsWarning() {
        assertThat(extractor.parseDay("31/12/2024", "duedate", "SHOP-9")).isNull();
        assertThat(extractor.parseDay("", "duedate", "SHOP-9")).isNull();
        assertThat(extractor.parseDay(null, "duedate", "SHOP-9")).isNull();

        assertThat(meterRegistry.counter("parser_warning_count").count()).isEqualTo(1.0);
    }
}
