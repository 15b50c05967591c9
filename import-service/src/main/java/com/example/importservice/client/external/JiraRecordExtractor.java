package com.example.importservice.client.external;

import com.example.importservice.dto.JiraEpicDto;
import com.example.importservice.dto.JiraIssueDto;
import com.example.importservice.metrics.ImportMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps raw Jira search JSON onto normalized epic/issue DTOs.
 *
 * Custom fields of the target Jira site:
 * - customfield_10192/10193/10194: rough, original and remaining estimate
 * - customfield_10033: story points
 * - customfield_10014: epic link
 * - customfield_10019: rank (backlog priority)
 * - customfield_10020: sprints
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JiraRecordExtractor {

    static final String BACKLOG = "backlog";

    private final ImportMetrics importMetrics;

    public JiraEpicDto toEpic(Map<String, Object> issue) {
        String key = (String) issue.get("key");
        Map<String, Object> fields = fieldsOf(issue);

        List<Map<String, Object>> versions = listOfMaps(fields.get("fixVersions"));
        String fixVersions = versions.stream()
                .map(version -> (String) version.get("name"))
                .filter(Objects::nonNull)
                .collect(Collectors.joining(", "));

        return JiraEpicDto.builder()
                .key(key)
                .summary(stringOrEmpty(fields.get("summary")))
                .status(stringOrEmpty(nestedName(fields, "status")))
                .dueDate(parseDay(fields.get("duedate"), "duedate", key))
                .priority(nestedName(fields, "priority"))
                .fixVersions(fixVersions.isEmpty() ? null : fixVersions)
                .roughEstimate(number(fields.get("customfield_10192")))
                .originalEstimate(number(fields.get("customfield_10193")))
                .remainingEstimate(number(fields.get("customfield_10194")))
                .build();
    }

    public JiraIssueDto toIssue(Map<String, Object> issue) {
        String key = (String) issue.get("key");
        Map<String, Object> fields = fieldsOf(issue);

        JiraIssueDto.JiraIssueDtoBuilder builder = JiraIssueDto.builder()
                .key(key)
                .issueType(stringOrEmpty(nestedName(fields, "issuetype")))
                .summary(stringOrEmpty(fields.get("summary")))
                .status(stringOrEmpty(nestedName(fields, "status")))
                .dueDate(parseDay(fields.get("duedate"), "duedate", key))
                .created(parseDay(fields.get("created"), "created", key))
                .updated(parseDay(fields.get("updated"), "updated", key))
                .resolved(parseDay(fields.get("resolutiondate"), "resolutiondate", key))
                .resolution(nestedName(fields, "resolution"))
                .storyPoints(number(fields.get("customfield_10033")))
                .epicLink(asString(fields.get("customfield_10014")))
                .backlogPriority(asString(fields.get("customfield_10019")));

        Optional<Map<String, Object>> sprint = latestSprint(listOfMaps(fields.get("customfield_10020")));
        if (sprint.isPresent()) {
            Map<String, Object> s = sprint.get();
            builder.sprintState((String) s.get("state"))
                    .lastAssignedSprint((String) s.get("name"))
                    .sprintStartDate(parseDay(s.get("startDate"), "sprint.startDate", key))
                    .sprintEndDate(parseDay(s.get("endDate"), "sprint.endDate", key));
        } else {
            builder.sprintState(BACKLOG);
        }
        return builder.build();
    }

    /**
     * Sprint with the latest start date; the first listed sprint when none has started.
     */
    Optional<Map<String, Object>> latestSprint(List<Map<String, Object>> sprints) {
        if (sprints.isEmpty()) {
            return Optional.empty();
        }
        Optional<Map<String, Object>> started = sprints.stream()
                .filter(s -> s.get("startDate") instanceof String)
                .max(Comparator.comparing(s -> (String) s.get("startDate")));
        return started.isPresent() ? started : Optional.of(sprints.get(0));
    }

    /**
     * Jira dates and timestamps are truncated to their first 10 characters (yyyy-MM-dd).
     * Unparseable values are logged, counted and dropped.
     */
    LocalDate parseDay(Object raw, String field, String key) {
        if (!(raw instanceof String value) || value.isBlank()) {
            return null;
        }
        String day = value.length() > 10 ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(day);
        } catch (DateTimeParseException e) {
            log.warn("⚠️ PARSER WARNING: Failed to parse date for field={}, key={}, rawValue='{}'",
                    field, key, value);
            importMetrics.recordParserWarning();
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> fieldsOf(Map<String, Object> issue) {
        Object fields = issue.get("fields");
        return fields instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(item -> item instanceof Map<?, ?>)
                .map(item -> (Map<String, Object>) item)
                .toList();
    }

    private static String nestedName(Map<String, Object> fields, String field) {
        Object value = fields.get(field);
        if (value instanceof Map<?, ?> map && map.get("name") instanceof String name) {
            return name;
        }
        return null;
    }

    private static Double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static String stringOrEmpty(Object value) {
        return value == null ? "" : value.toString();
    }
}
