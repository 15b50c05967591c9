package com.example.importservice.metrics;

import com.example.importservice.dto.RecordKind;
import com.example.importservice.entity.ImportRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics component for Prometheus monitoring.
 *
 * Exposes:
 * - import_runs_total: imports by kind and final status
 * - import_duration_seconds: import duration by kind
 * - import_records_total: records upserted by record kind
 * - jira_page_limit_reached_total: searches cut off at the page ceiling
 * - oauth_token_refresh_total: refresh attempts by outcome
 * - constraint_violation_count: unique-key races during upsert
 * - parser_warning_count: unparseable Jira dates
 *
 * Access metrics: http://localhost:8085/actuator/prometheus
 */
@Component
@Slf4j
public class ImportMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter runsStartedCounter;
    private final Counter constraintViolationCounter;
    private final Counter parserWarningCounter;

    public ImportMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.runsStartedCounter = Counter.builder("import_runs_started_total")
                .description("Total number of imports started (for failure rate calculation)")
                .register(meterRegistry);

        this.constraintViolationCounter = Counter.builder("constraint_violation_count")
                .description("Number of unique constraint violations during upsert")
                .register(meterRegistry);

        this.parserWarningCounter = Counter.builder("parser_warning_count")
                .description("Number of Jira date values that could not be parsed")
                .register(meterRegistry);
    }

    public void recordRunStarted() {
        runsStartedCounter.increment();
    }

    /**
     * Record an import reaching its terminal status.
     */
    public void recordRunFinished(ImportRun.ImportKind kind, ImportRun.RunStatus status, long durationMs) {
        Counter.builder("import_runs_total")
                .description("Total number of imports by kind and status")
                .tag("kind", kind.name().toLowerCase())
                .tag("status", status.name().toLowerCase())
                .register(meterRegistry)
                .increment();

        Timer.builder("import_duration_seconds")
                .description("Duration of imports")
                .tag("kind", kind.name().toLowerCase())
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);

        log.debug("Recorded import finished: kind={}, status={}, duration={}ms", kind, status, durationMs);
    }

    public void recordRecordsImported(RecordKind kind, int count) {
        Counter.builder("import_records_total")
                .description("Records upserted by kind")
                .tag("kind", kind.tag())
                .register(meterRegistry)
                .increment(count);
    }

    /**
     * Record a search that stopped at the page ceiling with more pages available.
     */
    public void recordPageLimitReached(RecordKind kind) {
        Counter.builder("jira_page_limit_reached_total")
                .description("Searches truncated at the page ceiling")
                .tag("kind", kind.tag())
                .register(meterRegistry)
                .increment();
    }

    /**
     * @param outcome success, failure or no_refresh_token
     */
    public void recordTokenRefresh(String outcome) {
        Counter.builder("oauth_token_refresh_total")
                .description("OAuth access token refresh attempts")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Expected: 0 in normal operation. Non-zero means two imports raced on the same key.
     */
    public void recordConstraintViolation() {
        constraintViolationCounter.increment();
        log.warn("⚠️ Recorded UNIQUE constraint violation during upsert");
    }

    /**
     * Call site logs the field, record key and raw value.
     */
    public void recordParserWarning() {
        parserWarningCounter.increment();
    }
}
