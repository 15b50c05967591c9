package com.example.importservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of one import. {@code errors} is capped, {@code totalErrors} is not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportResult {

    public static final int MAX_REPORTED_ERRORS = 10;

    private boolean success;
    private int epicsProcessed;
    private int issuesProcessed;
    private List<String> errors;
    private int totalErrors;
    private Long runId;
    private String correlationId;
    private long durationMs;
}
