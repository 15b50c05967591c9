package com.example.importservice.dto;

/**
 * Kind of Jira record fetched by a single search.
 */
public enum RecordKind {
    EPIC("epics"),
    ISSUE("issues");

    private final String tag;

    RecordKind(String tag) {
        this.tag = tag;
    }

    /**
     * Lower-case plural used in metric tags and log lines.
     */
    public String tag() {
        return tag;
    }
}
