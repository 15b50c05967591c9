package com.example.importservice.dto;

import java.util.List;
import java.util.Map;

/**
 * One page of raw search results plus the cursor for the next page (null when last).
 */
public record JiraSearchPage(List<Map<String, Object>> issues, String nextPageToken) {

    public JiraSearchPage {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasNextPage() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
