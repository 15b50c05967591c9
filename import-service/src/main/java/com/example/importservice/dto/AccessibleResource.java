package com.example.importservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A cloud site the granted token can reach.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccessibleResource {

    private String id;
    private String url;
    private String name;
    private List<String> scopes;

    public boolean grantsJiraAccess() {
        return scopes != null
                && (scopes.contains("read:jira-work") || scopes.contains("write:jira-work"));
    }
}
