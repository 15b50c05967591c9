package com.example.importservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Jira import service.
 *
 * Mirrors a team's epics and issues into the local database, records every import
 * run, and manages Atlassian OAuth tokens for accounts that connect via 3LO.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ImportServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ImportServiceApplication.class, args);
    }
}
