package com.example.importservice.scheduler;

import com.example.importservice.dto.ImportResult;
import com.example.importservice.entity.ImportConfig;
import com.example.importservice.entity.ImportRun;
import com.example.importservice.service.ImportConfigService;
import com.example.importservice.service.ImportOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Scheduled FULL import of every active config.
 *
 * CRITICAL DESIGN:
 * - @SchedulerLock ensures only ONE instance executes (multi-replica safe)
 * - Configs are imported one after another; a failing config does not stop the rest
 * - Disabled unless importer.scheduler.enabled=true
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "importer.scheduler.enabled", havingValue = "true")
public class ImportScheduler {

    private final ImportConfigService importConfigService;
    private final ImportOrchestrator importOrchestrator;

    /**
     * Default: daily at 03:00
     * Lock: max 3 hours
     */
    @Scheduled(cron = "${importer.scheduler.cron:0 0 3 * * *}")
    @SchedulerLock(
            name = "scheduledFullImport",
            lockAtMostFor = "3h",
            lockAtLeastFor = "1m"
    )
    public void importActiveConfigs() {
        String correlationId = "SCHEDULER-IMPORT-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put("correlationId", correlationId);

        try {
            List<ImportConfig> configs = importConfigService.getAllImportConfigs(true);
            log.info("=== Starting scheduled import of {} active configs: correlationId={} ===",
                    configs.size(), correlationId);

            int succeeded = 0;
            for (ImportConfig config : configs) {
                try {
                    ImportResult result = importOrchestrator.performImport(
                            importConfigService.toClientConfig(config), ImportRun.ImportKind.FULL);
                    if (result.isSuccess()) {
                        succeeded++;
                    } else {
                        log.warn("⚠️ Scheduled import failed for team={}, project={}: {}",
                                config.getTeamName(), config.getProjectKey(), result.getErrors());
                    }
                } catch (Exception e) {
                    log.error("Error in scheduled import for team={}, project={}: {}",
                            config.getTeamName(), config.getProjectKey(), e.getMessage(), e);
                }
            }

            log.info("=== Completed scheduled import: {}/{} succeeded ===", succeeded, configs.size());
        } finally {
            MDC.remove("correlationId");
        }
    }
}
