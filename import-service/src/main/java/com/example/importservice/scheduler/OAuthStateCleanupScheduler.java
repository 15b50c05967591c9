package com.example.importservice.scheduler;

import com.example.importservice.service.OAuthStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Removes OAuth states whose consent flow was never completed.
 * Runs every 10 minutes by default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OAuthStateCleanupScheduler {

    private final OAuthStateStore oauthStateStore;

    @Scheduled(fixedDelayString = "${importer.oauth.state-cleanup-interval-ms:600000}", initialDelay = 60000)
    @SchedulerLock(name = "oauthStateCleanup", lockAtMostFor = "5m", lockAtLeastFor = "30s")
    public void purgeExpiredStates() {
        int deleted = oauthStateStore.purgeExpired();

        if (deleted > 0) {
            log.info("Deleted {} expired OAuth states", deleted);
        } else {
            log.debug("No expired OAuth states to clean up");
        }
    }
}
