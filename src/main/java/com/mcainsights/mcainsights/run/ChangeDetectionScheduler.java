package com.mcainsights.mcainsights.run;

import com.mcainsights.mcainsights.snapshot.InsufficientHistoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs change detection for all pending snapshot pairs based on the cron expression in configuration.
 */
@Component
public class ChangeDetectionScheduler {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetectionScheduler.class);

    private final ChangeDetectionRunService runService;

    public ChangeDetectionScheduler(ChangeDetectionRunService runService) {
        this.runService = runService;
    }

    @Scheduled(cron = "${mca.cron}")
    public void scheduledRun() {
        try {
            List<ChangeRunResult> results = runService.runPending();
            int changes = results.stream().mapToInt(ChangeRunResult::totalChanges).sum();
            log.info("Scheduled change detection complete. runs={}, changes={}", results.size(), changes);
        } catch (InsufficientHistoryException ex) {
            log.info("Change detection skipped until more snapshots arrive: {}", ex.getMessage());
        }
    }
}
