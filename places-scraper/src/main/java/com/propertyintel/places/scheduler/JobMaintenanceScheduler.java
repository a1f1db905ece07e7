package com.propertyintel.places.scheduler;

import com.propertyintel.places.output.RunHistoryRecorder;
import com.propertyintel.places.service.ScrapeJobService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup checks and periodic registry housekeeping.
 *
 * Finished jobs are kept for the configured retention (default 15 minutes) so that
 * callers can still poll, preview and download them, then evicted.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobMaintenanceScheduler {

    private final ScrapeJobService jobService;
    private final RunHistoryRecorder historyRecorder;

    @PostConstruct
    public void onStartup() {
        if (!historyRecorder.isEnabled()) {
            log.info("Run history disabled, job results are kept in memory only");
            return;
        }
        try {
            historyRecorder.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise ClickHouse run-history schema: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${places-scraper.scheduling.cleanup-interval-ms:60000}")
    public void evictExpiredJobs() {
        try {
            jobService.evictExpiredJobs();
        } catch (Exception e) {
            log.error("Job registry cleanup failed: {}", e.getMessage(), e);
        }
    }
}
