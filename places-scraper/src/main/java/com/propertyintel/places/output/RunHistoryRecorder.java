package com.propertyintel.places.output;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.JobSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Best-effort sink for finished jobs. Only talks to ClickHouse when history is enabled,
 * and a failure here never changes the outcome of a job.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunHistoryRecorder {

    private final ClickHouseRunHistoryWriter clickHouseWriter;
    private final ScraperProperties properties;

    public boolean isEnabled() {
        return properties.getHistory().isEnabled();
    }

    public void ensureSchema() {
        if (!isEnabled()) return;
        clickHouseWriter.ensureSchema();
    }

    public void record(JobSnapshot job) {
        if (!isEnabled()) return;
        try {
            clickHouseWriter.writeAreaRuns(job);
        } catch (Exception e) {
            log.warn("Failed to record run history for job {}: {}", job.getJobId(), e.getMessage());
        }
    }
}
