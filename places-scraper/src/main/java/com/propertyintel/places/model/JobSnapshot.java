package com.propertyintel.places.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only aggregate view of a job, derived from its areas at the time it was taken.
 */
@Value
@Builder
public class JobSnapshot {

    String jobId;
    String businessType;
    String outputFile;
    boolean appendMode;
    boolean fastAppend;
    FailurePolicy failurePolicy;
    int resultsPerArea;

    JobStatus status;
    String errorMessage;

    // ── Counters (sums over areas) ──────────────────────────────────────────
    int acceptedCount;
    int rawCount;
    int duplicateCount;

    /** Fingerprints loaded from the existing file in append mode */
    int seededCount;

    /** Rows committed to the file by this job so far */
    int rowsWritten;

    // ── Progress ────────────────────────────────────────────────────────────
    int totalAreas;
    int finishedAreas;
    List<String> currentAreas;

    /** accepted / (areas × resultsPerArea), 0.0 - 1.0 */
    double progress;
    double throughputPerMinute;

    /** Null until there is enough history to estimate */
    Double etaSeconds;
    double elapsedSeconds;

    Instant startedAt;
    Instant finishedAt;

    List<AreaRunSnapshot> areas;
}
