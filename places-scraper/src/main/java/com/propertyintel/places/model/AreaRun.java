package com.propertyintel.places.model;

import java.time.Instant;

/**
 * Live state of one area within a job.
 *
 * Counters and state change together under the instance lock, so a snapshot
 * never shows a terminal state with counters from before the last record.
 * Once COMPLETED or FAILED nothing changes any more.
 */
public class AreaRun {

    private final String area;

    private AreaRunState state = AreaRunState.PENDING;
    private int acceptedCount;
    private int rawCount;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;

    public AreaRun(String area) {
        this.area = area;
    }

    public String getArea() {
        return area;
    }

    /**
     * PENDING → RUNNING. Returns false if the area was already failed (cancelled before start).
     */
    public synchronized boolean markRunning(Instant now) {
        if (state != AreaRunState.PENDING) return false;
        state = AreaRunState.RUNNING;
        startedAt = now;
        return true;
    }

    public synchronized void recordAccepted() {
        rawCount++;
        acceptedCount++;
    }

    public synchronized void recordDuplicate() {
        rawCount++;
    }

    public synchronized boolean markCompleted(Instant now) {
        if (state != AreaRunState.RUNNING) return false;
        state = AreaRunState.COMPLETED;
        completedAt = now;
        return true;
    }

    /**
     * PENDING or RUNNING → FAILED. No-op on an area that already finished.
     */
    public synchronized boolean markFailed(String reason, Instant now) {
        if (state.isTerminal()) return false;
        state = AreaRunState.FAILED;
        errorMessage = (reason == null || reason.isBlank()) ? "unknown error" : reason;
        completedAt = now;
        return true;
    }

    public synchronized int getAcceptedCount() {
        return acceptedCount;
    }

    public synchronized AreaRunState getState() {
        return state;
    }

    public synchronized AreaRunSnapshot snapshot() {
        return new AreaRunSnapshot(area, state, acceptedCount, rawCount, rawCount - acceptedCount,
                errorMessage, startedAt, completedAt);
    }
}
