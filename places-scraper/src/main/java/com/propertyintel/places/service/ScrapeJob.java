package com.propertyintel.places.service;

import com.propertyintel.places.dedupe.DedupeGate;
import com.propertyintel.places.model.AreaRun;
import com.propertyintel.places.model.AreaRunSnapshot;
import com.propertyintel.places.model.AreaRunState;
import com.propertyintel.places.model.FailurePolicy;
import com.propertyintel.places.model.JobSnapshot;
import com.propertyintel.places.model.JobStatus;
import com.propertyintel.places.model.PlaceRecord;
import com.propertyintel.places.output.PlaceCsvWriter;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Everything one submission owns: its areas, the shared dedupe gate and writer,
 * the cancel flag and the live metrics. The aggregate status is derived from the
 * areas on every snapshot and only becomes terminal after the writer is closed.
 */
class ScrapeJob {

    @Getter private final String jobId;
    @Getter private final String businessType;
    @Getter private final int resultsPerArea;
    @Getter private final boolean appendMode;
    @Getter private final boolean fastAppend;
    @Getter private final FailurePolicy failurePolicy;
    @Getter private final Path outputPath;
    @Getter private final String outputFile;
    @Getter private final DedupeGate gate;
    @Getter private final PlaceCsvWriter writer;
    @Getter private final int seededCount;
    @Getter private final CancellationFlag cancellation = new CancellationFlag();
    @Getter private final CompletableFuture<JobSnapshot> completion = new CompletableFuture<>();
    @Getter private final Instant startedAt;

    private final Map<String, AreaRun> areaRuns;
    private final Clock clock;
    private final int recentCapacity;
    private final Duration metricsWindow;

    private final AtomicInteger totalAccepted = new AtomicInteger();
    private final AtomicBoolean finalised = new AtomicBoolean();
    private final Deque<PlaceRecord> recentRecords = new ArrayDeque<>();
    private final Deque<long[]> progressSamples = new ArrayDeque<>();

    private volatile JobStatus status = JobStatus.RUNNING;
    private volatile String errorMessage;
    private volatile Instant finishedAt;

    ScrapeJob(String jobId, String businessType, List<String> areas, int resultsPerArea,
              boolean appendMode, boolean fastAppend, FailurePolicy failurePolicy, Path outputPath, String outputFile,
              DedupeGate gate, PlaceCsvWriter writer, int seededCount,
              Clock clock, int recentCapacity, Duration metricsWindow) {
        this.jobId = jobId;
        this.businessType = businessType;
        this.resultsPerArea = resultsPerArea;
        this.appendMode = appendMode;
        this.fastAppend = fastAppend;
        this.failurePolicy = failurePolicy;
        this.outputPath = outputPath;
        this.outputFile = outputFile;
        this.gate = gate;
        this.writer = writer;
        this.seededCount = seededCount;
        this.clock = clock;
        this.recentCapacity = recentCapacity;
        this.metricsWindow = metricsWindow;
        this.startedAt = clock.instant();

        Map<String, AreaRun> runs = new LinkedHashMap<>();
        for (String area : areas) {
            runs.put(area, new AreaRun(area));
        }
        this.areaRuns = Collections.unmodifiableMap(runs);
    }

    List<AreaRun> areaRuns() {
        return List.copyOf(areaRuns.values());
    }

    boolean isFinished() {
        return status != JobStatus.RUNNING;
    }

    Instant getFinishedAt() {
        return finishedAt;
    }

    // ── Called from area runners ─────────────────────────────────────────────

    void onAccepted(PlaceRecord record) {
        int accepted = totalAccepted.incrementAndGet();
        long now = clock.millis();
        synchronized (recentRecords) {
            recentRecords.addLast(record);
            while (recentRecords.size() > recentCapacity) {
                recentRecords.removeFirst();
            }
            progressSamples.addLast(new long[]{now, accepted});
            long cutoff = now - metricsWindow.toMillis();
            while (progressSamples.size() > 2 && progressSamples.peekFirst()[0] < cutoff) {
                progressSamples.removeFirst();
            }
        }
    }

    List<PlaceRecord> recentRecords(int limit) {
        synchronized (recentRecords) {
            List<PlaceRecord> all = new ArrayList<>(recentRecords);
            return all.subList(Math.max(0, all.size() - limit), all.size());
        }
    }

    // ── Cancellation / abort ─────────────────────────────────────────────────

    /**
     * Raises the cancel flag and fails every area that has not started yet.
     * Running areas notice the flag before their next record.
     *
     * @return areas failed directly by this call
     */
    List<AreaRun> cancel(String reason) {
        cancellation.request(reason);
        List<AreaRun> failedNow = new ArrayList<>();
        for (AreaRun run : areaRuns.values()) {
            if (run.getState() == AreaRunState.PENDING && run.markFailed(cancellation.reason(), clock.instant())) {
                failedNow.add(run);
            }
        }
        return failedNow;
    }

    void recordWriterFailure(String message) {
        if (errorMessage == null) {
            errorMessage = message;
        }
    }

    boolean hasWriterFailure() {
        return errorMessage != null;
    }

    // ── Finalisation ─────────────────────────────────────────────────────────

    /**
     * Flips the job to its terminal status exactly once. The caller closes the writer first.
     *
     * @return false if the job was already finalised
     */
    boolean finalise() {
        if (!finalised.compareAndSet(false, true)) return false;
        List<AreaRunSnapshot> areas = areaRuns.values().stream().map(AreaRun::snapshot).toList();
        JobStatus resolved = hasWriterFailure() ? JobStatus.FAILED : failurePolicy.resolve(areas);
        if (resolved == JobStatus.FAILED && errorMessage == null) {
            errorMessage = areas.stream().allMatch(a -> a.getState() == AreaRunState.FAILED)
                    ? "All areas failed"
                    : "One or more areas failed";
        }
        finishedAt = clock.instant();
        // status last: a reader that sees a terminal status also sees finishedAt
        status = resolved;
        return true;
    }

    JobSnapshot snapshot() {
        List<AreaRunSnapshot> areas = areaRuns.values().stream().map(AreaRun::snapshot).toList();

        int accepted = 0;
        int raw = 0;
        int finished = 0;
        List<String> current = new ArrayList<>();
        for (AreaRunSnapshot a : areas) {
            accepted += a.getAcceptedCount();
            raw += a.getRawCount();
            if (a.getState().isTerminal()) finished++;
            if (a.getState() == AreaRunState.RUNNING) current.add(a.getArea());
        }

        int target = areas.size() * resultsPerArea;
        Instant end = finishedAt != null ? finishedAt : clock.instant();
        double elapsed = Duration.between(startedAt, end).toMillis() / 1000.0;

        double throughputPerSecond = 0.0;
        synchronized (recentRecords) {
            if (progressSamples.size() >= 2) {
                long[] first = progressSamples.peekFirst();
                long[] last = progressSamples.peekLast();
                long deltaCount = last[1] - first[1];
                long deltaMillis = last[0] - first[0];
                if (deltaCount > 0 && deltaMillis > 0) {
                    throughputPerSecond = deltaCount * 1000.0 / deltaMillis;
                }
            }
        }
        Double eta = null;
        if (throughputPerSecond > 0 && finishedAt == null) {
            eta = Math.max(target - accepted, 0) / throughputPerSecond;
        }

        return JobSnapshot.builder()
                .jobId(jobId)
                .businessType(businessType)
                .outputFile(outputFile)
                .appendMode(appendMode)
                .fastAppend(fastAppend)
                .failurePolicy(failurePolicy)
                .resultsPerArea(resultsPerArea)
                .status(status)
                .errorMessage(errorMessage)
                .acceptedCount(accepted)
                .rawCount(raw)
                .duplicateCount(raw - accepted)
                .seededCount(seededCount)
                .rowsWritten(writer.getRowsWritten())
                .totalAreas(areas.size())
                .finishedAreas(finished)
                .currentAreas(List.copyOf(current))
                .progress(target == 0 ? 0.0 : Math.min(1.0, (double) accepted / target))
                .throughputPerMinute(throughputPerSecond * 60)
                .etaSeconds(eta)
                .elapsedSeconds(elapsed)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .areas(areas)
                .build();
    }
}
