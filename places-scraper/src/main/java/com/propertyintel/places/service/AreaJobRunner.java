package com.propertyintel.places.service;

import com.propertyintel.places.dedupe.DedupeGate;
import com.propertyintel.places.model.AreaRun;
import com.propertyintel.places.model.PlaceRecord;
import com.propertyintel.places.model.ProgressEvent;
import com.propertyintel.places.output.OutputWriteException;
import com.propertyintel.places.output.PlaceCsvWriter;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one area: pulls listings from the source, filters them through the dedupe gate
 * and hands accepted ones to the job's shared writer.
 *
 * Lifecycle: PENDING → RUNNING → COMPLETED | FAILED.
 *  - COMPLETED when the source is exhausted or {@code resultsPerArea} listings were accepted
 *  - FAILED when the source errors (the failure stays with this area) or the job is cancelled,
 *    including a cancel raised after the last record
 *  - an OutputWriteException also fails the area but is rethrown, because it ends the whole job
 * No retries: a failed area needs a new submission.
 */
@Slf4j
@Builder
public class AreaJobRunner implements Runnable {

    @NonNull private final String jobId;
    @NonNull private final AreaRun areaRun;
    @NonNull private final String searchQuery;
    private final int resultsPerArea;
    @NonNull private final PlaceSource source;
    @NonNull private final DedupeGate gate;
    @NonNull private final PlaceCsvWriter writer;
    @NonNull private final ProgressEventChannel events;
    @NonNull private final CancellationFlag cancellation;
    @NonNull private final Clock clock;
    private final int progressEvery;
    private final Consumer<PlaceRecord> onAccepted;

    @Override
    public void run() {
        String area = areaRun.getArea();

        if (!areaRun.markRunning(clock.instant())) {
            log.debug("Area '{}' of job {} was finished before it started", area, jobId);
            return;
        }
        if (cancellation.isRequested()) {
            fail(cancellation.reason());
            return;
        }
        publish(ProgressEvent.Type.AREA_STATE);
        log.info("Job {}: area '{}' started (target {} records)", jobId, area, resultsPerArea);

        try (PlaceCursor cursor = source.open(searchQuery, resultsPerArea)) {
            int pulled = 0;
            while (areaRun.getAcceptedCount() < resultsPerArea) {
                if (cancellation.isRequested()) {
                    fail(cancellation.reason());
                    return;
                }

                Optional<PlaceRecord> next = cursor.next();
                if (next.isEmpty()) break;

                process(next.get());
                pulled++;
                if (pulled % Math.max(1, progressEvery) == 0) {
                    publish(ProgressEvent.Type.AREA_PROGRESS);
                }
            }
        } catch (OutputWriteException e) {
            fail("output writer failure: " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.warn("Job {}: area '{}' failed after {} accepted records: {}",
                    jobId, area, areaRun.getAcceptedCount(), e.getMessage());
            fail(describe(e));
            return;
        }

        // the job may have been aborted while the last records were processed
        if (cancellation.isRequested()) {
            fail(cancellation.reason());
            return;
        }
        if (areaRun.markCompleted(clock.instant())) {
            publish(ProgressEvent.Type.AREA_STATE);
            var done = areaRun.snapshot();
            log.info("Job {}: area '{}' completed: {} accepted, {} duplicates",
                    jobId, area, done.getAcceptedCount(), done.getDuplicateCount());
        }
    }

    private void process(PlaceRecord record) {
        if (gate.admit(record) == DedupeGate.Admission.ACCEPTED) {
            writer.write(record);
            areaRun.recordAccepted();
            if (onAccepted != null) {
                onAccepted.accept(record);
            }
        } else {
            areaRun.recordDuplicate();
        }
    }

    private void fail(String reason) {
        if (areaRun.markFailed(reason, clock.instant())) {
            publish(ProgressEvent.Type.AREA_STATE);
        }
    }

    private void publish(ProgressEvent.Type type) {
        events.publish(ProgressEvent.forArea(type, jobId, areaRun.snapshot(), clock.instant()));
    }

    private String describe(RuntimeException e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
