package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.JobSnapshot;
import com.propertyintel.places.model.JobStatus;
import com.propertyintel.places.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Bridges the progress channel to Server-Sent Events.
 *
 * Each stream drains its own subscription on the event-stream executor, so a slow
 * browser only ever delays itself. The first event is a full snapshot; the stream
 * completes after the job's terminal JOB_STATE event.
 */
@Component
@Slf4j
public class JobEventStreamer {

    private static final Duration POLL_INTERVAL = Duration.ofSeconds(1);

    private final ScrapeJobService jobService;
    private final ProgressEventChannel events;
    private final ExecutorService executor;
    private final ScraperProperties properties;

    public JobEventStreamer(ScrapeJobService jobService,
                            ProgressEventChannel events,
                            @Qualifier("eventStreamExecutor") ExecutorService executor,
                            ScraperProperties properties) {
        this.jobService = jobService;
        this.events = events;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * @throws JobNotFoundException for an unknown job, before any stream is opened
     */
    public SseEmitter stream(String jobId) {
        // subscribe before the snapshot so nothing published in between is lost
        ProgressSubscription subscription = events.subscribe(jobId);
        JobSnapshot snapshot;
        try {
            snapshot = jobService.status(jobId);
        } catch (RuntimeException e) {
            subscription.close();
            throw e;
        }

        SseEmitter emitter = new SseEmitter(properties.getEvents().getStreamTimeout().toMillis());
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(error -> subscription.close());

        executor.submit(() -> pump(jobId, snapshot, subscription, emitter));
        return emitter;
    }

    private void pump(String jobId, JobSnapshot snapshot, ProgressSubscription subscription, SseEmitter emitter) {
        try {
            emitter.send(SseEmitter.event().name("snapshot").data(snapshot));
            if (snapshot.getStatus() != JobStatus.RUNNING) {
                emitter.complete();
                return;
            }

            while (!subscription.isClosed()) {
                ProgressEvent event = subscription.poll(POLL_INTERVAL);
                if (event == null) continue;

                emitter.send(SseEmitter.event()
                        .name(event.getType().name().toLowerCase(Locale.ROOT))
                        .data(event));

                if (event.isJobTerminal()) {
                    emitter.complete();
                    return;
                }
            }
        } catch (IOException e) {
            log.debug("Event stream for job {} closed by client: {}", jobId, e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } finally {
            subscription.close();
            if (subscription.droppedCount() > 0) {
                log.warn("Event stream for job {} dropped {} events (slow consumer)", jobId, subscription.droppedCount());
            }
        }
    }
}
