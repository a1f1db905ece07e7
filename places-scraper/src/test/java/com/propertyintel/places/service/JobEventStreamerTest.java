package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.JobSnapshot;
import com.propertyintel.places.model.JobStatus;
import com.propertyintel.places.model.ProgressEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobEventStreamerTest {

    private static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    @Mock
    private ScrapeJobService jobService;

    private final ProgressEventChannel events = new ProgressEventChannel(16);
    private ExecutorService executor;
    private JobEventStreamer streamer;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        streamer = new JobEventStreamer(jobService, events, executor, new ScraperProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void unknownJobFailsBeforeStreamingAndLeavesNoSubscriber() {
        when(jobService.status("missing")).thenThrow(new JobNotFoundException("missing"));

        assertThatThrownBy(() -> streamer.stream("missing")).isInstanceOf(JobNotFoundException.class);
        assertThat(events.subscriberCount()).isZero();
    }

    @Test
    void finishedJobStreamEndsAfterSnapshot() throws Exception {
        when(jobService.status("job-1")).thenReturn(snapshot(JobStatus.COMPLETED));

        assertThat(streamer.stream("job-1")).isNotNull();

        drainExecutor();
        assertThat(events.subscriberCount()).isZero();
    }

    @Test
    void runningJobStreamEndsOnTerminalJobEvent() throws Exception {
        when(jobService.status("job-1")).thenReturn(snapshot(JobStatus.RUNNING));

        streamer.stream("job-1");
        assertThat(events.subscriberCount()).isEqualTo(1);

        events.publish(new ProgressEvent(ProgressEvent.Type.AREA_PROGRESS, "job-1", "Adyar", "RUNNING",
                1, 1, 0, null, NOW));
        events.publish(ProgressEvent.forJob(snapshot(JobStatus.COMPLETED), NOW));

        drainExecutor();
        assertThat(events.subscriberCount()).isZero();
    }

    private void drainExecutor() throws InterruptedException {
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    private static JobSnapshot snapshot(JobStatus status) {
        return JobSnapshot.builder()
                .jobId("job-1")
                .status(status)
                .startedAt(NOW)
                .areas(List.of())
                .currentAreas(List.of())
                .build();
    }
}
