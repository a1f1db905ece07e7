package com.propertyintel.places.service;

import com.propertyintel.places.model.ProgressEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressEventChannelTest {

    private static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    @Test
    void subscriberOnlySeesItsOwnJob() {
        ProgressEventChannel channel = new ProgressEventChannel(16);
        ProgressSubscription jobA = channel.subscribe("a");
        ProgressSubscription everything = channel.subscribe(null);

        channel.publish(event("a", 1));
        channel.publish(event("b", 2));

        assertThat(jobA.drain()).extracting(ProgressEvent::getJobId).containsExactly("a");
        assertThat(everything.drain()).extracting(ProgressEvent::getJobId).containsExactly("a", "b");
    }

    @Test
    void fullQueueDropsOldestAndCounts() {
        ProgressEventChannel channel = new ProgressEventChannel(3);
        ProgressSubscription slow = channel.subscribe("a");

        for (int i = 1; i <= 5; i++) {
            channel.publish(event("a", i));
        }

        List<ProgressEvent> received = slow.drain();
        assertThat(received).extracting(ProgressEvent::getAcceptedCount).containsExactly(3, 4, 5);
        assertThat(slow.droppedCount()).isEqualTo(2);
    }

    @Test
    void closedSubscriptionStopsReceiving() throws Exception {
        ProgressEventChannel channel = new ProgressEventChannel(8);
        ProgressSubscription sub = channel.subscribe("a");
        assertThat(channel.subscriberCount()).isEqualTo(1);

        sub.close();
        sub.close();
        channel.publish(event("a", 1));

        assertThat(sub.isClosed()).isTrue();
        assertThat(channel.subscriberCount()).isZero();
        assertThat(sub.poll(Duration.ofMillis(10))).isNull();
    }

    @Test
    void pollWaitsForNextEvent() throws Exception {
        ProgressEventChannel channel = new ProgressEventChannel(8);
        ProgressSubscription sub = channel.subscribe("a");

        Thread publisher = new Thread(() -> channel.publish(event("a", 7)));
        publisher.start();

        ProgressEvent received = sub.poll(Duration.ofSeconds(5));
        publisher.join();
        assertThat(received).isNotNull();
        assertThat(received.getAcceptedCount()).isEqualTo(7);
    }

    @Test
    void publishingWithoutSubscribersIsFine() {
        ProgressEventChannel channel = new ProgressEventChannel(1);
        channel.publish(event("a", 1));
        assertThat(channel.subscriberCount()).isZero();
    }

    @Test
    void rejectsZeroCapacity() {
        assertThatThrownBy(() -> new ProgressEventChannel(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ProgressEvent event(String jobId, int accepted) {
        return new ProgressEvent(ProgressEvent.Type.AREA_PROGRESS, jobId, "Adyar", "RUNNING",
                accepted, accepted, 0, null, NOW);
    }
}
