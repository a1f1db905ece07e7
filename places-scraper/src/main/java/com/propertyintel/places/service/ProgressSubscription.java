package com.propertyintel.places.service;

import com.propertyintel.places.model.ProgressEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One subscriber's private, bounded view of the event channel.
 *
 * Publishers only ever offer to the queue; when it is full the oldest undelivered event
 * is dropped and counted. A subscriber that falls behind can recover the current state
 * from the job snapshot.
 */
public class ProgressSubscription implements AutoCloseable {

    private final String jobId;
    private final BlockingQueue<ProgressEvent> queue;
    private final ProgressEventChannel channel;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    ProgressSubscription(String jobId, int capacity, ProgressEventChannel channel) {
        this.jobId = jobId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.channel = channel;
    }

    boolean accepts(ProgressEvent event) {
        return !closed && (jobId == null || jobId.equals(event.getJobId()));
    }

    void offer(ProgressEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    /**
     * @return the next event, or null if none arrived within {@code timeout}
     */
    public ProgressEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<ProgressEvent> drain() {
        List<ProgressEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        channel.unsubscribe(this);
    }
}
