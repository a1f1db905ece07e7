package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe fan-out of progress events from area runners to observers.
 *
 * Publishing never blocks: each subscriber has its own bounded queue and slow subscribers
 * lose their oldest events instead of holding up a runner.
 */
@Component
@Slf4j
public class ProgressEventChannel {

    private final CopyOnWriteArrayList<ProgressSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final int queueCapacity;

    public ProgressEventChannel(ScraperProperties properties) {
        this(properties.getEvents().getSubscriberQueueCapacity());
    }

    public ProgressEventChannel(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Subscriber queue capacity must be at least 1, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    public void publish(ProgressEvent event) {
        for (ProgressSubscription subscription : subscriptions) {
            if (subscription.accepts(event)) {
                subscription.offer(event);
            }
        }
    }

    /**
     * @param jobId only receive this job's events; null for every job
     */
    public ProgressSubscription subscribe(String jobId) {
        ProgressSubscription subscription = new ProgressSubscription(jobId, queueCapacity, this);
        subscriptions.add(subscription);
        log.debug("Subscriber added for {} ({} active)", jobId == null ? "all jobs" : "job " + jobId,
                subscriptions.size());
        return subscription;
    }

    void unsubscribe(ProgressSubscription subscription) {
        subscriptions.remove(subscription);
    }

    public int subscriberCount() {
        return subscriptions.size();
    }
}
