package com.propertyintel.places.service;

/**
 * Cooperative stop signal shared by all areas of a job, checked between records.
 * The first reason wins.
 */
public class CancellationFlag {

    private volatile String reason;

    public synchronized boolean request(String reason) {
        if (this.reason != null) return false;
        this.reason = reason;
        return true;
    }

    public boolean isRequested() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }
}
