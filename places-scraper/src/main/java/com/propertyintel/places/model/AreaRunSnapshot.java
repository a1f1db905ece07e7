package com.propertyintel.places.model;

import lombok.Value;

import java.time.Instant;

@Value
public class AreaRunSnapshot {

    String area;
    AreaRunState state;
    int acceptedCount;
    int rawCount;
    int duplicateCount;

    /** Set once the area FAILED */
    String errorMessage;

    Instant startedAt;
    Instant completedAt;
}
