package com.propertyintel.places.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;

/**
 * Broadcast to event subscribers. For JOB_STATE events {@code area} is null and
 * {@code state} carries the JobStatus name.
 */
@Value
public class ProgressEvent {

    public enum Type {
        AREA_STATE, AREA_PROGRESS, JOB_STATE
    }

    Type type;
    String jobId;
    String area;
    String state;
    int acceptedCount;
    int rawCount;
    int duplicateCount;
    String message;
    Instant timestamp;

    public static ProgressEvent forArea(Type type, String jobId, AreaRunSnapshot area, Instant timestamp) {
        return new ProgressEvent(type, jobId, area.getArea(), area.getState().name(),
                area.getAcceptedCount(), area.getRawCount(), area.getDuplicateCount(), area.getErrorMessage(), timestamp);
    }

    public static ProgressEvent forJob(JobSnapshot job, Instant timestamp) {
        return new ProgressEvent(Type.JOB_STATE, job.getJobId(), null, job.getStatus().name(),
                job.getAcceptedCount(), job.getRawCount(), job.getDuplicateCount(), job.getErrorMessage(), timestamp);
    }

    @JsonIgnore
    public boolean isJobTerminal() {
        return type == Type.JOB_STATE && !JobStatus.RUNNING.name().equals(state);
    }
}
