package com.propertyintel.places.model;

import java.util.List;

/**
 * How a finished job's status is derived from its areas.
 */
public enum FailurePolicy {

    /** COMPLETED if at least one area completed, even when others failed */
    PARTIAL_SUCCESS,

    /** FAILED as soon as any area failed */
    ANY_FAILURE_FATAL;

    /**
     * @param areas terminal area snapshots
     */
    public JobStatus resolve(List<AreaRunSnapshot> areas) {
        boolean anyCompleted = areas.stream().anyMatch(a -> a.getState() == AreaRunState.COMPLETED);
        boolean anyFailed = areas.stream().anyMatch(a -> a.getState() == AreaRunState.FAILED);

        return switch (this) {
            case PARTIAL_SUCCESS -> anyCompleted ? JobStatus.COMPLETED : JobStatus.FAILED;
            case ANY_FAILURE_FATAL -> anyCompleted && !anyFailed ? JobStatus.COMPLETED : JobStatus.FAILED;
        };
    }
}
