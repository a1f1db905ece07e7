package com.propertyintel.places.service;

import com.propertyintel.places.model.JobSnapshot;
import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by a submission. {@code completion} finishes with the final snapshot
 * once the output file is closed.
 */
@Value
public class JobHandle {

    String jobId;
    CompletableFuture<JobSnapshot> completion;
}
