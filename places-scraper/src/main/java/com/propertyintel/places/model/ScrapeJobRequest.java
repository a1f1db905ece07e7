package com.propertyintel.places.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Submission payload: one business type searched across a list of areas,
 * all results landing in one CSV.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapeJobRequest {

    /** e.g. "coffee shops" */
    private String businessType;

    /** Target accepted (non-duplicate) records per area */
    private Integer resultsPerArea;

    private List<String> areas;

    /** File name under the configured output directory */
    private String outputFile;

    /** Append to an existing file instead of starting a new one */
    private boolean appendMode;

    /** Append without checking the existing rows for duplicates; implies appendMode */
    private boolean fastAppend;

    /** Worker count; null → configured default */
    private Integer concurrency;

    /** null → configured default */
    private FailurePolicy failurePolicy;
}
