package com.propertyintel.places.model;

public enum JobStatus {
    RUNNING, COMPLETED, FAILED
}
