package com.propertyintel.places.model;

public enum AreaRunState {
    PENDING, RUNNING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
