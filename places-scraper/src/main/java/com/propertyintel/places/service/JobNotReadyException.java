package com.propertyintel.places.service;

public class JobNotReadyException extends RuntimeException {

    public JobNotReadyException(String message) {
        super(message);
    }
}
