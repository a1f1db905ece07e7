package com.propertyintel.places.service;

public class InvalidJobRequestException extends IllegalArgumentException {

    public InvalidJobRequestException(String message) {
        super(message);
    }
}
