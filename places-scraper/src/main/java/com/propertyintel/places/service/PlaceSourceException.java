package com.propertyintel.places.service;

/**
 * Extraction failed for one search. Only the area that hit it fails.
 */
public class PlaceSourceException extends RuntimeException {

    public PlaceSourceException(String message) {
        super(message);
    }

    public PlaceSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
