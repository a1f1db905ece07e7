package com.propertyintel.places.service;

import com.propertyintel.places.model.PlaceRecord;

import java.util.Optional;

/**
 * Sequential read over one search's listings.
 */
public interface PlaceCursor extends AutoCloseable {

    /**
     * @return the next listing, or empty once the search is exhausted
     * @throws PlaceSourceException on an unrecoverable extraction error
     */
    Optional<PlaceRecord> next();

    @Override
    void close();
}
