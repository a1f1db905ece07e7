package com.propertyintel.places.service;

/**
 * Producer of listings for one search, backed by whatever does the actual extraction.
 */
public interface PlaceSource {

    /**
     * Starts a fresh, finite stream of listings for {@code searchQuery}.
     *
     * @param maxResults how many listings the caller intends to keep; a hint, the cursor may
     *                   yield more (duplicates are filtered downstream) or fewer
     * @throws PlaceSourceException if the search cannot be started
     */
    PlaceCursor open(String searchQuery, int maxResults);
}
