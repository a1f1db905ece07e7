package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.ExtractedPlace;
import com.propertyintel.places.model.PlaceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Default PlaceSource: pages through the extraction sidecar one request at a time.
 * A page shorter than requested ends the search.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HttpPlaceSource implements PlaceSource {

    private final ExtractionApiClient apiClient;
    private final PlaceRecordMapper mapper;
    private final ScraperProperties properties;

    @Override
    public PlaceCursor open(String searchQuery, int maxResults) {
        int pageSize = Math.max(1, Math.min(properties.getApi().getPageSize(), maxResults));
        return new HttpPlaceCursor(searchQuery, pageSize);
    }

    private class HttpPlaceCursor implements PlaceCursor {

        private final String searchQuery;
        private final int pageSize;
        private final Deque<ExtractedPlace> page = new ArrayDeque<>();
        private int offset;
        private boolean exhausted;

        HttpPlaceCursor(String searchQuery, int pageSize) {
            this.searchQuery = searchQuery;
            this.pageSize = pageSize;
        }

        @Override
        public Optional<PlaceRecord> next() {
            if (page.isEmpty() && !exhausted) {
                fetchPage();
            }
            ExtractedPlace raw = page.poll();
            return raw == null ? Optional.empty() : Optional.of(mapper.map(raw));
        }

        private void fetchPage() {
            List<ExtractedPlace> fetched;
            try {
                fetched = apiClient.fetchPlaces(searchQuery, offset, pageSize);
            } catch (RuntimeException e) {
                throw new PlaceSourceException("Extraction failed for '" + searchQuery
                        + "' at offset " + offset + ": " + e.getMessage(), e);
            }
            page.addAll(fetched);
            offset += fetched.size();
            if (fetched.size() < pageSize) {
                exhausted = true;
                log.debug("Search '{}' exhausted after {} places", searchQuery, offset);
            }
        }

        @Override
        public void close() {
            page.clear();
            exhausted = true;
        }
    }
}
