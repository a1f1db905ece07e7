package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.ExtractedPlace;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the browser-automation sidecar that does the actual map scraping.
 *
 * The sidecar is slow and shares one browser pool, so every call is preceded by a
 * configurable pause. A 429 or 5xx triggers the Resilience4j retry with exponential backoff;
 * once retries are exhausted the exception reaches the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExtractionApiClient {

    private final RestTemplate restTemplate;
    private final ScraperProperties properties;

    /**
     * Fetch one page of listings for a search.
     *
     * @param searchQuery e.g. "coffee shops in Adyar, Chennai, Tamil Nadu, India"
     * @param offset      number of listings already consumed
     * @param limit       page size
     * @return listings in result order (may be empty, never null)
     */
    @Retry(name = "extractionApi")
    public List<ExtractedPlace> fetchPlaces(String searchQuery, int offset, int limit) {
        URI uri = UriComponentsBuilder
                .fromHttpUrl(properties.getApi().getBaseUrl() + "/places")
                .queryParam("query", searchQuery)
                .queryParam("offset", offset)
                .queryParam("limit", limit)
                .build()
                .encode()
                .toUri();

        return callApi(uri);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<ExtractedPlace> callApi(URI uri) {
        log.debug("Calling extraction API: {}", uri);
        try {
            applyRateLimit();
            ExtractedPlace[] response = restTemplate.getForObject(uri, ExtractedPlace[].class);
            if (response == null) {
                return Collections.emptyList();
            }
            log.debug("Extraction API returned {} places for {}", response.length, uri);
            return Arrays.asList(response);

        } catch (HttpClientErrorException.NotFound e) {
            // no results page for this offset
            log.debug("No places found (404) for {}", uri);
            return Collections.emptyList();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by extraction API, backing off");
            throw e;

        } catch (Exception e) {
            log.error("Extraction API call failed for {}: {}", uri, e.getMessage());
            throw e;
        }
    }

    private void applyRateLimit() {
        long delay = properties.getApi().getRateLimitDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
