package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.model.ExtractedPlace;
import com.propertyintel.places.model.PlaceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HttpPlaceSourceTest {

    private static final String QUERY = "cafes in Adyar, Chennai, Tamil Nadu, India";

    @Mock
    private ExtractionApiClient apiClient;

    private HttpPlaceSource source;

    @BeforeEach
    void setUp() {
        ScraperProperties properties = new ScraperProperties();
        properties.getApi().setPageSize(3);
        source = new HttpPlaceSource(apiClient, new PlaceRecordMapper(), properties);
    }

    @Test
    void pagesUntilShortPage() {
        when(apiClient.fetchPlaces(QUERY, 0, 3)).thenReturn(places(0, 3));
        when(apiClient.fetchPlaces(QUERY, 3, 3)).thenReturn(places(3, 2));

        List<String> names = drain(source.open(QUERY, 10));

        assertThat(names).containsExactly("p0", "p1", "p2", "p3", "p4");
        verify(apiClient).fetchPlaces(QUERY, 3, 3);
    }

    @Test
    void pageSizeNeverExceedsRequestedResults() {
        when(apiClient.fetchPlaces(QUERY, 0, 2)).thenReturn(places(0, 1));

        assertThat(drain(source.open(QUERY, 2))).containsExactly("p0");
    }

    @Test
    void openIsLazy() {
        source.open(QUERY, 5).close();
        verifyNoInteractions(apiClient);
    }

    @Test
    void apiFailureBecomesPlaceSourceException() {
        when(apiClient.fetchPlaces(anyString(), anyInt(), anyInt()))
                .thenThrow(new ResourceAccessException("connection refused"));

        PlaceCursor cursor = source.open(QUERY, 5);

        assertThatThrownBy(cursor::next)
                .isInstanceOf(PlaceSourceException.class)
                .hasMessageContaining("connection refused");
    }

    private static List<String> drain(PlaceCursor cursor) {
        List<String> names = new ArrayList<>();
        try (cursor) {
            Optional<PlaceRecord> next;
            while ((next = cursor.next()).isPresent()) {
                names.add(next.get().getName());
            }
        }
        return names;
    }

    private static List<ExtractedPlace> places(int from, int count) {
        return IntStream.range(from, from + count).mapToObj(i -> {
            ExtractedPlace p = new ExtractedPlace();
            p.setName("p" + i);
            p.setAddress("Street " + i);
            return p;
        }).toList();
    }
}
