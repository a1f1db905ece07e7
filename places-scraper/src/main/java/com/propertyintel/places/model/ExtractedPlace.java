package com.propertyintel.places.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Raw DTO matching the extraction service's JSON.
 * Kept separate from PlaceRecord to isolate the sidecar's formatting quirks
 * (review counts come back as "1,234", flags as "Yes"/"No").
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractedPlace {

    private String name;

    private String address;

    private String website;

    @JsonProperty("phone_number")
    private String phoneNumber;

    @JsonProperty("reviews_count")
    private String reviewsCount;

    @JsonProperty("reviews_average")
    private String reviewsAverage;

    @JsonProperty("store_shopping")
    private String storeShopping;

    @JsonProperty("in_store_pickup")
    private String inStorePickup;

    @JsonProperty("store_delivery")
    private String storeDelivery;

    @JsonProperty("place_type")
    private String placeType;

    @JsonProperty("opens_at")
    private String opensAt;

    private String introduction;
}
