package com.propertyintel.places.model;

import lombok.Builder;
import lombok.Value;

/**
 * One business listing as handed over by the extraction service.
 *
 * Immutable once built. Deduplication only looks at name + address,
 * every other field is carried through to the CSV as-is.
 */
@Value
@Builder
public class PlaceRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    String name;
    String address;

    // ── Contact ─────────────────────────────────────────────────────────────
    String website;
    String phoneNumber;

    // ── Reviews ─────────────────────────────────────────────────────────────
    /** Null when the listing shows no reviews */
    Integer reviewsCount;

    /** Star average, 1.0 - 5.0 */
    Double reviewsAverage;

    // ── Service options ─────────────────────────────────────────────────────
    boolean storeShopping;
    boolean inStorePickup;
    boolean storeDelivery;

    // ── Details ─────────────────────────────────────────────────────────────
    /** Category label, e.g. "Coffee shop" */
    String placeType;

    /** Opening hours text as shown on the listing */
    String opensAt;

    String introduction;
}
