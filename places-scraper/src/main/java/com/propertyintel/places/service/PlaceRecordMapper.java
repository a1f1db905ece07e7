package com.propertyintel.places.service;

import com.propertyintel.places.model.ExtractedPlace;
import com.propertyintel.places.model.PlaceRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps raw extraction DTOs to the immutable PlaceRecord.
 */
@Component
@Slf4j
public class PlaceRecordMapper {

    public PlaceRecord map(ExtractedPlace raw) {
        return PlaceRecord.builder()
                .name(clean(raw.getName()))
                .address(clean(raw.getAddress()))
                .website(clean(raw.getWebsite()))
                .phoneNumber(clean(raw.getPhoneNumber()))
                .reviewsCount(parseCount(raw.getReviewsCount()))
                .reviewsAverage(parseAverage(raw.getReviewsAverage()))
                .storeShopping(isYes(raw.getStoreShopping()))
                .inStorePickup(isYes(raw.getInStorePickup()))
                .storeDelivery(isYes(raw.getStoreDelivery()))
                .placeType(clean(raw.getPlaceType()))
                .opensAt(clean(raw.getOpensAt()))
                .introduction(clean(raw.getIntroduction()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * "1,234" / "(1,234)" / "1234" → 1234
     */
    Integer parseCount(String val) {
        if (val == null) return null;
        String digits = val.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) return null;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            log.debug("Review count out of range: {}", val);
            return null;
        }
    }

    /**
     * "4.5" / "4,5" → 4.5
     */
    Double parseAverage(String val) {
        if (val == null || val.isBlank()) return null;
        try {
            return Double.parseDouble(val.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            log.debug("Unparseable review average: {}", val);
            return null;
        }
    }

    private boolean isYes(String val) {
        return val != null && (val.trim().equalsIgnoreCase("yes") || val.trim().equalsIgnoreCase("true"));
    }

    private String clean(String val) {
        return (val == null || val.isBlank()) ? "" : val.trim();
    }
}
