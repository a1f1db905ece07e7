package com.propertyintel.places.dedupe;

import com.propertyintel.places.model.PlaceRecord;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives a compact digest from a listing's name + address.
 *
 * Both fields are lower-cased and whitespace-collapsed, joined with '|', and only a
 * leading window of the result is hashed. The window grows with the content and is
 * clipped to [minSampleChars, maxSampleChars]: anything up to the upper bound is
 * hashed in full, longer content only by its first maxSampleChars characters.
 * Same input always gives the same fingerprint; collisions count as duplicates.
 */
public class RecordFingerprinter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int minSampleChars;
    private final int maxSampleChars;

    public RecordFingerprinter(int minSampleChars, int maxSampleChars) {
        if (minSampleChars < 1 || maxSampleChars < minSampleChars) {
            throw new IllegalArgumentException(
                    "Invalid sample window [" + minSampleChars + ", " + maxSampleChars + "]");
        }
        this.minSampleChars = minSampleChars;
        this.maxSampleChars = maxSampleChars;
    }

    public String fingerprint(PlaceRecord record) {
        return fingerprint(record.getName(), record.getAddress());
    }

    public String fingerprint(String name, String address) {
        String content = normalise(name) + "|" + normalise(address);
        String sample = content.substring(0, sampleWindow(content.length()));
        return DigestUtils.md5DigestAsHex(sample.getBytes(StandardCharsets.UTF_8));
    }

    int sampleWindow(int contentLength) {
        int clipped = Math.max(minSampleChars, Math.min(maxSampleChars, contentLength));
        return Math.min(contentLength, clipped);
    }

    private String normalise(String value) {
        if (value == null) return "";
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
