package com.propertyintel.places.dedupe;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.propertyintel.places.model.PlaceRecord;
import com.propertyintel.places.output.OutputWriteException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Accept/reject decision for each incoming listing.
 *
 * An accepted listing stays "seen" for the lifetime of the cache; there is no second chance.
 */
@Slf4j
public class DedupeGate {

    public enum Admission {
        ACCEPTED, REJECTED
    }

    private final FingerprintCache cache;
    private final RecordFingerprinter fingerprinter;

    public DedupeGate(FingerprintCache cache, RecordFingerprinter fingerprinter) {
        this.cache = cache;
        this.fingerprinter = fingerprinter;
    }

    public Admission admit(PlaceRecord record) {
        return cache.probeAndMark(fingerprinter.fingerprint(record))
                ? Admission.ACCEPTED
                : Admission.REJECTED;
    }

    /**
     * Marks every listing already in {@code csv} as seen, streaming the file row by row and
     * keeping only fingerprints. If the file holds more identities than the cache capacity,
     * the oldest rows are evicted like any other entry.
     *
     * @return number of rows fingerprinted
     */
    public int seedFromArtifact(Path csv) {
        if (!Files.exists(csv)) return 0;

        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in).build()) {

            String[] header = reader.readNext();
            if (header == null) return 0;

            int nameCol = indexOf(header, "name");
            int addressCol = indexOf(header, "address");
            if (nameCol < 0) {
                log.warn("Existing file {} has no 'name' column, nothing seeded", csv);
                return 0;
            }

            int seeded = 0;
            String[] row;
            while ((row = reader.readNext()) != null) {
                String name = nameCol < row.length ? row[nameCol] : "";
                String address = addressCol >= 0 && addressCol < row.length ? row[addressCol] : "";
                cache.probeAndMark(fingerprinter.fingerprint(name, address));
                seeded++;
            }

            log.info("Seeded {} fingerprints from existing file {}", seeded, csv);
            return seeded;

        } catch (IOException | CsvValidationException e) {
            throw new OutputWriteException("Cannot read existing output file " + csv + ": " + e.getMessage(), e);
        }
    }

    private int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            // strip a UTF-8 BOM some spreadsheet tools leave on the first cell
            String cell = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim();
            if (cell.equalsIgnoreCase(column)) return i;
        }
        return -1;
    }
}
