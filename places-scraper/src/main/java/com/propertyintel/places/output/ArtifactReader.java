package com.propertyintel.places.output;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import com.propertyintel.places.model.ArtifactPreview;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the output CSV: bounded previews and streaming row counts.
 * Never loads the whole file.
 */
@Component
@Slf4j
public class ArtifactReader {

    /**
     * Header plus at most {@code limit} data rows.
     */
    public ArtifactPreview preview(Path csv, int limit) {
        if (!Files.exists(csv)) {
            throw new IllegalArgumentException("Output file not found: " + csv.getFileName());
        }

        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in).build()) {

            String[] header = reader.readNext();
            if (header == null) {
                return new ArtifactPreview(List.of(), List.of(), "file");
            }
            List<String> columns = Arrays.asList(header);

            List<Map<String, String>> rows = new ArrayList<>();
            String[] line;
            while (rows.size() < limit && (line = reader.readNext()) != null) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), i < line.length ? line[i] : "");
                }
                rows.add(row);
            }
            return new ArtifactPreview(columns, rows, "file");

        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + csv.getFileName(), e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Malformed CSV in " + csv.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Data rows in the file, header excluded. Streams the file; 0 if it doesn't exist.
     */
    public int countRows(Path csv) {
        if (!Files.exists(csv)) return 0;

        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReaderBuilder(in).build()) {

            if (reader.readNext() == null) return 0;
            int count = 0;
            while (reader.readNext() != null) {
                count++;
            }
            return count;

        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + csv.getFileName(), e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Malformed CSV in " + csv.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
