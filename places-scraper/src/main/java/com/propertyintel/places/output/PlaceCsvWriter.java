package com.propertyintel.places.output;

import com.opencsv.CSVWriter;
import com.propertyintel.places.model.PlaceRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers accepted listings and commits them to one CSV file in batches.
 *
 * One instance per job, shared by all of the job's areas. Buffering and flushing
 * share the instance lock, so a batch is always written whole and rows from two
 * areas never interleave.
 *
 * Fresh mode truncates the file and writes the header straight away.
 * Append mode on an existing, non-empty file trusts its header and only adds rows.
 */
@Slf4j
public class PlaceCsvWriter implements Closeable {

    public static final String[] HEADERS = {
            "name", "address",
            "website", "phone_number",
            "reviews_count", "reviews_average",
            "store_shopping", "in_store_pickup", "store_delivery",
            "place_type", "opens_at", "introduction"
    };

    private final Path outputPath;
    private final int batchSize;
    private final boolean appending;
    private final CSVWriter writer;
    private final List<PlaceRecord> buffer = new ArrayList<>();

    private int rowsWritten;
    private boolean closed;
    private boolean failed;

    private PlaceCsvWriter(Path outputPath, int batchSize, boolean appending, CSVWriter writer) {
        this.outputPath = outputPath;
        this.batchSize = batchSize;
        this.appending = appending;
        this.writer = writer;
    }

    public static PlaceCsvWriter open(Path outputPath, boolean appendMode, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Flush batch size must be at least 1, got " + batchSize);
        }
        ensureDirectory(outputPath.getParent());

        try {
            boolean appending = appendMode && Files.exists(outputPath) && Files.size(outputPath) > 0;
            boolean needsLineBreak = appending && !endsWithNewline(outputPath);

            Writer out = appending
                    ? Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                            StandardOpenOption.WRITE, StandardOpenOption.APPEND)
                    : Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8,
                            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);

            if (needsLineBreak) {
                // last row of the existing file has no terminator; don't glue our first row onto it
                out.write(CSVWriter.DEFAULT_LINE_END);
            }

            return over(outputPath, out, appending, batchSize);

        } catch (IOException e) {
            throw new OutputWriteException("Cannot open output file " + outputPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Wraps an already opened stream; the header is written unless {@code appending}.
     */
    static PlaceCsvWriter over(Path outputPath, Writer out, boolean appending, int batchSize) throws IOException {
        CSVWriter csv = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);

        if (!appending) {
            csv.writeNext(HEADERS);
        }
        csv.flush();

        log.info("Opened {} ({}, batch size {})", outputPath, appending ? "append" : "fresh", batchSize);
        return new PlaceCsvWriter(outputPath, batchSize, appending, csv);
    }

    /**
     * Buffers one record, flushing when the batch is full.
     */
    public synchronized void write(PlaceRecord record) {
        if (closed) {
            throw new IllegalStateException("Writer for " + outputPath + " is closed");
        }
        ensureHealthy();
        buffer.add(record);
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    /**
     * Commits everything buffered as one append and clears the buffer.
     * After one failed flush every later write or flush fails too.
     */
    public synchronized void flush() {
        ensureHealthy();
        if (buffer.isEmpty()) return;

        List<String[]> rows = new ArrayList<>(buffer.size());
        for (PlaceRecord r : buffer) {
            rows.add(toRow(r));
        }
        buffer.clear();

        try {
            writer.writeAll(rows);
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("write error reported by CSV writer");
            }
            rowsWritten += rows.size();
            log.debug("Flushed {} rows to {} ({} total)", rows.size(), outputPath, rowsWritten);
        } catch (IOException e) {
            failed = true;
            throw new OutputWriteException("Failed to flush " + rows.size() + " rows to " + outputPath
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Flushes what is left and closes the file. Safe to call more than once.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        try {
            if (!failed) {
                flush();
            }
        } finally {
            try {
                writer.close();
            } catch (IOException e) {
                throw new OutputWriteException("Failed to close " + outputPath + ": " + e.getMessage(), e);
            }
        }
        log.info("Closed {}: {} rows written", outputPath, rowsWritten);
    }

    public synchronized boolean isFailed() {
        return failed;
    }

    public synchronized int getRowsWritten() {
        return rowsWritten;
    }

    public synchronized int getBufferedCount() {
        return buffer.size();
    }

    public boolean isAppending() {
        return appending;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public static String[] toRow(PlaceRecord r) {
        return new String[]{
                str(r.getName()),
                str(r.getAddress()),
                str(r.getWebsite()),
                str(r.getPhoneNumber()),
                str(r.getReviewsCount()),
                str(r.getReviewsAverage()),
                yesNo(r.isStoreShopping()),
                yesNo(r.isInStorePickup()),
                yesNo(r.isStoreDelivery()),
                str(r.getPlaceType()),
                str(r.getOpensAt()),
                str(r.getIntroduction())
        };
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private static String yesNo(boolean val) {
        return val ? "Yes" : "No";
    }

    private void ensureHealthy() {
        if (failed) {
            throw new OutputWriteException("Writer for " + outputPath + " failed earlier, "
                    + "rows after the last successful flush are lost", null);
        }
    }

    private static boolean endsWithNewline(Path path) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) return true;
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) == '\n';
        }
    }

    private static void ensureDirectory(Path dir) {
        if (dir == null) return;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new OutputWriteException("Cannot create output directory: " + dir, e);
        }
    }
}
