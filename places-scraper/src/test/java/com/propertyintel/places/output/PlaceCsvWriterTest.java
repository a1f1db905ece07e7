package com.propertyintel.places.output;

import com.propertyintel.places.model.PlaceRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FilterWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaceCsvWriterTest {

    @TempDir
    Path tempDir;

    private final ArtifactReader reader = new ArtifactReader();

    @Test
    void freshFileGetsHeaderEvenWithoutRows() throws Exception {
        Path csv = tempDir.resolve("empty.csv");

        PlaceCsvWriter.open(csv, false, 20).close();

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(1);
        assertThat(lines.get(0)).startsWith("\"name\",\"address\"");
    }

    @Test
    void buffersUntilBatchSizeThenFlushes() {
        Path csv = tempDir.resolve("batched.csv");
        PlaceCsvWriter writer = PlaceCsvWriter.open(csv, false, 3);

        writer.write(place("A", "1"));
        writer.write(place("B", "2"));
        assertThat(writer.getRowsWritten()).isZero();
        assertThat(writer.getBufferedCount()).isEqualTo(2);
        assertThat(reader.countRows(csv)).isZero();

        writer.write(place("C", "3"));
        assertThat(writer.getRowsWritten()).isEqualTo(3);
        assertThat(writer.getBufferedCount()).isZero();
        assertThat(reader.countRows(csv)).isEqualTo(3);

        writer.write(place("D", "4"));
        writer.close();
        assertThat(writer.getRowsWritten()).isEqualTo(4);
        assertThat(reader.countRows(csv)).isEqualTo(4);
    }

    @Test
    void writesAllColumnsWithYesNoFlags() {
        Path csv = tempDir.resolve("columns.csv");
        try (PlaceCsvWriter writer = PlaceCsvWriter.open(csv, false, 20)) {
            writer.write(PlaceRecord.builder()
                    .name("Amethyst Cafe")
                    .address("Whites Rd, Royapettah")
                    .website("https://amethyst.example")
                    .phoneNumber("044 4599 1633")
                    .reviewsCount(5321)
                    .reviewsAverage(4.3)
                    .storeShopping(true)
                    .inStorePickup(false)
                    .storeDelivery(true)
                    .placeType("Cafe")
                    .opensAt("Opens 10 am")
                    .introduction("Garden cafe, \"quiet\", in an old house")
                    .build());
        }

        Map<String, String> row = reader.preview(csv, 1).getRows().get(0);
        assertThat(row).containsEntry("name", "Amethyst Cafe")
                .containsEntry("reviews_count", "5321")
                .containsEntry("reviews_average", "4.3")
                .containsEntry("store_shopping", "Yes")
                .containsEntry("in_store_pickup", "No")
                .containsEntry("store_delivery", "Yes")
                .containsEntry("introduction", "Garden cafe, \"quiet\", in an old house");
    }

    @Test
    void concurrentWritersNeverTearOrLoseRows() throws Exception {
        Path csv = tempDir.resolve("concurrent.csv");
        PlaceCsvWriter writer = PlaceCsvWriter.open(csv, false, 20);
        int threads = 4;
        int perThread = 250;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int runner = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        writer.write(place("runner-" + runner + "-place-" + i, "Street " + i + ", Chennai"));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        writer.close();

        assertThat(reader.countRows(csv)).isEqualTo(threads * perThread);

        Set<String> names = new HashSet<>();
        for (Map<String, String> row : reader.preview(csv, threads * perThread).getRows()) {
            assertThat(row.get("address")).startsWith("Street ").endsWith(", Chennai");
            names.add(row.get("name"));
        }
        assertThat(names).hasSize(threads * perThread);
    }

    @Test
    void appendModeKeepsExistingHeaderAndRows() throws Exception {
        Path csv = tempDir.resolve("append.csv");
        try (PlaceCsvWriter first = PlaceCsvWriter.open(csv, false, 20)) {
            first.write(place("A", "1"));
            first.write(place("B", "2"));
            first.write(place("C", "3"));
        }

        PlaceCsvWriter second = PlaceCsvWriter.open(csv, true, 20);
        assertThat(second.isAppending()).isTrue();
        second.write(place("D", "4"));
        second.write(place("E", "5"));
        second.close();

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertThat(lines.stream().filter(l -> l.startsWith("\"name\"")).count()).isEqualTo(1);
        assertThat(reader.countRows(csv)).isEqualTo(5);
    }

    @Test
    void appendModeOnMissingFileCreatesItWithHeader() {
        Path csv = tempDir.resolve("nested/dir/new.csv");

        PlaceCsvWriter writer = PlaceCsvWriter.open(csv, true, 20);
        writer.write(place("A", "1"));
        writer.close();

        assertThat(writer.isAppending()).isFalse();
        assertThat(reader.preview(csv, 5).getColumns()).containsExactly(PlaceCsvWriter.HEADERS);
        assertThat(reader.countRows(csv)).isEqualTo(1);
    }

    @Test
    void appendAfterFileWithoutTrailingNewlineStartsOnNewLine() throws Exception {
        Path csv = tempDir.resolve("no-newline.csv");
        Files.writeString(csv, "name,address\nOld Place,Mylapore", StandardCharsets.UTF_8);

        try (PlaceCsvWriter writer = PlaceCsvWriter.open(csv, true, 20)) {
            writer.write(place("New Place", "Guindy"));
        }

        List<Map<String, String>> rows = reader.preview(csv, 10).getRows();
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsEntry("name", "Old Place").containsEntry("address", "Mylapore");
        assertThat(rows.get(1)).containsEntry("name", "New Place").containsEntry("address", "Guindy");
    }

    @Test
    void freshModeOverwritesExistingFile() throws Exception {
        Path csv = tempDir.resolve("overwrite.csv");
        Files.writeString(csv, "name,address\nOld,Row\n", StandardCharsets.UTF_8);

        try (PlaceCsvWriter writer = PlaceCsvWriter.open(csv, false, 20)) {
            writer.write(place("New", "Row"));
        }

        assertThat(reader.countRows(csv)).isEqualTo(1);
        assertThat(reader.preview(csv, 1).getRows().get(0)).containsEntry("name", "New");
    }

    @Test
    void closeIsIdempotentAndRejectsLaterWrites() {
        PlaceCsvWriter writer = PlaceCsvWriter.open(tempDir.resolve("closed.csv"), false, 20);
        writer.close();
        writer.close();

        assertThatThrownBy(() -> writer.write(place("A", "1")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failedFlushPoisonsEveryLaterWriteAndFlush() throws Exception {
        StringWriter sink = new StringWriter();
        BreakableWriter out = new BreakableWriter(sink);
        PlaceCsvWriter writer = PlaceCsvWriter.over(tempDir.resolve("disk.csv"), out, false, 2);

        writer.write(place("A", "1"));
        out.broken = true;
        assertThatThrownBy(() -> writer.write(place("B", "2")))
                .isInstanceOf(OutputWriteException.class)
                .hasMessageContaining("disk full");
        assertThat(writer.isFailed()).isTrue();

        out.broken = false;
        assertThatThrownBy(() -> writer.write(place("C", "3")))
                .isInstanceOf(OutputWriteException.class)
                .hasMessageContaining("failed earlier");
        assertThatThrownBy(writer::flush).isInstanceOf(OutputWriteException.class);

        writer.close();
        assertThat(writer.getRowsWritten()).isZero();
        assertThat(sink.toString()).doesNotContain("\"C\"");
    }

    @Test
    void unopenableFileIsAnOutputWriteException() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> PlaceCsvWriter.open(blocker.resolve("out.csv"), false, 20))
                .isInstanceOf(OutputWriteException.class);
    }

    private static PlaceRecord place(String name, String address) {
        return PlaceRecord.builder().name(name).address(address).build();
    }

    /** Fails every write and flush while {@code broken} is set. */
    private static class BreakableWriter extends FilterWriter {

        volatile boolean broken;

        BreakableWriter(StringWriter sink) {
            super(sink);
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            check();
            super.write(cbuf, off, len);
        }

        @Override
        public void write(String str, int off, int len) throws IOException {
            check();
            super.write(str, off, len);
        }

        @Override
        public void write(int c) throws IOException {
            check();
            super.write(c);
        }

        @Override
        public void flush() throws IOException {
            check();
            super.flush();
        }

        private void check() throws IOException {
            if (broken) {
                throw new IOException("disk full");
            }
        }
    }
}
