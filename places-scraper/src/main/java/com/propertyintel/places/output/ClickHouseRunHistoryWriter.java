package com.propertyintel.places.output;

import com.propertyintel.places.model.AreaRunSnapshot;
import com.propertyintel.places.model.JobSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseRunHistoryWriter {

    private static final DateTimeFormatter CLICKHOUSE_DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse run-history schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS places_intel");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS places_intel.area_runs
            (
                job_id              String,
                area                LowCardinality(String),
                business_type       String,
                output_file         String,
                append_mode         UInt8,
                state               LowCardinality(String),
                raw_count           Int32,
                accepted_count      Int32,
                duplicate_count     Int32,
                started_at          Nullable(DateTime),
                completed_at        Nullable(DateTime),
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (job_id, area)
        """);

        log.info("ClickHouse run-history schema ready.");
    }

    /**
     * One row per area of a finished job, as a single INSERT ... VALUES.
     */
    public void writeAreaRuns(JobSnapshot job) {
        if (job.getAreas().isEmpty()) return;

        String rows = job.getAreas().stream()
                .map(area -> toValueRow(job, area))
                .collect(Collectors.joining(",\n"));

        jdbcTemplate.execute("""
            INSERT INTO places_intel.area_runs
            (job_id, area, business_type, output_file, append_mode, state,
             raw_count, accepted_count, duplicate_count, started_at, completed_at, error_message)
            VALUES
            """ + rows);

        log.debug("Recorded {} area runs for job {}", job.getAreas().size(), job.getJobId());
    }

    private String toValueRow(JobSnapshot job, AreaRunSnapshot area) {
        return String.format("(%s,%s,%s,%s,%d,%s,%d,%d,%d,%s,%s,%s)",
                sqlStr(job.getJobId()),
                sqlStr(area.getArea()),
                sqlStr(job.getBusinessType()),
                sqlStr(job.getOutputFile()),
                job.isAppendMode() ? 1 : 0,
                sqlStr(area.getState().name()),
                area.getRawCount(),
                area.getAcceptedCount(),
                area.getDuplicateCount(),
                sqlTime(area.getStartedAt()),
                sqlTime(area.getCompletedAt()),
                sqlStr(area.getErrorMessage())
        );
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlTime(Instant val) {
        return val == null ? "NULL" : "'" + CLICKHOUSE_DATETIME.format(val) + "'";
    }
}
