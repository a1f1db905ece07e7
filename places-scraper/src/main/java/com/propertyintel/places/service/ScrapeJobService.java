package com.propertyintel.places.service;

import com.propertyintel.places.config.ScraperProperties;
import com.propertyintel.places.dedupe.DedupeGate;
import com.propertyintel.places.dedupe.FingerprintCache;
import com.propertyintel.places.dedupe.RecordFingerprinter;
import com.propertyintel.places.model.AreaRun;
import com.propertyintel.places.model.AreaRunState;
import com.propertyintel.places.model.ArtifactPreview;
import com.propertyintel.places.model.FailurePolicy;
import com.propertyintel.places.model.JobSnapshot;
import com.propertyintel.places.model.JobStatus;
import com.propertyintel.places.model.PlaceRecord;
import com.propertyintel.places.model.ProgressEvent;
import com.propertyintel.places.model.ScrapeJobRequest;
import com.propertyintel.places.output.ArtifactReader;
import com.propertyintel.places.output.OutputWriteException;
import com.propertyintel.places.output.PlaceCsvWriter;
import com.propertyintel.places.output.RunHistoryRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Owns every submitted job and is the only entry point for callers.
 *
 * A submission gets its own fingerprint cache, one CSV writer and one runner per area.
 * Runners execute on a per-job pool of {@code concurrency} threads; once they are all
 * terminal the writer is closed exactly once and the job's status is fixed.
 *
 * Jobs stay in the registry until {@link #evictExpiredJobs()} removes finished ones
 * older than the configured retention. Running jobs are never evicted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScrapeJobService {

    private static final String CANCELLED = "cancelled by request";
    private static final String WRITER_ABORT = "aborted: output writer failure";

    private final ScraperProperties properties;
    private final PlaceSource placeSource;
    private final ProgressEventChannel events;
    private final ArtifactReader artifactReader;
    private final RunHistoryRecorder historyRecorder;
    private final Clock clock;

    private final Map<String, ScrapeJob> jobs = new ConcurrentHashMap<>();
    private final Deque<Instant> recentSubmissions = new ArrayDeque<>();
    private final Object submissionLock = new Object();

    // ── Submission ───────────────────────────────────────────────────────────

    /**
     * Validates the request, registers the job and starts its areas.
     *
     * @throws InvalidJobRequestException  on a malformed request; nothing is created
     * @throws RateLimitExceededException  when too many jobs were started recently or are running
     * @throws OutputWriteException        when the output file cannot be read (append) or opened
     */
    public JobHandle submit(ScrapeJobRequest request) {
        List<String> areas = validate(request);
        int concurrency = resolveConcurrency(request.getConcurrency(), areas.size());
        FailurePolicy policy = request.getFailurePolicy() != null
                ? request.getFailurePolicy()
                : properties.getJobs().getFailurePolicy();
        String outputFile = normaliseFileName(request.getOutputFile());
        Path outputPath = resolveOutputPath(outputFile);
        String businessType = request.getBusinessType().trim();
        boolean fastAppend = request.isFastAppend();
        boolean appendMode = request.isAppendMode() || fastAppend;

        ScrapeJob job;
        synchronized (submissionLock) {
            enforceRateLimit();
            ensureOutputNotInUse(outputPath);
            if (!appendMode) {
                ensureNoExistingData(outputPath);
            }

            FingerprintCache cache = new FingerprintCache(properties.getDedupe().getCacheCapacity());
            DedupeGate gate = new DedupeGate(cache, new RecordFingerprinter(
                    properties.getDedupe().getSampleMinChars(),
                    properties.getDedupe().getSampleMaxChars()));

            int seeded = 0;
            if (fastAppend) {
                log.info("Fast append to {}: existing rows are not checked for duplicates", outputPath);
            } else if (appendMode) {
                seeded = gate.seedFromArtifact(outputPath);
                log.info("Appending to {} ({} existing rows)", outputPath, seeded);
            }
            PlaceCsvWriter writer = openWriter(outputPath, appendMode);

            job = new ScrapeJob(UUID.randomUUID().toString(), businessType, areas,
                    request.getResultsPerArea(), appendMode, fastAppend, policy, outputPath, outputFile,
                    gate, writer, seeded, clock,
                    properties.getJobs().getRecentRecords(), properties.getJobs().getMetricsWindow());

            jobs.put(job.getJobId(), job);
            recentSubmissions.addLast(clock.instant());
        }

        log.info("Job {} submitted: '{}' across {} areas, {} per area → {} ({}, {} workers, {} seeded)",
                job.getJobId(), businessType, areas.size(), job.getResultsPerArea(), outputPath,
                fastAppend ? "fast append" : appendMode ? "append" : "fresh", concurrency, job.getSeededCount());

        events.publish(ProgressEvent.forJob(job.snapshot(), clock.instant()));
        start(job, concurrency);
        return new JobHandle(job.getJobId(), job.getCompletion());
    }

    private void start(ScrapeJob job, int concurrency) {
        ExecutorService executor = Executors.newFixedThreadPool(concurrency,
                new CustomizableThreadFactory("area-" + job.getJobId().substring(0, 8) + "-"));

        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (AreaRun areaRun : job.areaRuns()) {
            AreaJobRunner runner = AreaJobRunner.builder()
                    .jobId(job.getJobId())
                    .areaRun(areaRun)
                    .searchQuery(buildSearchQuery(job.getBusinessType(), areaRun.getArea()))
                    .resultsPerArea(job.getResultsPerArea())
                    .source(placeSource)
                    .gate(job.getGate())
                    .writer(job.getWriter())
                    .events(events)
                    .cancellation(job.getCancellation())
                    .clock(clock)
                    .progressEvery(properties.getJobs().getProgressEvery())
                    .onAccepted(job::onAccepted)
                    .build();

            futures.add(CompletableFuture.runAsync(runner, executor)
                    .whenComplete((ignored, error) -> {
                        if (error != null) {
                            abort(job, unwrap(error));
                        }
                    }));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> {
                    try {
                        finish(job);
                    } finally {
                        executor.shutdown();
                    }
                });
    }

    /**
     * A runner escaped with an exception: the writer broke (or something unexpected happened).
     * Everything still pending or running in this job is failed.
     */
    private void abort(ScrapeJob job, Throwable cause) {
        if (cause instanceof OutputWriteException) {
            log.error("Job {}: output writer failed, aborting remaining areas", job.getJobId(), cause);
            job.recordWriterFailure(cause.getMessage());
            failPending(job, job.cancel(WRITER_ABORT));
        } else {
            log.error("Job {}: area runner crashed: {}", job.getJobId(), cause.getMessage(), cause);
        }
    }

    private void finish(ScrapeJob job) {
        try {
            job.getWriter().close();
        } catch (OutputWriteException e) {
            log.error("Job {}: failed to close {}", job.getJobId(), job.getOutputPath(), e);
            job.recordWriterFailure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Job {}: unexpected error closing {}", job.getJobId(), job.getOutputPath(), e);
            job.recordWriterFailure(e.getMessage());
        }

        if (!job.finalise()) return;

        JobSnapshot snapshot = job.snapshot();
        log.info("Job {} {}: {} accepted, {} duplicates, {} rows written, {}/{} areas failed",
                job.getJobId(), snapshot.getStatus(), snapshot.getAcceptedCount(), snapshot.getDuplicateCount(),
                snapshot.getRowsWritten(),
                snapshot.getAreas().stream().filter(a -> a.getState() == AreaRunState.FAILED).count(),
                snapshot.getTotalAreas());

        events.publish(ProgressEvent.forJob(snapshot, clock.instant()));
        historyRecorder.record(snapshot);
        job.getCompletion().complete(snapshot);
    }

    // ── Queries and control ──────────────────────────────────────────────────

    public JobSnapshot status(String jobId) {
        return find(jobId).snapshot();
    }

    /** Newest first. */
    public List<JobSnapshot> list() {
        return jobs.values().stream()
                .map(ScrapeJob::snapshot)
                .sorted(Comparator.comparing(JobSnapshot::getStartedAt).reversed())
                .toList();
    }

    /**
     * Cooperative: areas not yet started fail immediately, running areas stop before
     * their next record. A finished job is returned unchanged.
     */
    public JobSnapshot cancel(String jobId) {
        ScrapeJob job = find(jobId);
        if (!job.isFinished()) {
            log.info("Job {}: cancellation requested", jobId);
            failPending(job, job.cancel(CANCELLED));
        }
        return job.snapshot();
    }

    /**
     * Live ring of recently accepted records while running; a bounded prefix of the
     * file once finished (or when nothing has been accepted yet in this run).
     */
    public ArtifactPreview preview(String jobId, Integer limit) {
        ScrapeJob job = find(jobId);
        int rows = clampPreview(limit);

        if (!job.isFinished()) {
            List<PlaceRecord> recent = job.recentRecords(rows);
            if (!recent.isEmpty()) {
                return toPreview(recent);
            }
        }
        if (!Files.exists(job.getOutputPath())) {
            return new ArtifactPreview(List.of(PlaceCsvWriter.HEADERS), List.of(), "file");
        }
        return artifactReader.preview(job.getOutputPath(), rows);
    }

    /**
     * @throws JobNotReadyException unless the job finished COMPLETED
     */
    public Path artifact(String jobId) {
        ScrapeJob job = find(jobId);
        JobSnapshot snapshot = job.snapshot();
        if (snapshot.getStatus() != JobStatus.COMPLETED) {
            throw new JobNotReadyException("Job " + jobId + " is " + snapshot.getStatus() + ", file not ready for download");
        }
        if (!Files.exists(job.getOutputPath())) {
            throw new JobNotFoundException(jobId + " (output file missing)");
        }
        return job.getOutputPath();
    }

    /**
     * Drops finished jobs whose end is older than the retention period.
     *
     * @return number of jobs removed
     */
    public int evictExpiredJobs() {
        Instant cutoff = clock.instant().minus(properties.getJobs().getRetention());
        List<String> expired = jobs.values().stream()
                .filter(ScrapeJob::isFinished)
                .filter(job -> job.getFinishedAt() != null && job.getFinishedAt().isBefore(cutoff))
                .map(ScrapeJob::getJobId)
                .toList();
        expired.forEach(jobs::remove);
        if (!expired.isEmpty()) {
            log.info("Evicted {} finished jobs from the registry", expired.size());
        }
        return expired.size();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ScrapeJob find(String jobId) {
        ScrapeJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void failPending(ScrapeJob job, List<AreaRun> failedNow) {
        for (AreaRun run : failedNow) {
            events.publish(ProgressEvent.forArea(ProgressEvent.Type.AREA_STATE, job.getJobId(),
                    run.snapshot(), clock.instant()));
        }
    }

    private List<String> validate(ScrapeJobRequest request) {
        if (request == null) {
            throw new InvalidJobRequestException("Request body is required");
        }
        if (request.getBusinessType() == null || request.getBusinessType().isBlank()) {
            throw new InvalidJobRequestException("Business type is required");
        }
        if (request.getResultsPerArea() == null || request.getResultsPerArea() < 1) {
            throw new InvalidJobRequestException("Results per area must be at least 1");
        }
        if (request.getAreas() == null || request.getAreas().isEmpty()) {
            throw new InvalidJobRequestException("Select at least one area");
        }
        Set<String> areas = new LinkedHashSet<>();
        for (String area : request.getAreas()) {
            if (area == null || area.isBlank()) {
                throw new InvalidJobRequestException("Area names must not be blank");
            }
            areas.add(area.trim());
        }
        if (request.getOutputFile() == null || request.getOutputFile().isBlank()) {
            throw new InvalidJobRequestException("Output file name is required");
        }
        return List.copyOf(areas);
    }

    private int resolveConcurrency(Integer requested, int areaCount) {
        int max = properties.getJobs().getMaxConcurrency();
        if (requested != null && (requested < 1 || requested > max)) {
            throw new InvalidJobRequestException("Concurrency must be between 1 and " + max);
        }
        int workers = requested != null ? requested : properties.getJobs().getDefaultConcurrency();
        return Math.max(1, Math.min(workers, areaCount));
    }

    private String normaliseFileName(String outputFile) {
        String name = outputFile.trim();
        return name.toLowerCase(Locale.ROOT).endsWith(".csv") ? name : name + ".csv";
    }

    private Path resolveOutputPath(String outputFile) {
        Path dir = Paths.get(properties.getOutput().getOutputDir()).toAbsolutePath().normalize();
        Path path = dir.resolve(outputFile).normalize();
        if (!path.startsWith(dir) || path.equals(dir)) {
            throw new InvalidJobRequestException("Output file must stay inside the output directory");
        }
        return path;
    }

    /**
     * Must hold submissionLock.
     */
    private void enforceRateLimit() {
        Instant cutoff = clock.instant().minus(properties.getJobs().getRateLimitWindow());
        while (!recentSubmissions.isEmpty() && recentSubmissions.peekFirst().isBefore(cutoff)) {
            recentSubmissions.removeFirst();
        }
        if (recentSubmissions.size() >= properties.getJobs().getRateLimit()) {
            throw new RateLimitExceededException("Too many scraping jobs started recently");
        }
        long running = jobs.values().stream().filter(job -> !job.isFinished()).count();
        if (running >= properties.getJobs().getMaxConcurrentJobs()) {
            throw new RateLimitExceededException("Maximum concurrent scraping jobs in progress");
        }
    }

    /**
     * Must hold submissionLock. Two live writers on one file would interleave batches.
     */
    private void ensureOutputNotInUse(Path outputPath) {
        jobs.values().stream()
                .filter(job -> !job.isFinished() && job.getOutputPath().equals(outputPath))
                .findFirst()
                .ifPresent(job -> {
                    throw new InvalidJobRequestException("Output file " + outputPath.getFileName()
                            + " is already being written by job " + job.getJobId());
                });
    }

    /**
     * Must hold submissionLock. A fresh run never replaces rows a previous run wrote.
     */
    private void ensureNoExistingData(Path outputPath) {
        try {
            if (Files.exists(outputPath) && Files.size(outputPath) > 0) {
                throw new InvalidJobRequestException("Output file " + outputPath.getFileName()
                        + " already contains data. Use append mode or choose a different file name");
            }
        } catch (IOException e) {
            throw new OutputWriteException("Cannot inspect output file " + outputPath + ": " + e.getMessage(), e);
        }
    }

    PlaceCsvWriter openWriter(Path outputPath, boolean appendMode) {
        return PlaceCsvWriter.open(outputPath, appendMode, properties.getOutput().getFlushBatchSize());
    }

    String buildSearchQuery(String businessType, String area) {
        String suffix = properties.getJobs().getRegionSuffix();
        return (suffix == null || suffix.isBlank())
                ? businessType + " in " + area
                : businessType + " in " + area + ", " + suffix;
    }

    private int clampPreview(Integer limit) {
        int requested = limit != null ? limit : properties.getOutput().getPreviewRows();
        return Math.max(1, Math.min(requested, properties.getOutput().getMaxPreviewRows()));
    }

    private ArtifactPreview toPreview(List<PlaceRecord> records) {
        List<String> columns = List.of(PlaceCsvWriter.HEADERS);
        List<Map<String, String>> rows = new ArrayList<>();
        for (PlaceRecord record : records) {
            String[] values = PlaceCsvWriter.toRow(record);
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                row.put(columns.get(i), values[i]);
            }
            rows.add(row);
        }
        return new ArtifactPreview(columns, rows, "recent");
    }

    private Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
