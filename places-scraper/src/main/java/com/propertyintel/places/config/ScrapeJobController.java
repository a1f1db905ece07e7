package com.propertyintel.places.config;

import com.propertyintel.places.model.ArtifactPreview;
import com.propertyintel.places.model.JobSnapshot;
import com.propertyintel.places.model.ScrapeJobRequest;
import com.propertyintel.places.output.OutputWriteException;
import com.propertyintel.places.service.JobEventStreamer;
import com.propertyintel.places.service.JobHandle;
import com.propertyintel.places.service.JobNotFoundException;
import com.propertyintel.places.service.JobNotReadyException;
import com.propertyintel.places.service.RateLimitExceededException;
import com.propertyintel.places.service.ScrapeJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/jobs")
@Slf4j
@RequiredArgsConstructor
public class ScrapeJobController {

    private final ScrapeJobService jobService;
    private final JobEventStreamer eventStreamer;

    // ── Submission / control ─────────────────────────────────────────────────

    /**
     * Start a job.
     *
     * POST /api/jobs
     * {"businessType":"coffee shops","resultsPerArea":20,"areas":["Adyar","Velachery"],
     *  "outputFile":"chennai-results.csv","appendMode":false,"concurrency":2}
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody ScrapeJobRequest request) {
        try {
            JobHandle handle = jobService.submit(request);
            return ResponseEntity.accepted().body(Map.of("jobId", handle.getJobId(), "status", "RUNNING"));
        } catch (IllegalArgumentException e) {
            log.warn("Rejected job submission: {}", e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (RateLimitExceededException e) {
            log.warn("Rate-limited job submission: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(Map.of("error", e.getMessage()));
        } catch (OutputWriteException e) {
            log.error("Could not open output for submission: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        try {
            return ResponseEntity.accepted().body(jobService.cancel(jobId));
        } catch (JobNotFoundException e) {
            return notFound(e);
        }
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @GetMapping
    public List<JobSnapshot> list() {
        return jobService.list();
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> status(@PathVariable String jobId) {
        try {
            return ResponseEntity.ok(jobService.status(jobId));
        } catch (JobNotFoundException e) {
            return notFound(e);
        }
    }

    /**
     * Live progress as Server-Sent Events. Ends after the job's final JOB_STATE event.
     */
    @GetMapping(path = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String jobId) {
        try {
            return ResponseEntity.ok(eventStreamer.stream(jobId));
        } catch (JobNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    // ── Output ───────────────────────────────────────────────────────────────

    /**
     * GET /api/jobs/{jobId}/preview?limit=10
     */
    @GetMapping("/{jobId}/preview")
    public ResponseEntity<?> preview(@PathVariable String jobId,
                                     @RequestParam(required = false) Integer limit) {
        try {
            ArtifactPreview preview = jobService.preview(jobId, limit);
            return ResponseEntity.ok(preview);
        } catch (JobNotFoundException e) {
            return notFound(e);
        } catch (Exception e) {
            log.error("Preview failed for job {}: {}", jobId, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/{jobId}/artifact")
    public ResponseEntity<?> download(@PathVariable String jobId) {
        try {
            Path file = jobService.artifact(jobId);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                            .filename(file.getFileName().toString())
                            .build()
                            .toString())
                    .contentType(MediaType.parseMediaType("text/csv"))
                    .body(new FileSystemResource(file));
        } catch (JobNotFoundException e) {
            return notFound(e);
        } catch (JobNotReadyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
    }

    private ResponseEntity<Map<String, String>> notFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }
}
