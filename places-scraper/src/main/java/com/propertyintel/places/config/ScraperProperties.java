package com.propertyintel.places.config;

import com.propertyintel.places.model.FailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "places-scraper")
@Data
public class ScraperProperties {

    private Output output = new Output();
    private Dedupe dedupe = new Dedupe();
    private Jobs jobs = new Jobs();
    private Events events = new Events();
    private Api api = new Api();
    private History history = new History();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Output {
        private String outputDir = "./data/output";
        private int flushBatchSize = 20;
        private int previewRows = 10;
        private int maxPreviewRows = 200;
    }

    /**
     * Fingerprint cache sizing and the character window sampled from name + address.
     */
    @Data
    public static class Dedupe {
        private int cacheCapacity = 50_000;
        private int sampleMinChars = 1024;
        private int sampleMaxChars = 8192;
    }

    @Data
    public static class Jobs {
        private int defaultConcurrency = 2;
        private int maxConcurrency = 8;
        private int maxConcurrentJobs = 2;
        private int rateLimit = 5;
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private Duration retention = Duration.ofMinutes(15);
        private FailurePolicy failurePolicy = FailurePolicy.PARTIAL_SUCCESS;
        private int progressEvery = 1;
        private int recentRecords = 25;
        private Duration metricsWindow = Duration.ofSeconds(180);
        private String regionSuffix = "Chennai, Tamil Nadu, India";
    }

    @Data
    public static class Events {
        private int subscriberQueueCapacity = 256;
        private Duration streamTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Api {
        private String baseUrl = "http://localhost:8090";
        private int pageSize = 20;
        private long rateLimitDelayMs = 500;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class History {
        private boolean enabled = false;
    }

    @Data
    public static class Scheduling {
        private long cleanupIntervalMs = 60_000;
    }
}
