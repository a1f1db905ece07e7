package com.propertyintel.places.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, ScraperProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Drains SSE subscriptions so that area runners never write to an HTTP connection themselves.
     */
    @Bean(name = "eventStreamExecutor", destroyMethod = "shutdownNow")
    public ExecutorService eventStreamExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("event-stream-"));
    }
}
