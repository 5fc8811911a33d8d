package com.fanfic.ingest.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Fanfic Ingest Service Application - Entry point for the Spring Boot application.
 *
 * Watches a drop folder for *.url files and fans the URLs they contain out to
 * per-site processing queues:
 * - Extracts one URL per file and removes the consumed file
 * - Classifies each URL by its originating fanfiction site
 * - Routes it to that site's queue, or to the notifier when the site is diverted
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.fanfic.ingest.service.config")
public class FanficIngestServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FanficIngestServiceApplication.class, args);
    }
}
