package com.cgi.medscrub.config;

import com.cgi.medscrub.model.ScrubConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Configuration properties for the scrub engine.
 * Maps to properties with the prefix "medscrub" in the application properties.
 */
@Component
@ConfigurationProperties(prefix = "medscrub")
@Getter
@Setter
public class ScrubberProperties {
    private int maxInputSize = ScrubConfig.DEFAULT_MAX_INPUT_SIZE;
    private int chunkSize = ScrubConfig.DEFAULT_CHUNK_SIZE;
    private long statisticalTimeoutMs = ScrubConfig.DEFAULT_STATISTICAL_TIMEOUT_MS;
    private double confidenceThreshold = ScrubConfig.DEFAULT_CONFIDENCE_THRESHOLD;
    private double warningThreshold = ScrubConfig.DEFAULT_WARNING_THRESHOLD;
    private boolean enableStatisticalDetector = true;
    private boolean enableContextDetector = true;

    /**
     * Number of chunks sent to the named-entity model at the same time.
     */
    private int statisticalConcurrency = 4;

    /**
     * Number of documents scrubbed at the same time by asynchronous requests.
     */
    private int workerThreads = 2;

    /**
     * Locale used for sentence segmentation when chunking.
     */
    private Locale sentenceLocale = Locale.US;

    private Ner ner = new Ner();

    /**
     * Builds the default per-invocation configuration. The session salt is left empty.
     *
     * @return Scrub configuration
     */
    public ScrubConfig toScrubConfig() {
        return ScrubConfig.builder()
                .maxInputSize(maxInputSize)
                .chunkSize(chunkSize)
                .statisticalTimeoutMs(statisticalTimeoutMs)
                .confidenceThreshold(confidenceThreshold)
                .warningThreshold(warningThreshold)
                .enableStatisticalDetector(enableStatisticalDetector)
                .enableContextDetector(enableContextDetector)
                .build();
    }

    @Getter
    @Setter
    public static class Ner {
        /**
         * URL of the entity-recognition endpoint. The statistical pass reports the model as unavailable when unset.
         */
        private String serviceUrl;

        private String healthPath = "/health";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;
        private String modelName = "remote-ner";
    }
}
