package com.cgi.medscrub.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Per-invocation settings of a scrub.
 * Built once at the orchestrator entry and never changed afterwards.
 */
@Value
@Builder(toBuilder = true)
public class ScrubConfig {
    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;
    public static final int DEFAULT_CHUNK_SIZE = 2000;
    public static final int MIN_CHUNK_SIZE = 100;
    public static final int MAX_CHUNK_SIZE = 5000;
    public static final long DEFAULT_STATISTICAL_TIMEOUT_MS = 30_000L;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.85;
    public static final double DEFAULT_WARNING_THRESHOLD = 0.5;

    private static final SecureRandom SALT_SOURCE = new SecureRandom();

    @Builder.Default
    int maxInputSize = DEFAULT_MAX_INPUT_SIZE;

    @Builder.Default
    int chunkSize = DEFAULT_CHUNK_SIZE;

    @Builder.Default
    long statisticalTimeoutMs = DEFAULT_STATISTICAL_TIMEOUT_MS;

    /**
     * Statistical entities must score strictly above this value to be redacted.
     */
    @Builder.Default
    double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

    /**
     * Statistical entities scoring above this value but not above the threshold are reported for review.
     */
    @Builder.Default
    double warningThreshold = DEFAULT_WARNING_THRESHOLD;

    @ToString.Exclude
    String sessionSalt;

    @Builder.Default
    boolean enableStatisticalDetector = true;

    @Builder.Default
    boolean enableContextDetector = true;

    public static ScrubConfig defaults() {
        return ScrubConfig.builder().build();
    }

    /**
     * Returns a copy carrying a fresh random session salt when none was supplied.
     *
     * @return Configuration with a usable salt
     */
    public ScrubConfig withResolvedSalt() {
        if (sessionSalt != null && !sessionSalt.isBlank()) {
            return this;
        }
        return toBuilder().sessionSalt(randomSalt()).build();
    }

    /**
     * Checks every field against its allowed range.
     *
     * @throws IllegalArgumentException if a field is out of range
     */
    public void validate() {
        if (maxInputSize <= 0) {
            throw new IllegalArgumentException("maxInputSize must be positive");
        }
        if (chunkSize < MIN_CHUNK_SIZE || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException(
                    "chunkSize must be between " + MIN_CHUNK_SIZE + " and " + MAX_CHUNK_SIZE);
        }
        if (statisticalTimeoutMs <= 0) {
            throw new IllegalArgumentException("statisticalTimeoutMs must be positive");
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("Confidence threshold must be between 0.0 and 1.0");
        }
        if (warningThreshold < 0.0 || warningThreshold > confidenceThreshold) {
            throw new IllegalArgumentException("Warning threshold must be between 0.0 and the confidence threshold");
        }
        if (sessionSalt == null || sessionSalt.isBlank()) {
            throw new IllegalArgumentException("Session salt must not be blank");
        }
    }

    private static String randomSalt() {
        byte[] bytes = new byte[16];
        SALT_SOURCE.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
