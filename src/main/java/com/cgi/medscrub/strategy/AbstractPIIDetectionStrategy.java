/*
 * AbstractPIIDetectionStrategy.java - Abstract strategy for PII detection
 */
package com.cgi.medscrub.strategy;

import com.cgi.medscrub.api.PIIDetectionStrategy;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.enums.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.BitSet;

/**
 * Base strategy for PII detection.
 * Provides common functionality for all strategies.
 */
public abstract class AbstractPIIDetectionStrategy implements PIIDetectionStrategy {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /**
     * Creates a detection stamped with this strategy's method.
     *
     * @param text Document text the offsets refer to
     * @param start Start offset (inclusive)
     * @param end End offset (exclusive)
     * @param type Entity type
     * @param confidence Confidence level
     * @param source Pattern or label that matched
     * @return Detection object
     */
    protected Detection createDetection(String text, int start, int end, EntityType type,
                                        double confidence, String source) {
        return Detection.builder()
                .entityText(text.substring(start, end))
                .entityType(type)
                .startOffset(start)
                .endOffset(end)
                .confidence(confidence)
                .method(getMethod())
                .source(source)
                .build();
    }

    /**
     * Checks if a span touches a placeholder left by an earlier scrub of the same text.
     *
     * @param placeholders Positions covered by existing placeholders
     * @param start Start offset (inclusive)
     * @param end End offset (exclusive)
     * @return true if the span must be skipped
     */
    protected boolean touchesPlaceholder(BitSet placeholders, int start, int end) {
        return PlaceholderToken.intersects(placeholders, start, end);
    }

    protected static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
