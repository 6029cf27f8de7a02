package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

/**
 * A single piece of PII evidence: a span of the input text, its category and how it was found.
 */
@Value
public class Detection {
    String entityText;
    EntityType entityType;
    int startOffset;
    int endOffset;
    double confidence;
    DetectionMethod method;

    /**
     * Pattern or label that produced this detection.
     */
    String source;

    @Builder(toBuilder = true)
    private Detection(String entityText, EntityType entityType, int startOffset, int endOffset,
                      double confidence, DetectionMethod method, String source) {
        if (entityText == null || entityText.isEmpty()) {
            throw new IllegalArgumentException("Detection text must not be empty");
        }
        if (startOffset < 0 || startOffset >= endOffset) {
            throw new IllegalArgumentException("Invalid detection span [" + startOffset + ", " + endOffset + ")");
        }
        if (endOffset - startOffset != entityText.length()) {
            throw new IllegalArgumentException("Detection span length does not match its text");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (entityType == null || method == null) {
            throw new IllegalArgumentException("Detection type and method are required");
        }
        this.entityText = entityText;
        this.entityType = entityType;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.confidence = confidence;
        this.method = method;
        this.source = source;
    }

    @JsonIgnore
    public int length() {
        return endOffset - startOffset;
    }

    public boolean overlaps(Detection other) {
        return startOffset < other.endOffset && other.startOffset < endOffset;
    }

    /**
     * Moves this detection by a fixed offset, used to map chunk-relative spans back to the document.
     *
     * @param delta Number of characters to shift by
     * @return Shifted copy
     */
    public Detection shift(int delta) {
        if (delta == 0) {
            return this;
        }
        return toBuilder()
                .startOffset(startOffset + delta)
                .endOffset(endOffset + delta)
                .build();
    }
}
