package com.cgi.medscrub.model;

import lombok.Value;

/**
 * One original value and the placeholder it maps to, as recorded in the audit trail.
 * {@code applied} is false when the span lost an overlap contest and was left to another detection.
 */
@Value
public class RedactionRecord {
    String original;
    String placeholder;
    int startOffset;
    boolean applied;
}
