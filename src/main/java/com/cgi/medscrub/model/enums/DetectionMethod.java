package com.cgi.medscrub.model.enums;

/**
 * How a detection was produced.
 * Declaration order is merge precedence: a later method overrides an earlier one.
 */
public enum DetectionMethod {
    REGEX,
    CONTEXT,
    STATISTICAL;

    /**
     * Whether this method takes precedence over another one during merging.
     *
     * @param other Method to compare with
     * @return true if this method wins
     */
    public boolean outranks(DetectionMethod other) {
        return other == null || ordinal() > other.ordinal();
    }
}
