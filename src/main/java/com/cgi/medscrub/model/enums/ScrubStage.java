package com.cgi.medscrub.model.enums;

/**
 * States of the scrub pipeline.
 */
public enum ScrubStage {
    VALIDATING,
    STRUCTURAL_PASS,
    CONTEXT_PASS,
    CHUNKING,
    STATISTICAL_PASS,
    MERGING,
    REPLACING,
    AUDITING,
    DONE,
    FAILED
}
