package com.cgi.medscrub.model.enums;

/**
 * Categories of recoverable problems reported alongside a scrub result.
 */
public enum WarningType {
    STATISTICAL_MODEL_ERROR,
    LOW_CONFIDENCE,
    STAGE_FAILURE,
    OUTPUT_INVARIANT_VIOLATION,
    RESIDUAL_RISK
}
