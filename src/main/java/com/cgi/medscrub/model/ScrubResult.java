package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.ScrubStage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a scrub: the de-identified text and everything needed to audit it.
 */
@Value
@Builder(toBuilder = true)
public class ScrubResult {
    String text;

    /**
     * Original value to placeholder, in order of first appearance.
     */
    @Singular
    Map<String, String> replacements;

    int count;
    double confidence;

    @Singular
    List<Detection> detections;

    @Singular
    List<ScrubWarning> warnings;

    AuditTrail auditTrail;
    ScrubStage finalStage;
}
