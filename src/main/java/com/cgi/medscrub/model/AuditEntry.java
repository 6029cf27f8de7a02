package com.cgi.medscrub.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Record of one detector invocation.
 */
@Value
@Builder
public class AuditEntry {
    String detectorName;
    String patternOrLabel;
    long elapsedMs;

    @Singular
    List<RedactionRecord> replacements;

    /**
     * Number of matches of this invocation. Always equal to the number of recorded replacements.
     */
    public int getMatchCount() {
        return replacements.size();
    }
}
