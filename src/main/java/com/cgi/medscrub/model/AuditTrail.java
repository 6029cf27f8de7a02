package com.cgi.medscrub.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Replayable record of every detector invocation of one scrub, plus its aggregate summary.
 */
@Value
@Builder
public class AuditTrail {
    @Singular
    List<AuditEntry> entries;

    AuditSummary summary;
}
