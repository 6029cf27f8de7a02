package com.cgi.medscrub.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Canonical detection per entity text, plus the non-overlapping spans that will be replaced.
 */
@Value
public class MergeOutcome {
    Map<String, Detection> canonical;
    List<Detection> spans;

    public static MergeOutcome empty() {
        return new MergeOutcome(Map.of(), List.of());
    }
}
