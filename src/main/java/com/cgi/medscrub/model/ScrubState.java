package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.EntityType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Immutable snapshot of a scrub in progress.
 * Stages derive a new snapshot instead of changing an existing one.
 */
@Value
@Builder(toBuilder = true)
public class ScrubState {
    String currentText;

    @Singular
    Map<String, PlaceholderToken> replacements;

    @Singular
    Map<EntityType, Integer> perTypeCounts;

    public static ScrubState initial(String text) {
        return ScrubState.builder().currentText(text).build();
    }
}
