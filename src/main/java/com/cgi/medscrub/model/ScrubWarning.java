package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.ScrubStage;
import com.cgi.medscrub.model.enums.WarningType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A recoverable problem that did not stop the scrub.
 * The optional fields are only filled for the warning types that need them.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScrubWarning {
    WarningType type;
    ScrubStage stage;
    String message;
    String suggestion;

    @Builder.Default
    boolean recoverable = true;

    // Statistical model details
    String modelName;
    Boolean fallbackUsed;

    // Low-confidence details
    String entity;
    Double score;
    String context;
}
