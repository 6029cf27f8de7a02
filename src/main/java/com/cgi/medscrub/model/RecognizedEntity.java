package com.cgi.medscrub.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity returned by a named-entity-recognition model.
 * Offsets are relative to the text that was sent to the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecognizedEntity {
    @JsonAlias({"entity_group", "entity", "type"})
    private String label;

    @JsonAlias("word")
    private String text;

    private int start;
    private int end;
    private double score;
}
