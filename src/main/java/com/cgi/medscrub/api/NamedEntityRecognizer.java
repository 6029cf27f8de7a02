package com.cgi.medscrub.api;

import com.cgi.medscrub.exception.StatisticalModelException;
import com.cgi.medscrub.model.RecognizedEntity;

import java.util.List;

/**
 * Boundary to an external named-entity-recognition model.
 * The engine treats it as opaque: it may be slow, unavailable or return spans that do not fit the text.
 */
public interface NamedEntityRecognizer {
    /**
     * Name of the model, reported in warnings.
     *
     * @return Model name
     */
    String getModelName();

    /**
     * Labels entities in a text.
     *
     * @param text Text to analyze
     * @return Entities with offsets relative to {@code text}
     * @throws StatisticalModelException if the model cannot be queried
     */
    List<RecognizedEntity> infer(String text);

    /**
     * Checks if the model can currently be reached.
     *
     * @return true if the model is available
     */
    default boolean isAvailable() {
        return true;
    }
}
