package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Failure of the named-entity-recognition model.
 * Never leaves the statistical detector: it is turned into a warning and the chunk degrades to no detections.
 */
public class StatisticalModelException extends BaseException {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new StatisticalModelException with the specified message.
     *
     * @param message Exception message
     */
    public StatisticalModelException(String message) {
        super(message, "STATISTICAL_MODEL_ERROR");
    }

    /**
     * Creates a new StatisticalModelException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public StatisticalModelException(String message, Throwable cause) {
        super(message, cause, "STATISTICAL_MODEL_ERROR");
    }
}
