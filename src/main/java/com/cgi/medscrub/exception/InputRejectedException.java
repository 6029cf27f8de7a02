package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Input that never enters the scrub pipeline.
 */
public abstract class InputRejectedException extends BaseException {
    @Serial
    private static final long serialVersionUID = 1L;

    protected InputRejectedException(String message, String errorCode) {
        super(message, errorCode);
    }
}
