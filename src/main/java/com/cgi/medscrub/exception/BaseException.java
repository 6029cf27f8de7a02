package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Base exception class for all exceptions in the application.
 * Carries an error code that the REST layer reports back to the caller.
 */
public abstract class BaseException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String errorCode;

    /**
     * Creates a new BaseException with the specified message and error code.
     *
     * @param message Exception message
     * @param errorCode Error code
     */
    protected BaseException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    /**
     * Creates a new BaseException with the specified message, cause, and error code.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     * @param errorCode Error code
     */
    protected BaseException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
