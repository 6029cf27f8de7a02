package com.cgi.medscrub.exception;

import java.io.Serial;

/**
 * Exception for failures while exporting a scrub report.
 */
public class ReportExportException extends BaseException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ReportExportException(String message, Throwable cause) {
        super(message, cause, "EXPORT_ERROR");
    }
}
